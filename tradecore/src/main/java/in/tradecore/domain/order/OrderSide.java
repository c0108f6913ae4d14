package in.tradecore.domain.order;

public enum OrderSide {
    BUY,
    SELL
}
