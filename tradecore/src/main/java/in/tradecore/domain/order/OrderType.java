package in.tradecore.domain.order;

public enum OrderType {
    MARKET,
    LIMIT
}
