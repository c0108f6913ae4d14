package in.tradecore.domain.order;

/**
 * Terminal status reported for a submitted order.
 */
public enum OrderStatus {
    FILLED,
    REJECTED
}
