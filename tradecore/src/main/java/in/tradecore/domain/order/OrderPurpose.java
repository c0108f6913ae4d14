package in.tradecore.domain.order;

/**
 * Whether an order opens or closes exposure.
 */
public enum OrderPurpose {
    ENTRY,
    EXIT
}
