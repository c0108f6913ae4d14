package in.tradecore.config;

/**
 * PAPER fills orders locally at the latest price. LIVE routes to a real venue gateway.
 */
public enum TradingMode {
    PAPER,
    LIVE
}
