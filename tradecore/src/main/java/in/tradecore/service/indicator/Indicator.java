package in.tradecore.service.indicator;

public enum Indicator {
    SMA,
    EMA,
    ATR,
    ADX,
    RSI,
    BB_UPPER,
    BB_LOWER,
    /** (upper - lower) / middle */
    BB_WIDTH
}
