package in.tradecore.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Capital, sizing and exposure limits.
 */
public record RiskConfig(
    @JsonProperty("capital")
    BigDecimal capital,

    @JsonProperty("riskPerTradePercent")
    double riskPerTradePercent,

    @JsonProperty("maxOpenPositions")
    int maxOpenPositions,

    @JsonProperty("maxPortfolioRiskPercent")
    double maxPortfolioRiskPercent,

    @JsonProperty("maxOrderToTradeRatio")
    double maxOrderToTradeRatio,        // orders placed per fill before entries are throttled

    @JsonProperty("minOrdersForRatio")
    int minOrdersForRatio,

    @JsonProperty("throttleSeconds")
    int throttleSeconds,

    @JsonProperty("maxDailyLossPercent")
    double maxDailyLossPercent          // realized loss for the day, percent of capital
) {
    public static RiskConfig defaults() {
        return new RiskConfig(new BigDecimal("1000000"), 1.0, 5, 15.0, 20.0, 20, 300, 2.0);
    }

    public boolean isValid() {
        return capital != null && capital.signum() > 0
            && riskPerTradePercent > 0 && riskPerTradePercent <= 100
            && maxOpenPositions > 0
            && maxPortfolioRiskPercent > 0 && maxPortfolioRiskPercent <= 100
            && maxOrderToTradeRatio > 1
            && minOrdersForRatio > 0
            && throttleSeconds > 0
            && maxDailyLossPercent > 0 && maxDailyLossPercent <= 100;
    }
}
