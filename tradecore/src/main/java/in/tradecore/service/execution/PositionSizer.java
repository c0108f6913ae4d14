package in.tradecore.service.execution;

import in.tradecore.config.RiskConfig;
import in.tradecore.domain.signal.Signal;
import in.tradecore.infrastructure.broker.data.InsufficientDataException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-fractional sizing: quantity = floor(capital × riskPerTrade% / |entry − stop|), at least 1.
 */
public final class PositionSizer {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final RiskConfig config;

    public PositionSizer(RiskConfig config) {
        this.config = config;
    }

    /**
     * @throws InsufficientDataException when entry and stop coincide
     */
    public int size(Signal signal) {
        BigDecimal riskPerUnit = signal.riskPerUnit();
        if (riskPerUnit.signum() == 0) {
            throw new InsufficientDataException(signal.symbol(), "Zero risk distance between entry and stop");
        }
        BigDecimal riskBudget = config.capital()
            .multiply(BigDecimal.valueOf(config.riskPerTradePercent()))
            .divide(HUNDRED, 8, RoundingMode.HALF_UP);
        int qty = riskBudget.divide(riskPerUnit, 0, RoundingMode.FLOOR).intValue();
        return Math.max(1, qty);
    }
}
