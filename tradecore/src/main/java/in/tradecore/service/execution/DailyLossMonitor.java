package in.tradecore.service.execution;

import in.tradecore.config.RiskConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Sums realized P&L of closed positions for the trading day. When the day's loss reaches
 * {@code maxDailyLossPercent} of capital, new entries are halted until the next trading
 * day. Exits are never affected.
 */
public final class DailyLossMonitor {
    private static final Logger log = LoggerFactory.getLogger(DailyLossMonitor.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ExecutionGate gate;
    private final Clock clock;
    private final ZoneId zone;
    private final BigDecimal lossLimit;

    private LocalDate day;
    private BigDecimal realized = BigDecimal.ZERO;
    private boolean halted = false;

    public DailyLossMonitor(RiskConfig config, ExecutionGate gate, Clock clock, ZoneId zone) {
        this.gate = gate;
        this.clock = clock;
        this.zone = zone;
        this.lossLimit = config.capital()
            .multiply(BigDecimal.valueOf(config.maxDailyLossPercent()))
            .divide(HUNDRED, MathContext.DECIMAL64);
        this.day = LocalDate.now(clock.withZone(zone));
    }

    /**
     * Add the realized P&L of a closed position.
     */
    public synchronized void recordClosed(String symbol, BigDecimal pnl) {
        rollDay();
        realized = realized.add(pnl);
        if (halted || realized.negate().compareTo(lossLimit) < 0) {
            return;
        }
        halted = true;
        Instant nextDay = day.plusDays(1).atStartOfDay(zone).toInstant();
        log.error("[{}] Daily loss limit reached: realized {} <= -{}", symbol, realized.toPlainString(),
            lossLimit.toPlainString());
        gate.haltUntil(nextDay, "daily loss " + realized.toPlainString() + " reached limit " + lossLimit.toPlainString());
    }

    public synchronized BigDecimal realizedToday() {
        rollDay();
        return realized;
    }

    public BigDecimal getLossLimit() {
        return lossLimit;
    }

    private void rollDay() {
        LocalDate today = LocalDate.now(clock.withZone(zone));
        if (!today.equals(day)) {
            log.info("New trading day {}, resetting realized P&L (was {})", today, realized.toPlainString());
            realized = BigDecimal.ZERO;
            halted = false;
            day = today;
        }
    }
}
