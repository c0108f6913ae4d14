package in.tradecore.service.position;

import in.tradecore.config.StopConfig;
import in.tradecore.domain.trade.Position;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Pure stop-ratchet rules.
 *
 * Breakeven: once the favorable excursion reaches {@code breakevenRiskMultiple} × initial risk,
 * the stop moves to entry. Trail: after breakeven the stop follows
 * {@code entry ± trailFraction × (peak − entry)}. Candidates that do not tighten are dropped.
 */
public final class StopRatchet {

    private final StopConfig config;

    public StopRatchet(StopConfig config) {
        this.config = config;
    }

    public record StopMove(BigDecimal newStop, Kind kind) {
        public enum Kind { BREAKEVEN, TRAIL }
    }

    /**
     * @param position Position with its peak already updated for {@code price}
     */
    public Optional<StopMove> evaluate(Position position, BigDecimal price) {
        if (!position.breakevenMoved()) {
            BigDecimal excursion = position.direction().favorableMove(position.entryPrice(), price);
            BigDecimal trigger = position.initialRisk().multiply(BigDecimal.valueOf(config.breakevenRiskMultiple()));
            if (trigger.signum() > 0 && excursion.compareTo(trigger) >= 0) {
                BigDecimal stop = position.entryPrice();
                return position.tightens(stop)
                    ? Optional.of(new StopMove(stop, StopMove.Kind.BREAKEVEN))
                    : Optional.empty();
            }
            return Optional.empty();
        }

        BigDecimal gain = position.direction().favorableMove(position.entryPrice(), position.peakFavorablePrice());
        if (gain.signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal locked = gain.multiply(BigDecimal.valueOf(config.trailFraction()));
        BigDecimal candidate = position.entryPrice()
            .add(locked.multiply(BigDecimal.valueOf(position.direction().sign())))
            .setScale(Math.max(position.entryPrice().scale(), 2), RoundingMode.HALF_UP);
        return position.tightens(candidate)
            ? Optional.of(new StopMove(candidate, StopMove.Kind.TRAIL))
            : Optional.empty();
    }
}
