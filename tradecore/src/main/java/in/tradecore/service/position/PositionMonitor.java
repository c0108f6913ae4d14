package in.tradecore.service.position;

import in.tradecore.domain.common.EventType;
import in.tradecore.domain.trade.ExitReason;
import in.tradecore.domain.trade.Position;
import in.tradecore.infrastructure.broker.metrics.EngineMetrics;
import in.tradecore.service.candle.SessionClock;
import in.tradecore.service.core.AuditEventBus;
import in.tradecore.service.retest.RetestWaitQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Fast loop over open positions.
 *
 * Per cycle and position: update the favorable peak, ratchet the stop (breakeven, then trail),
 * then check stop, target and session flatten. Exit orders are handed to
 * {@link ExitOrderExecutor} and never awaited here.
 *
 * The same cycle drives {@link RetestWaitQueue#evaluate} so pending retests see every price.
 */
public final class PositionMonitor {
    private static final Logger log = LoggerFactory.getLogger(PositionMonitor.class);

    private final PositionLedger ledger;
    private final StopRatchet ratchet;
    private final ExitOrderExecutor exits;
    private final RetestWaitQueue retests;
    private final SessionClock sessionClock;
    private final Function<String, Optional<BigDecimal>> priceLookup;
    private final AuditEventBus audit;
    private final EngineMetrics metrics;

    // trading date the session flatten already ran for
    private volatile LocalDate flattenedForDate;

    public PositionMonitor(PositionLedger ledger, StopRatchet ratchet, ExitOrderExecutor exits,
                           RetestWaitQueue retests, SessionClock sessionClock,
                           Function<String, Optional<BigDecimal>> priceLookup,
                           AuditEventBus audit, EngineMetrics metrics) {
        this.ledger = ledger;
        this.ratchet = ratchet;
        this.exits = exits;
        this.retests = retests;
        this.sessionClock = sessionClock;
        this.priceLookup = priceLookup;
        this.audit = audit;
        this.metrics = metrics;
    }

    public void runCycle() {
        Instant now = sessionClock.now();
        boolean flattenWindow = sessionClock.isFlattenWindow(now);

        if (flattenWindow) {
            flattenOnce(now);
        } else {
            retests.evaluate(priceLookup);
        }

        List<Position> positions = ledger.getAll();
        for (Position position : positions) {
            try {
                monitor(position, flattenWindow);
            } catch (RuntimeException e) {
                log.error("[{}] Position monitor failed: {}", position.symbol(), e.getMessage(), e);
            }
        }
        metrics.setOpenPositions(positions.size());
    }

    private void flattenOnce(Instant now) {
        LocalDate today = sessionClock.tradingDate(now);
        if (today.equals(flattenedForDate)) {
            return;
        }
        flattenedForDate = today;
        List<Position> open = ledger.getAll();
        log.warn("Session flatten at {}: closing {} position(s), cancelling {} pending retest(s)",
            sessionClock.format(now), open.size(), retests.size());
        for (String symbol : retests.symbols()) {
            retests.cancel(symbol, "session flatten");
        }
    }

    private void monitor(Position position, boolean flattenWindow) {
        String symbol = position.symbol();
        Optional<BigDecimal> latest = priceLookup.apply(symbol);
        if (latest.isEmpty()) {
            if (flattenWindow) {
                exits.submitExit(position, ExitReason.SESSION_END, position.entryPrice());
            }
            return;
        }
        BigDecimal price = latest.get();

        Position current = ledger.updatePeak(symbol, price).orElse(position);
        Optional<StopRatchet.StopMove> move = ratchet.evaluate(current, price);
        if (move.isPresent()) {
            StopRatchet.StopMove m = move.get();
            Optional<Position> updated = ledger.updateStop(symbol,
                m.newStop(), m.kind() == StopRatchet.StopMove.Kind.BREAKEVEN);
            if (updated.isPresent()) {
                BigDecimal previous = current.stopLoss();
                current = updated.get();
                log.info("[{}] Stop moved {} -> {} ({}, price {}, peak {})", symbol, previous,
                    current.stopLoss(), m.kind(), price, current.peakFavorablePrice());
                metrics.recordStopMove(m.kind().name());
                Map<String, Object> payload = new HashMap<>();
                payload.put("kind", m.kind().name());
                payload.put("previousStop", previous);
                payload.put("newStop", current.stopLoss());
                payload.put("price", price);
                payload.put("peak", current.peakFavorablePrice());
                audit.emit(EventType.STOP_MOVED, symbol, payload);
            }
        }

        ExitReason reason = null;
        if (current.isStopHit(price)) {
            reason = ExitReason.STOP_LOSS;
        } else if (current.isTargetHit(price)) {
            reason = ExitReason.TARGET;
        } else if (flattenWindow) {
            reason = ExitReason.SESSION_END;
        }
        if (reason != null) {
            exits.submitExit(current, reason, price);
        }
    }

    public LocalDate getFlattenedForDate() {
        return flattenedForDate;
    }
}
