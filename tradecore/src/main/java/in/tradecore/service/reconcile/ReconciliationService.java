package in.tradecore.service.reconcile;

import in.tradecore.application.monitoring.AlertService;
import in.tradecore.config.ReconciliationConfig;
import in.tradecore.domain.common.EventType;
import in.tradecore.domain.monitoring.ReconciliationReport;
import in.tradecore.domain.trade.ExitReason;
import in.tradecore.domain.trade.Position;
import in.tradecore.domain.trade.VenuePosition;
import in.tradecore.infrastructure.broker.common.ErrorCategory;
import in.tradecore.infrastructure.broker.common.ErrorClassifier;
import in.tradecore.infrastructure.broker.common.ExternalCallExecutor;
import in.tradecore.infrastructure.broker.metrics.EngineMetrics;
import in.tradecore.infrastructure.broker.order.OrderGateway;
import in.tradecore.service.core.AuditEventBus;
import in.tradecore.service.execution.ExecutionGate;
import in.tradecore.service.execution.SlotState;
import in.tradecore.service.execution.SymbolSlotRegistry;
import in.tradecore.service.position.ExitOrderExecutor;
import in.tradecore.service.position.PositionLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Diffs the local ledger against the venue's open positions.
 *
 * - Local position with no venue counterpart ("phantom"): force-removed, unless it is younger
 *   than the grace period or its exit order is still in flight.
 * - Venue position with no local counterpart: reported and alerted, never adopted.
 * - Both sides present but direction or size differ: reported and alerted, ledger untouched.
 *
 * The venue call happens before the ledger is read; no lock is held across it. Removal
 * releases the slot from POSITION_OPEN first, so a position whose exit has claimed the
 * slot is never removed here.
 */
public final class ReconciliationService {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private final OrderGateway gateway;
    private final ExternalCallExecutor gatewayCalls;
    private final PositionLedger ledger;
    private final SymbolSlotRegistry slots;
    private final ExitOrderExecutor exits;
    private final ExecutionGate gate;
    private final ReconciliationConfig config;
    private final Clock clock;
    private final AlertService alertService;
    private final AuditEventBus audit;
    private final EngineMetrics metrics;

    private volatile ReconciliationReport lastReport;
    private long totalPhantomsRemoved = 0;

    public ReconciliationService(OrderGateway gateway, ExternalCallExecutor gatewayCalls, PositionLedger ledger,
                                 SymbolSlotRegistry slots, ExitOrderExecutor exits, ExecutionGate gate,
                                 ReconciliationConfig config, Clock clock, AlertService alertService,
                                 AuditEventBus audit, EngineMetrics metrics) {
        this.gateway = gateway;
        this.gatewayCalls = gatewayCalls;
        this.ledger = ledger;
        this.slots = slots;
        this.exits = exits;
        this.gate = gate;
        this.config = config;
        this.clock = clock;
        this.alertService = alertService;
        this.audit = audit;
        this.metrics = metrics;
    }

    public ReconciliationReport reconcile() {
        Instant start = clock.instant();

        List<VenuePosition> venue;
        try {
            venue = gatewayCalls.execute("getOpenPositions", gateway::getOpenPositions);
        } catch (RuntimeException e) {
            if (ErrorClassifier.classify(e) == ErrorCategory.CRITICAL) {
                gate.suspend("venue authentication failed during reconciliation: " + e.getMessage());
                alertService.sendCriticalAlert("GATEWAY_AUTH_FAILED",
                    "Reconciliation refused by venue authentication; new entries suspended");
            }
            log.error("Reconciliation skipped, venue positions unavailable: {}", e.getMessage());
            lastReport = ReconciliationReport.failed(start, ledger.size());
            return lastReport;
        }

        Map<String, VenuePosition> venueBySymbol = new HashMap<>();
        for (VenuePosition vp : venue) {
            if (!vp.isFlat()) {
                venueBySymbol.put(vp.symbol(), vp);
            }
        }

        List<Position> local = ledger.getAll();
        List<String> phantoms = new ArrayList<>();
        List<String> mismatched = new ArrayList<>();
        Duration grace = Duration.ofSeconds(config.gracePeriodSeconds());

        for (Position position : local) {
            String symbol = position.symbol();
            VenuePosition counterpart = venueBySymbol.remove(symbol);
            if (counterpart == null) {
                if (exits.isExiting(symbol)) {
                    log.debug("[{}] Not at venue but exit in flight, leaving to exit path", symbol);
                    continue;
                }
                if (position.openedAt() != null && position.openedAt().plus(grace).isAfter(start)) {
                    log.debug("[{}] Not at venue yet, within {}s grace period", symbol, grace.toSeconds());
                    continue;
                }
                if (removePhantom(position)) {
                    phantoms.add(symbol);
                }
            } else if (counterpart.direction() != position.direction()
                || Math.abs(counterpart.netQuantity()) != position.quantity()) {
                mismatched.add(symbol);
                reportMismatch(position, counterpart);
            }
        }

        List<String> unowned = new ArrayList<>(venueBySymbol.keySet());
        unowned.sort(null);
        for (String symbol : unowned) {
            reportUnowned(venueBySymbol.get(symbol));
        }

        ReconciliationReport report = new ReconciliationReport(start, true, local.size(), venue.size(),
            phantoms, unowned, mismatched);
        lastReport = report;
        metrics.setOpenPositions(ledger.size());
        if (report.hasDiscrepancies()) {
            log.warn("Reconciliation: local={}, venue={}, phantomRemoved={}, unowned={}, mismatched={}",
                local.size(), venue.size(), phantoms, unowned, mismatched);
        } else {
            log.info("Reconciliation clean: local={}, venue={}", local.size(), venue.size());
        }
        return report;
    }

    private boolean removePhantom(Position position) {
        String symbol = position.symbol();
        // an exit claims the slot first; losing that race leaves the position to the exit path
        if (!slots.release(symbol, SlotState.POSITION_OPEN)) {
            log.debug("[{}] Slot not POSITION_OPEN ({}), phantom removal skipped", symbol,
                slots.stateOf(symbol).orElse(null));
            return false;
        }
        if (ledger.remove(symbol).isEmpty()) {
            return false;
        }
        exits.forget(symbol);
        totalPhantomsRemoved++;

        String reason = "Phantom position: ledger holds " + position.direction() + " x" + position.quantity()
            + " @ " + position.entryPrice() + " but the venue reports none";
        log.warn("[{}] ⚠️ {}. Removed from ledger.", symbol, reason);
        metrics.recordReconciliationDiscrepancy("PHANTOM_LOCAL");
        metrics.recordPositionClosed(ExitReason.RECONCILIATION);

        Map<String, Object> payload = new HashMap<>();
        payload.put("type", "PHANTOM_LOCAL");
        payload.put("action", "REMOVED");
        payload.put("direction", position.direction().name());
        payload.put("quantity", position.quantity());
        payload.put("entryPrice", position.entryPrice());
        payload.put("reason", reason);
        audit.emit(EventType.RECONCILIATION_DISCREPANCY, symbol, payload);

        Map<String, Object> closed = new HashMap<>();
        closed.put("reason", ExitReason.RECONCILIATION.name());
        closed.put("entryPrice", position.entryPrice());
        closed.put("quantity", position.quantity());
        audit.emit(EventType.POSITION_CLOSED, symbol, closed);

        alertService.sendHighAlert("PHANTOM_POSITION", symbol + ": " + reason);
        return true;
    }

    private void reportUnowned(VenuePosition vp) {
        String reason = "Venue holds " + vp.direction() + " x" + Math.abs(vp.netQuantity())
            + " @ " + vp.averagePrice() + " with no local position; not adopted";
        log.warn("[{}] {}", vp.symbol(), reason);
        metrics.recordReconciliationDiscrepancy("UNOWNED_VENUE");

        Map<String, Object> payload = new HashMap<>();
        payload.put("type", "UNOWNED_VENUE");
        payload.put("action", "NONE");
        payload.put("netQuantity", vp.netQuantity());
        payload.put("averagePrice", vp.averagePrice() == null ? "" : vp.averagePrice());
        payload.put("reason", reason);
        audit.emit(EventType.RECONCILIATION_DISCREPANCY, vp.symbol(), payload);

        Map<String, Object> details = new HashMap<>();
        details.put("symbol", vp.symbol());
        details.put("netQuantity", vp.netQuantity());
        alertService.sendMediumAlert("UNOWNED_VENUE_POSITION", vp.symbol() + ": " + reason, details);
    }

    private void reportMismatch(Position position, VenuePosition vp) {
        String reason = "Ledger " + position.direction() + " x" + position.quantity()
            + " vs venue " + vp.direction() + " x" + Math.abs(vp.netQuantity());
        log.warn("[{}] Position mismatch: {}", position.symbol(), reason);
        metrics.recordReconciliationDiscrepancy("QUANTITY_MISMATCH");

        Map<String, Object> payload = new HashMap<>();
        payload.put("type", "QUANTITY_MISMATCH");
        payload.put("action", "NONE");
        payload.put("reason", reason);
        audit.emit(EventType.RECONCILIATION_DISCREPANCY, position.symbol(), payload);
        alertService.sendHighAlert("POSITION_MISMATCH", position.symbol() + ": " + reason);
    }

    public ReconciliationReport getLastReport() {
        return lastReport;
    }

    public long getTotalPhantomsRemoved() {
        return totalPhantomsRemoved;
    }
}
