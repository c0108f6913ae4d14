package in.tradecore.application.service;

import in.tradecore.domain.common.EventType;
import in.tradecore.domain.screening.ScreeningVerdict;
import in.tradecore.domain.signal.Signal;
import in.tradecore.infrastructure.broker.data.InsufficientDataException;
import in.tradecore.service.candle.SessionClock;
import in.tradecore.service.core.AuditEventBus;
import in.tradecore.service.execution.EntryIntent;
import in.tradecore.service.execution.EntryOrderService;
import in.tradecore.service.execution.ExecutionGate;
import in.tradecore.service.execution.PositionSizer;
import in.tradecore.service.execution.SlotState;
import in.tradecore.service.execution.SymbolSlotRegistry;
import in.tradecore.service.position.PositionLedger;
import in.tradecore.service.retest.RetestWaitQueue;
import in.tradecore.service.screening.MarketState;
import in.tradecore.service.screening.MarketStateProvider;
import in.tradecore.service.screening.ScreeningPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Takes ranked signals from the strategy loop through to an order or a pending retest.
 *
 * For each signal: entry gate → slot reservation → screening → sizing → retest queue
 * (breakouts) or immediate entry. The symbol's slot is held from reservation on and is
 * released on every path that does not end in a pending retest or an in-flight order.
 * Those committed slots are passed to screening so portfolio limits see them before they fill.
 */
public final class SignalProcessor {
    private static final Logger log = LoggerFactory.getLogger(SignalProcessor.class);

    private final SymbolSlotRegistry slots;
    private final ExecutionGate gate;
    private final ScreeningPipeline pipeline;
    private final MarketStateProvider marketState;
    private final PositionLedger ledger;
    private final PositionSizer sizer;
    private final RetestWaitQueue retests;
    private final EntryOrderService entryOrders;
    private final SessionClock sessionClock;
    private final AuditEventBus audit;

    public SignalProcessor(SymbolSlotRegistry slots, ExecutionGate gate, ScreeningPipeline pipeline,
                           MarketStateProvider marketState, PositionLedger ledger, PositionSizer sizer,
                           RetestWaitQueue retests, EntryOrderService entryOrders, SessionClock sessionClock,
                           AuditEventBus audit) {
        this.slots = slots;
        this.gate = gate;
        this.pipeline = pipeline;
        this.marketState = marketState;
        this.ledger = ledger;
        this.sizer = sizer;
        this.retests = retests;
        this.entryOrders = entryOrders;
        this.sessionClock = sessionClock;
        this.audit = audit;
    }

    /**
     * @return number of signals that became a pending retest or an entry order
     */
    public int process(List<Signal> signals) {
        int accepted = 0;
        for (Signal signal : signals) {
            try {
                if (processOne(signal)) {
                    accepted++;
                }
            } catch (RuntimeException e) {
                slots.release(signal.symbol(), SlotState.SCREENING);
                log.error("[{}] Signal processing failed: {}", signal.symbol(), e.getMessage(), e);
            }
        }
        return accepted;
    }

    boolean processOne(Signal signal) {
        String symbol = signal.symbol();

        String blocked = gate.blockReason();
        if (blocked != null) {
            log.info("[{}] {} signal not taken, entries {}", symbol, signal.strategyId(), blocked);
            return false;
        }
        Instant now = sessionClock.now();
        if (sessionClock.isFlattenWindow(now)) {
            log.info("[{}] {} signal not taken, session flatten window", symbol, signal.strategyId());
            return false;
        }
        if (!slots.tryReserve(symbol, SlotState.SCREENING)) {
            log.info("[{}] {} signal rejected, symbol already has a position, retest or entry in progress",
                symbol, signal.strategyId());
            return false;
        }

        audit.emit(EventType.SIGNAL, symbol, signalPayload(signal));

        MarketState state = marketState.stateFor(symbol).withCommittedEntries(committedEntries());
        ScreeningVerdict verdict = pipeline.screen(signal, state, ledger.getAll());
        if (!verdict.passed()) {
            slots.release(symbol, SlotState.SCREENING);
            return false;
        }

        int quantity;
        try {
            quantity = sizer.size(signal);
        } catch (InsufficientDataException e) {
            slots.release(symbol, SlotState.SCREENING);
            log.warn("[{}] Signal dropped, cannot size: {}", symbol, e.getMessage());
            return false;
        }

        if (signal.requiresRetest()) {
            boolean queued = retests.enqueue(symbol, signal.direction(), signal.entryPrice(), signal.stopLoss(),
                signal.target(), quantity, signal.strategyId()).isPresent();
            if (!queued) {
                slots.release(symbol, SlotState.SCREENING);
            }
            return queued;
        }

        if (!slots.transition(symbol, SlotState.SCREENING, SlotState.ENTRY_IN_FLIGHT)) {
            return false;
        }
        BigDecimal reference = state.lastPrice() != null ? state.lastPrice() : signal.entryPrice();
        entryOrders.submit(new EntryIntent(symbol, signal.direction(), quantity, signal.stopLoss(),
            signal.target(), signal.strategyId(), reference, "SIGNAL"));
        return true;
    }

    private int committedEntries() {
        return (int) (slots.count(SlotState.ENTRY_IN_FLIGHT) + slots.count(SlotState.PENDING_RETEST));
    }

    private static Map<String, Object> signalPayload(Signal signal) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("strategy", signal.strategyId());
        payload.put("direction", signal.direction().name());
        payload.put("entryPrice", signal.entryPrice());
        payload.put("stopLoss", signal.stopLoss());
        payload.put("target", signal.target() == null ? "" : signal.target());
        payload.put("confidence", signal.confidence());
        payload.put("rationale", signal.rationale());
        payload.put("requiresRetest", signal.requiresRetest());
        return payload;
    }
}
