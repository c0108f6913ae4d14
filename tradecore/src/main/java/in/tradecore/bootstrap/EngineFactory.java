package in.tradecore.bootstrap;

import in.tradecore.application.monitoring.AlertService;
import in.tradecore.application.port.output.AuditSink;
import in.tradecore.application.service.EngineSupervisor;
import in.tradecore.application.service.SignalProcessor;
import in.tradecore.config.EngineConfig;
import in.tradecore.infrastructure.broker.adapters.PaperOrderGateway;
import in.tradecore.infrastructure.broker.common.ExternalCallExecutor;
import in.tradecore.infrastructure.broker.common.FeedConnectionManager;
import in.tradecore.infrastructure.broker.common.Sleeper;
import in.tradecore.infrastructure.broker.data.HistoricalBarSource;
import in.tradecore.infrastructure.broker.data.MarketFeed;
import in.tradecore.infrastructure.broker.metrics.EngineMetrics;
import in.tradecore.infrastructure.broker.order.OrderGateway;
import in.tradecore.service.candle.CandleAggregator;
import in.tradecore.service.candle.SessionClock;
import in.tradecore.service.core.AuditEventBus;
import in.tradecore.service.execution.DailyLossMonitor;
import in.tradecore.service.execution.EntryOrderService;
import in.tradecore.service.execution.ExecutionGate;
import in.tradecore.service.execution.OrderToTradeRatioMonitor;
import in.tradecore.service.execution.PositionSizer;
import in.tradecore.service.execution.SymbolSlotRegistry;
import in.tradecore.service.indicator.BasicIndicatorLibrary;
import in.tradecore.service.indicator.IndicatorLibrary;
import in.tradecore.service.position.ExitOrderExecutor;
import in.tradecore.service.position.PositionLedger;
import in.tradecore.service.position.PositionMonitor;
import in.tradecore.service.position.StopRatchet;
import in.tradecore.service.reconcile.ReconciliationService;
import in.tradecore.service.retest.RetestWaitQueue;
import in.tradecore.service.screening.MarketStateProvider;
import in.tradecore.service.screening.ScreeningLevels;
import in.tradecore.service.screening.ScreeningPipeline;
import in.tradecore.service.strategy.BreakoutGenerator;
import in.tradecore.service.strategy.MeanReversionGenerator;
import in.tradecore.service.strategy.RegimeClassifier;
import in.tradecore.service.strategy.SignalGenerator;
import in.tradecore.service.strategy.StrategyRouter;
import in.tradecore.service.strategy.StrategyVariant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the engine from configuration and the external collaborators.
 *
 * In PAPER mode a {@link PaperOrderGateway} priced off the candle aggregator is used when no
 * gateway is supplied.
 */
public final class EngineFactory {
    private static final Logger log = LoggerFactory.getLogger(EngineFactory.class);

    private EngineFactory() {}

    public static EngineSupervisor create(EngineConfig config, MarketFeed feed, OrderGateway gateway,
                                          HistoricalBarSource historicalSource, EngineMetrics metrics,
                                          AuditSink auditSink, Clock clock) {
        SessionClock sessionClock = new SessionClock(config.session(), clock);
        IndicatorLibrary indicators = new BasicIndicatorLibrary();
        AlertService alertService = new AlertService(clock);
        AuditEventBus audit = new AuditEventBus(auditSink, config.audit().queueCapacity(), clock, metrics);

        // ═══ Market data ═══
        CandleAggregator candles = new CandleAggregator(sessionClock, config.candles().intervalMinutes(),
            config.candles().tickBufferCapacity(), config.candles().maxBarsPerSymbol(), metrics);
        FeedConnectionManager feedManager = new FeedConnectionManager(feed,
            config.retry().marketFeed().toPolicy(), Duration.ofMillis(config.retry().feedTimeoutMillis()),
            Sleeper.SYSTEM, metrics);

        // ═══ Venue ═══
        OrderGateway venue = gateway;
        if (venue == null) {
            venue = new PaperOrderGateway(candles::latestPrice, clock);
            log.info("Using paper order gateway");
        }
        ExternalCallExecutor gatewayCalls = new ExternalCallExecutor(venue.getGatewayCode(),
            config.retry().orderGateway().toPolicy(), Duration.ofMillis(config.retry().gatewayTimeoutMillis()),
            Sleeper.SYSTEM, metrics);
        ExecutorService entryExecutor = Executors.newFixedThreadPool(4, namedThreads("entry-order"));
        ExecutorService exitExecutor = Executors.newFixedThreadPool(2, namedThreads("exit-order"));

        // ═══ Execution state ═══
        SymbolSlotRegistry slots = new SymbolSlotRegistry();
        PositionLedger ledger = new PositionLedger();
        ExecutionGate gate = new ExecutionGate(clock);
        OrderToTradeRatioMonitor otrMonitor = new OrderToTradeRatioMonitor(config.risk(), gate, clock,
            sessionClock.zone());
        DailyLossMonitor dailyLoss = new DailyLossMonitor(config.risk(), gate, clock, sessionClock.zone());
        EntryOrderService entryOrders = new EntryOrderService(venue, gatewayCalls, entryExecutor, ledger, slots,
            gate, otrMonitor, alertService, audit, metrics, clock);
        ExitOrderExecutor exits = new ExitOrderExecutor(venue, gatewayCalls, exitExecutor, ledger, slots,
            gate, dailyLoss, alertService, audit, metrics, clock);
        RetestWaitQueue retests = new RetestWaitQueue(slots, entryOrders, gate, config.retest(), clock, audit,
            metrics);

        // ═══ Strategy + screening ═══
        Map<StrategyVariant, SignalGenerator> generators = new EnumMap<>(StrategyVariant.class);
        generators.put(StrategyVariant.MEAN_REVERSION, new MeanReversionGenerator(indicators, config.strategy()));
        generators.put(StrategyVariant.BREAKOUT, new BreakoutGenerator(indicators, config.strategy()));
        StrategyRouter router = new StrategyRouter(candles, new RegimeClassifier(indicators, config.regime()),
            generators, slots, sessionClock, config.candles().minBarsForSignal(), metrics);
        ScreeningPipeline pipeline = new ScreeningPipeline(
            ScreeningLevels.defaultLevels(config.screening(), config.risk(), indicators),
            config.screening(), audit, metrics);
        SignalProcessor signalProcessor = new SignalProcessor(slots, gate, pipeline,
            new MarketStateProvider(candles, sessionClock), ledger, new PositionSizer(config.risk()),
            retests, entryOrders, sessionClock, audit);

        // ═══ Monitoring + reconciliation ═══
        PositionMonitor monitor = new PositionMonitor(ledger, new StopRatchet(config.stops()), exits, retests,
            sessionClock, candles::latestPrice, audit, metrics);
        ReconciliationService reconciliation = new ReconciliationService(venue, gatewayCalls, ledger, slots,
            exits, gate, config.reconciliation(), clock, alertService, audit, metrics);

        return EngineSupervisor.builder()
            .config(config)
            .sessionClock(sessionClock)
            .feedManager(feedManager)
            .candles(candles)
            .historicalSource(historicalSource)
            .router(router)
            .signalProcessor(signalProcessor)
            .positionMonitor(monitor)
            .reconciliation(reconciliation)
            .ledger(ledger)
            .retests(retests)
            .pipeline(pipeline)
            .gate(gate)
            .audit(audit)
            .alertService(alertService)
            .metrics(metrics)
            .entryExecutor(entryExecutor)
            .exitExecutor(exitExecutor)
            .build();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> new Thread(r, prefix + "-" + seq.incrementAndGet());
    }
}
