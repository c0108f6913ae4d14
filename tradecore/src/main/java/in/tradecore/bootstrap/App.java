package in.tradecore.bootstrap;

import in.tradecore.application.service.EngineSupervisor;
import in.tradecore.config.EngineConfig;
import in.tradecore.config.EngineConfigLoader;
import in.tradecore.domain.common.EngineStartupException;
import in.tradecore.infrastructure.audit.JsonLogAuditSink;
import in.tradecore.infrastructure.broker.adapters.ReplayMarketFeed;
import in.tradecore.infrastructure.broker.data.MarketFeed;
import in.tradecore.infrastructure.broker.metrics.PrometheusEngineMetrics;
import in.tradecore.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== TradeCore Engine Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        EngineConfig config = new EngineConfigLoader().load();

        // ═══════════════════════════════════════════════════════════════
        // Market feed (PAPER replay; LIVE feeds are supplied by an integration module)
        // ═══════════════════════════════════════════════════════════════
        Duration pace = Duration.ofMillis(Env.getInt("REPLAY_PACE_MS", 20));
        MarketFeed feed = Env.findPath("REPLAY_FILE")
            .map(path -> (MarketFeed) new ReplayMarketFeed(path, pace))
            .orElse(null);

        try {
            StartupConfigValidator.validate(config, null, feed);
        } catch (EngineStartupException e) {
            log.error("Refusing to start: {}", e.getMessage());
            System.exit(1);
            return;
        }

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusEngineMetrics metrics = new PrometheusEngineMetrics();
        log.info("✓ Prometheus metrics initialized");

        EngineSupervisor engine = EngineFactory.create(config, feed, null, null, metrics,
            new JsonLogAuditSink(), Clock.systemUTC());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");
            engine.stop();
        }, "shutdown-hook"));

        try {
            engine.start();
        } catch (EngineStartupException e) {
            log.error("Refusing to start: {}", e.getMessage());
            System.exit(1);
        }
    }

    private App() {}
}
