package in.tradecore.bootstrap;

import in.tradecore.config.EngineConfig;
import in.tradecore.config.TradingMode;
import in.tradecore.domain.common.EngineStartupException;
import in.tradecore.infrastructure.broker.data.MarketFeed;
import in.tradecore.infrastructure.broker.order.OrderGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Startup configuration validator.
 *
 * Runs before anything is wired. Any problem throws {@link EngineStartupException}
 * (an IllegalStateException) and the engine refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @param gateway Externally supplied order gateway, null when none is bundled
     * @param feed Market feed, null when none could be created
     * @throws EngineStartupException if the configuration cannot run
     */
    public static void validate(EngineConfig config, OrderGateway gateway, MarketFeed feed) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        List<String> problems = config.validate();
        if (!problems.isEmpty()) {
            problems.forEach(p -> log.error("❌ Config: {}", p));
            throw new EngineStartupException("Invalid engine configuration: " + String.join("; ", problems));
        }

        log.info("Trading mode: {}", config.tradingMode());
        if (config.tradingMode() == TradingMode.LIVE && gateway == null) {
            log.error("❌ LIVE mode requires a venue order gateway, none configured");
            throw new EngineStartupException("LIVE trading mode requires an order gateway");
        }
        if (feed == null) {
            log.error("❌ No market feed available (set REPLAY_FILE for PAPER replay)");
            throw new EngineStartupException("No market feed configured");
        }
        if (!config.screening().failOpen()) {
            log.info("Screening is fail-closed: advisory level errors will block trades");
        }

        log.info("✅ Startup config validation passed ({} symbols)", config.symbols().size());
        log.info("════════════════════════════════════════════════════════");
    }

    private StartupConfigValidator() {}
}
