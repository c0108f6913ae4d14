package in.tradecore.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.tradecore.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link EngineConfig} from JSON.
 *
 * Source: file named by ENGINE_CONFIG, else classpath {@code engine-config.json}.
 * Env overrides: TRADING_MODE, SCREENING_FAIL_OPEN.
 */
public final class EngineConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(EngineConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "engine-config.json";

    private final ObjectMapper mapper;

    public EngineConfigLoader() {
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Load from the configured location and apply environment overrides.
     *
     * @throws IllegalStateException if the configuration cannot be read
     */
    public EngineConfig load() {
        EngineConfig config = Env.findPath("ENGINE_CONFIG")
            .map(this::loadFile)
            .orElseGet(() -> loadResource(DEFAULT_RESOURCE));
        return applyOverrides(config);
    }

    public EngineConfig loadFile(Path path) {
        log.info("Loading engine config from file {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            return mapper.readValue(in, EngineConfig.class);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read engine config " + path + ": " + e.getMessage(), e);
        }
    }

    public EngineConfig loadResource(String resource) {
        log.info("Loading engine config from classpath {}", resource);
        try (InputStream in = EngineConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Engine config resource not found: " + resource);
            }
            return mapper.readValue(in, EngineConfig.class);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot parse engine config " + resource + ": " + e.getMessage(), e);
        }
    }

    EngineConfig applyOverrides(EngineConfig config) {
        EngineConfig result = config;

        var mode = Env.findEnum("TRADING_MODE", TradingMode.class);
        if (mode.isPresent()) {
            result = result.withTradingMode(mode.get());
            log.info("TRADING_MODE override: {}", mode.get());
        }

        var failOpen = Env.findBool("SCREENING_FAIL_OPEN");
        if (failOpen.isPresent() && result.screening() != null) {
            ScreeningConfig s = result.screening();
            boolean flag = failOpen.get();
            result = result.withScreening(new ScreeningConfig(
                flag, s.levels(), s.blacklist(), s.minRewardToRisk(),
                s.fastEmaPeriod(), s.slowEmaPeriod(), s.bollingerPeriod(), s.squeezeWidthThreshold(),
                s.srLookback(), s.srProximityPercent(), s.minGapPercent(),
                s.nrbLookback(), s.nrbPercentile(), s.breadthNeutralBand(),
                s.minHeuristicScore(), s.maxChasePercent()));
            log.info("SCREENING_FAIL_OPEN override: {}", flag);
        }
        return result;
    }

    public ObjectMapper getMapper() {
        return mapper;
    }
}
