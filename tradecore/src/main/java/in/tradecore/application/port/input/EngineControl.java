package in.tradecore.application.port.input;

import in.tradecore.domain.monitoring.EngineSnapshot;

/**
 * EngineControl - the only surface an outer control layer (HTTP, CLI) needs.
 *
 * CONTRACT:
 * - start() is a no-op when already running; a Fatal startup problem throws
 *   {@link in.tradecore.domain.common.EngineStartupException} and leaves the engine STOPPED
 * - stop() lets in-flight order submissions finish before the loops exit
 * - status() never blocks on the venue
 */
public interface EngineControl {

    void start();

    void stop();

    EngineSnapshot status();
}
