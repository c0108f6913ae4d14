package in.tradecore.infrastructure.broker.common;

import java.time.Duration;

/**
 * Backoff wait. Swapped for a no-op in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
