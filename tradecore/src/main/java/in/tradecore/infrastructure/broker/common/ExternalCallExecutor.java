package in.tradecore.infrastructure.broker.common;

import in.tradecore.infrastructure.broker.metrics.EngineMetrics;
import in.tradecore.infrastructure.broker.order.GatewayTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs calls against an external system with a per-attempt timeout and the shared
 * {@link RetryPolicy}.
 *
 * - A timeout becomes {@link GatewayTimeoutException} and is retried like any transient error.
 * - Only {@link ErrorCategory#TRANSIENT} failures are retried.
 * - When attempts are exhausted the last failure is rethrown, unwrapped.
 *
 * Blocks the calling thread; never call it while holding a ledger or queue lock.
 */
public final class ExternalCallExecutor {
    private static final Logger log = LoggerFactory.getLogger(ExternalCallExecutor.class);

    private final String target;
    private final RetryPolicy policy;
    private final Duration timeout;
    private final Sleeper sleeper;
    private final EngineMetrics metrics;

    public ExternalCallExecutor(String target, RetryPolicy policy, Duration timeout,
                                Sleeper sleeper, EngineMetrics metrics) {
        this.target = target;
        this.policy = policy;
        this.timeout = timeout;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    /**
     * Execute with retries.
     *
     * @param operation Name used in logs and metrics (placeOrder, getOpenPositions)
     * @param call Supplies a fresh future per attempt
     * @return Call result
     * @throws RuntimeException last failure once retries are exhausted or the failure is not transient
     */
    public <T> T execute(String operation, Supplier<CompletableFuture<T>> call) {
        long startNanos = System.nanoTime();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return awaitOnce(operation, call.get());
            } catch (RuntimeException e) {
                Throwable cause = ErrorClassifier.unwrap(e);
                RuntimeException failure = cause instanceof RuntimeException ? (RuntimeException) cause : e;
                if (failure instanceof CancellationException) {
                    throw failure;
                }
                ErrorCategory category = ErrorClassifier.classify(failure);
                Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);

                if (!category.isRetryable() || !policy.shouldRetry(attempt, elapsed)) {
                    log.warn("[{}] {} failed after {} attempt(s) ({}): {}",
                        target, operation, attempt, category, failure.getMessage());
                    throw failure;
                }

                Duration delay = policy.delayForAttempt(attempt);
                log.warn("[{}] {} attempt {} failed ({}), retrying in {}ms: {}",
                    target, operation, attempt, category, delay.toMillis(), failure.getMessage());
                metrics.recordRetry(target, operation);
                pause(delay);
            }
        }
    }

    private <T> T awaitOnce(String operation, CompletableFuture<T> future) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new GatewayTimeoutException(target, operation, timeout);
        } catch (ExecutionException e) {
            Throwable cause = ErrorClassifier.unwrap(e);
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("[" + target + "] " + operation + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("[" + target + "] " + operation + " interrupted");
        }
    }

    private void pause(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("[" + target + "] retry wait interrupted");
        }
    }

    public RetryPolicy getPolicy() {
        return policy;
    }
}
