package in.tradecore.infrastructure.broker.common;

import in.tradecore.domain.common.EngineStartupException;
import in.tradecore.infrastructure.broker.data.FeedDisconnectedException;
import in.tradecore.infrastructure.broker.data.FeedTimeoutException;
import in.tradecore.infrastructure.broker.data.InsufficientDataException;
import in.tradecore.infrastructure.broker.order.GatewayAuthenticationException;
import in.tradecore.infrastructure.broker.order.GatewayRateLimitException;
import in.tradecore.infrastructure.broker.order.GatewayTimeoutException;
import in.tradecore.infrastructure.broker.order.OrderPlacementException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps exceptions onto {@link ErrorCategory}.
 */
public final class ErrorClassifier {

    public static ErrorCategory classify(Throwable error) {
        Throwable e = unwrap(error);

        if (e instanceof GatewayAuthenticationException) {
            return ErrorCategory.CRITICAL;
        }
        if (e instanceof EngineStartupException) {
            return ErrorCategory.FATAL;
        }
        if (e instanceof OrderPlacementException || e instanceof IllegalArgumentException) {
            return ErrorCategory.VALIDATION;
        }
        if (e instanceof InsufficientDataException || e instanceof ArithmeticException) {
            return ErrorCategory.DATA;
        }
        if (e instanceof GatewayTimeoutException
            || e instanceof GatewayRateLimitException
            || e instanceof FeedDisconnectedException
            || e instanceof FeedTimeoutException
            || e instanceof TimeoutException
            || e instanceof IOException
            || e instanceof UncheckedIOException) {
            return ErrorCategory.TRANSIENT;
        }
        // Unknown failures from venue clients are usually network-level
        return ErrorCategory.TRANSIENT;
    }

    /**
     * Strip CompletionException / ExecutionException wrappers.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable e = error;
        while ((e instanceof CompletionException || e instanceof ExecutionException) && e.getCause() != null) {
            e = e.getCause();
        }
        return e;
    }

    private ErrorClassifier() {}
}
