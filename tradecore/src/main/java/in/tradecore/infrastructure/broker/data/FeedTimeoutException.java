package in.tradecore.infrastructure.broker.data;

import java.time.Duration;

/**
 * Exception thrown when a market feed operation does not complete in time.
 */
public class FeedTimeoutException extends RuntimeException {

    private final String feedCode;
    private final String operation;

    public FeedTimeoutException(String feedCode, String operation, Duration timeout) {
        super(String.format("[%s] %s timed out after %dms", feedCode, operation, timeout.toMillis()));
        this.feedCode = feedCode;
        this.operation = operation;
    }

    public String getFeedCode() {
        return feedCode;
    }

    public String getOperation() {
        return operation;
    }
}
