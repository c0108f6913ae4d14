package in.tradecore.infrastructure.broker.data;

/**
 * Exception thrown when the market feed connection drops or cannot be established.
 */
public class FeedDisconnectedException extends RuntimeException {

    private final String feedCode;

    public FeedDisconnectedException(String feedCode, String message) {
        super(String.format("[%s] %s", feedCode, message));
        this.feedCode = feedCode;
    }

    public FeedDisconnectedException(String feedCode, String message, Throwable cause) {
        super(String.format("[%s] %s", feedCode, message), cause);
        this.feedCode = feedCode;
    }

    public String getFeedCode() {
        return feedCode;
    }
}
