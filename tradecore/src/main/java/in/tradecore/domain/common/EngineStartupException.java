package in.tradecore.domain.common;

/**
 * Unrecoverable startup failure. The engine refuses to start.
 */
public class EngineStartupException extends IllegalStateException {

    public EngineStartupException(String message) {
        super(message);
    }

    public EngineStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
