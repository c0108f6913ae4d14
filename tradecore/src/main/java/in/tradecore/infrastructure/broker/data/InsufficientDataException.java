package in.tradecore.infrastructure.broker.data;

/**
 * Not enough bars (or a non-finite indicator value) to evaluate a symbol this cycle.
 */
public class InsufficientDataException extends RuntimeException {

    private final String symbol;

    public InsufficientDataException(String symbol, String message) {
        super(String.format("[%s] %s", symbol, message));
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
