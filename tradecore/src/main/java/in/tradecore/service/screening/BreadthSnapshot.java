package in.tradecore.service.screening;

/**
 * Advance/decline counts across the traded universe.
 */
public record BreadthSnapshot(int advancing, int declining, int unchanged) {

    public int total() {
        return advancing + declining + unchanged;
    }

    /**
     * (advancing - declining) / total, in [-1, 1]; 0 when empty.
     */
    public double ratio() {
        int total = total();
        return total == 0 ? 0.0 : (double) (advancing - declining) / total;
    }
}
