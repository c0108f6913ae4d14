package in.tradecore.domain.monitoring;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one reconciliation cycle.
 *
 * @param fetched false when the venue could not be queried; nothing was changed in that case
 */
public record ReconciliationReport(
    Instant runAt,
    boolean fetched,
    int localPositions,
    int venuePositions,
    List<String> phantomRemoved,
    List<String> unownedVenue,
    List<String> mismatched
) {
    public ReconciliationReport {
        phantomRemoved = List.copyOf(phantomRemoved);
        unownedVenue = List.copyOf(unownedVenue);
        mismatched = List.copyOf(mismatched);
    }

    public static ReconciliationReport failed(Instant runAt, int localPositions) {
        return new ReconciliationReport(runAt, false, localPositions, 0, List.of(), List.of(), List.of());
    }

    public boolean hasDiscrepancies() {
        return !phantomRemoved.isEmpty() || !unownedVenue.isEmpty() || !mismatched.isEmpty();
    }
}
