package wasp.core.model.evidence;

import java.util.List;

/**
 * Counts and averages over the events of one evaluation window.
 *
 * @param eventCount   number of events
 * @param averageScore mean score, 0 for an empty window
 * @param allowed      events with verdict allow
 * @param challenged   events with verdict challenge
 * @param tarpitted    events with verdict tarpit
 * @param blocked      events with verdict block
 */
public record WindowSummary(
        int eventCount, double averageScore, int allowed, int challenged, int tarpitted, int blocked) {

    public static WindowSummary of(List<CaseEvent> events) {
        int allowed = 0;
        int challenged = 0;
        int tarpitted = 0;
        int blocked = 0;
        double scoreSum = 0;
        for (CaseEvent event : events) {
            scoreSum += event.score();
            switch (event.action()) {
                case ALLOW -> allowed++;
                case CHALLENGE -> challenged++;
                case TARPIT -> tarpitted++;
                case BLOCK -> blocked++;
            }
        }
        final var n = events.size();
        return new WindowSummary(n, n == 0 ? 0 : scoreSum / n, allowed, challenged, tarpitted, blocked);
    }

    /**
     * Number of events that were mitigated in some way.
     */
    public int nonAllowed() {
        return challenged + tarpitted + blocked;
    }
}
