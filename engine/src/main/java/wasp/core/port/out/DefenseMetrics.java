package wasp.core.port.out;

import java.util.Locale;

import wasp.core.model.admission.Verdict;

/**
 * Port for recording defense metrics.
 *
 * <p>All methods are no-ops when metrics are disabled.
 */
public interface DefenseMetrics {

    boolean isEnabled();

    void recordVerdict(Verdict verdict);

    void recordFailSafe();

    void recordPublishFailure();

    void recordIngestion(IngestionOutcome outcome);

    void recordMaterialization();

    /**
     * Terminal outcome of one delivery of a queue message.
     */
    enum IngestionOutcome {
        ACKED,
        RETRIED,
        DEAD_LETTERED;

        public String tagValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
