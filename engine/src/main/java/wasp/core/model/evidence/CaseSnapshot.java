package wasp.core.model.evidence;

import java.util.Objects;

/**
 * Fields written atomically when a case is materialized.
 *
 * @param lastSeen epoch milliseconds of the recompute
 * @param status   the case status
 * @param metrics  the recomputed metrics
 * @param reports  the generated report artifacts
 */
public record CaseSnapshot(long lastSeen, CaseStatus status, ThreatMetrics metrics, CaseReports reports) {

    public CaseSnapshot {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(metrics, "metrics must not be null");
        Objects.requireNonNull(reports, "reports must not be null");
    }
}
