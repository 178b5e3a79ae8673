package wasp.core.model.evidence;

/**
 * Outcome of one recompute of a case.
 *
 * @param caseId       the case
 * @param summary      counts over the window
 * @param metrics      the computed metrics
 * @param materialized whether the trigger fired and the snapshot was written
 */
public record AggregationResult(String caseId, WindowSummary summary, ThreatMetrics metrics, boolean materialized) {}
