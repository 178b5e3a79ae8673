package wasp.core.port.out;

import wasp.core.model.evidence.CaseKey;
import wasp.core.model.evidence.CaseReports;
import wasp.core.model.evidence.ThreatMetrics;
import wasp.core.model.evidence.WindowSummary;

/**
 * Port for producing report artifacts of a materialized case.
 *
 * <p>Implementations must be pure: the same input yields the same text.
 */
public interface ReportGenerator {

    CaseReports generate(CaseKey key, String country, WindowSummary summary, ThreatMetrics metrics, long generatedAt);
}
