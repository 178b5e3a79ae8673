package wasp.core.model.evidence;

/**
 * Text artifacts generated for a materialized case.
 *
 * @param abuseReport     report suitable for an upstream network abuse desk
 * @param section504Draft draft information filing
 */
public record CaseReports(String abuseReport, String section504Draft) {}
