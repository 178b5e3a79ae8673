package wasp.core.model.evidence;

/**
 * Lifecycle status of a case.
 */
public enum CaseStatus {
    /** Case is being tracked and may still receive events. */
    OPEN
}
