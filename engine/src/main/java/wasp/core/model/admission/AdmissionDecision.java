package wasp.core.model.admission;

import java.util.Objects;

/**
 * Result of an admission evaluation.
 *
 * @param action the verdict
 * @param score  the actor's threat score after this request
 * @param hits   requests counted in the actor's current window
 */
public record AdmissionDecision(Verdict action, double score, int hits) {

    public AdmissionDecision {
        Objects.requireNonNull(action, "action must not be null");
    }

    /**
     * Decision for a request that skipped evaluation entirely (health checks).
     *
     * @return an allow decision with zero score and hits
     */
    public static AdmissionDecision bypass() {
        return new AdmissionDecision(Verdict.ALLOW, 0.0, 0);
    }

    /**
     * Decision used when the actor's state could not be read or written.
     *
     * @param verdict the configured fail-safe verdict
     * @return a decision with zero score and hits
     */
    public static AdmissionDecision failSafe(Verdict verdict) {
        return new AdmissionDecision(verdict, 0.0, 0);
    }
}
