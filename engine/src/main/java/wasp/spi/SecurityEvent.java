package wasp.spi;

import java.time.Instant;

/**
 * Defense activity worth a human's attention: escalated clients, materialized
 * cases and verdict events the queue consumer gave up on.
 */
public sealed interface SecurityEvent {

    Instant timestamp();

    /**
     * Return the client identifier ({@code ip:asn}), or the message id for queue events.
     *
     * @return client identifier
     */
    String clientIdentifier();

    Severity severity();

    enum Severity {
        INFO,
        WARNING,
        CRITICAL
    }

    /**
     * A client was tarpitted or blocked.
     *
     * @param timestamp when the verdict was issued
     * @param clientIdentifier {@code ip:asn}
     * @param zone protected zone
     * @param verdict wire name of the verdict
     * @param score actor score
     * @param hits actor hits in the current window
     */
    record ClientEscalated(
            Instant timestamp, String clientIdentifier, String zone, String verdict, double score, int hits)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return "block".equals(verdict) ? Severity.WARNING : Severity.INFO;
        }
    }

    /**
     * A case materialized its report artifacts.
     *
     * @param timestamp when the snapshot was written
     * @param clientIdentifier {@code ip:asn}
     * @param caseId the case id
     * @param caseKey the case key
     * @param attackForce attack force at materialization
     * @param balanceOfForce balance of force at materialization
     * @param evidenceCount evidence factor at materialization
     */
    record CaseMaterialized(
            Instant timestamp,
            String clientIdentifier,
            String caseId,
            String caseKey,
            double attackForce,
            double balanceOfForce,
            long evidenceCount)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return attackForce >= 1.0 ? Severity.CRITICAL : Severity.WARNING;
        }
    }

    /**
     * A verdict event was dead-lettered.
     *
     * @param timestamp when it was dead-lettered
     * @param clientIdentifier the queue message id
     * @param reason why
     * @param attempts delivery attempts made
     */
    record EventDeadLettered(Instant timestamp, String clientIdentifier, String reason, int attempts)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.WARNING;
        }
    }
}
