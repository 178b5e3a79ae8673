package wasp.core.model.evidence;

import java.util.Objects;

import wasp.core.model.admission.Verdict;

/**
 * One persisted admission verdict belonging to a case. Append-only; appending
 * an {@code eventId} the case already holds is a no-op, so a redelivered
 * message cannot be counted twice.
 *
 * @param caseId    owning case id
 * @param eventId   id of the queue message that carried the verdict
 * @param ts        epoch ms of the verdict
 * @param path      request path
 * @param method    HTTP method
 * @param userAgent user agent
 * @param action    verdict
 * @param score     actor score at the time of the verdict
 * @param hits      actor hits in its window
 * @param colo      edge location tag
 */
public record CaseEvent(
        String caseId,
        String eventId,
        long ts,
        String path,
        String method,
        String userAgent,
        Verdict action,
        double score,
        int hits,
        String colo) {

    public CaseEvent {
        Objects.requireNonNull(caseId, "caseId must not be null");
        Objects.requireNonNull(eventId, "eventId must not be null");
        Objects.requireNonNull(action, "action must not be null");
    }
}
