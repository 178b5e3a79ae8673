package wasp.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import wasp.core.model.evidence.CaseEvent;
import wasp.core.model.evidence.CaseKey;
import wasp.core.model.evidence.CaseRecord;
import wasp.core.model.evidence.CaseSnapshot;

/**
 * Port for durable storage of cases and their event logs.
 *
 * <p>This is a pure persistence layer; it applies no policy beyond the
 * uniqueness of case keys and the monotonic {@code last_seen}.
 */
public interface CaseRepository {

    /**
     * Return the id of the case for {@code key}, creating it if it does not exist.
     *
     * <p>Idempotent. When the case exists its {@code last_seen} is raised to
     * {@code ts} if {@code ts} is later; it never moves backwards. A new case
     * is created with status OPEN and {@code first_seen = last_seen = ts}.
     *
     * @param key     the case key
     * @param country country of the triggering event
     * @param ts      event timestamp, epoch ms
     * @return the case id
     */
    Uni<String> upsertCase(CaseKey key, String country, long ts);

    /**
     * Append an event to its case's log. An event whose {@code eventId} the case
     * already holds is not appended again.
     */
    Uni<Void> appendEvent(CaseEvent event);

    /**
     * Events of a case with {@code ts >= fromTs}, ordered by ts. Ties keep
     * insertion order in memory and event id order in Cassandra.
     */
    Uni<List<CaseEvent>> selectEventsInWindow(String caseId, long fromTs);

    /**
     * Write the materialization snapshot of a case in a single update.
     *
     * @return true if the case exists and was updated
     */
    Uni<Boolean> updateCaseSnapshot(String caseId, CaseSnapshot snapshot);

    Uni<Optional<CaseRecord>> findById(String caseId);

    Uni<Optional<CaseRecord>> findByKey(CaseKey key);

    /**
     * Most recently seen cases, ordered by {@code last_seen} descending.
     */
    Uni<List<CaseRecord>> findRecent(int limit);
}
