package wasp.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

import io.smallrye.mutiny.Uni;

import wasp.core.model.evidence.CaseEvent;
import wasp.core.model.evidence.CaseKey;
import wasp.core.model.evidence.CaseRecord;
import wasp.core.model.evidence.CaseSnapshot;
import wasp.core.port.out.CaseRepository;

/**
 * In-memory case repository for development and tests.
 *
 * <p>
 * Limitations:
 * <ul>
 * <li>State is lost on restart</li>
 * <li>Event logs grow without bound</li>
 * </ul>
 */
public final class InMemoryCaseRepository implements CaseRepository {

    private final ConcurrentMap<String, String> idsByKey = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, CaseRecord> cases = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, EventLog> events = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Uni<String> upsertCase(CaseKey key, String country, long ts) {
        return Uni.createFrom().item(() -> {
            final var created = new boolean[1];
            final var id = idsByKey.computeIfAbsent(key.value(), k -> {
                final var newId = UUID.randomUUID().toString();
                cases.put(newId, CaseRecord.open(newId, key, country, ts));
                created[0] = true;
                return newId;
            });
            if (!created[0]) {
                cases.computeIfPresent(id, (k, existing) -> existing.touchedAt(ts));
            }
            return id;
        });
    }

    @Override
    public Uni<Void> appendEvent(CaseEvent event) {
        return Uni.createFrom().item(() -> {
            events.compute(event.caseId(), (k, log) -> {
                final var next = log != null ? log : new EventLog();
                if (next.eventIds.add(event.eventId())) {
                    next.entries.add(new SequencedEvent(sequence.incrementAndGet(), event));
                }
                return next;
            });
            return null;
        });
    }

    @Override
    public Uni<List<CaseEvent>> selectEventsInWindow(String caseId, long fromTs) {
        return Uni.createFrom().item(() -> {
            final List<SequencedEvent> copy = new ArrayList<>();
            events.computeIfPresent(caseId, (k, log) -> {
                copy.addAll(log.entries);
                return log;
            });
            return copy.stream()
                    .filter(e -> e.event().ts() >= fromTs)
                    .sorted(Comparator.comparingLong((SequencedEvent e) -> e.event().ts())
                            .thenComparingLong(SequencedEvent::sequence))
                    .map(SequencedEvent::event)
                    .toList();
        });
    }

    @Override
    public Uni<Boolean> updateCaseSnapshot(String caseId, CaseSnapshot snapshot) {
        return Uni.createFrom()
                .item(() -> cases.computeIfPresent(caseId, (k, existing) -> existing.withSnapshot(snapshot)) != null);
    }

    @Override
    public Uni<Optional<CaseRecord>> findById(String caseId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(cases.get(caseId)));
    }

    @Override
    public Uni<Optional<CaseRecord>> findByKey(CaseKey key) {
        return Uni.createFrom()
                .item(() -> Optional.ofNullable(idsByKey.get(key.value())).map(cases::get));
    }

    @Override
    public Uni<List<CaseRecord>> findRecent(int limit) {
        return Uni.createFrom().item(() -> cases.values().stream()
                .sorted(Comparator.comparingLong(CaseRecord::lastSeen).reversed())
                .limit(Math.max(limit, 0))
                .toList());
    }

    /**
     * Number of stored cases. Useful for tests.
     */
    public int caseCount() {
        return cases.size();
    }

    private record SequencedEvent(long sequence, CaseEvent event) {}

    // guarded by the events map's compute lock
    private static final class EventLog {
        private final List<SequencedEvent> entries = new ArrayList<>();
        private final Set<String> eventIds = new HashSet<>();
    }
}
