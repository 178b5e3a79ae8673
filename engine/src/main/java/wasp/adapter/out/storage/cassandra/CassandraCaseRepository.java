package wasp.adapter.out.storage.cassandra;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Function;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.cql.AsyncResultSet;
import com.datastax.oss.driver.api.core.cql.BoundStatement;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.Row;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import io.vertx.core.Context;
import io.vertx.core.Vertx;
import org.jboss.logging.Logger;

import wasp.core.model.admission.Verdict;
import wasp.core.model.evidence.CaseEvent;
import wasp.core.model.evidence.CaseKey;
import wasp.core.model.evidence.CaseRecord;
import wasp.core.model.evidence.CaseSnapshot;
import wasp.core.model.evidence.CaseStatus;
import wasp.core.model.evidence.ThreatMetrics;
import wasp.core.port.out.CaseRepository;

/**
 * Cassandra implementation of CaseRepository.
 *
 * <p>
 * Key uniqueness is enforced by a lightweight transaction on {@code cases_by_key}.
 * The case row is written before the key is claimed, so a key that resolves
 * always resolves to an existing case; the loser of a concurrent creation
 * deletes its orphan row and adopts the winner's id.
 *
 * <p>
 * Events are clustered by {@code (ts, event_id)} where {@code event_id} is the
 * queue message id, so a redelivered event overwrites its own row.
 */
public class CassandraCaseRepository implements CaseRepository {

    private static final Logger LOG = Logger.getLogger(CassandraCaseRepository.class);

    private final CqlSession session;
    private final PreparedStatement insertCaseStmt;
    private final PreparedStatement claimKeyStmt;
    private final PreparedStatement selectIdByKeyStmt;
    private final PreparedStatement deleteCaseStmt;
    private final PreparedStatement touchCaseStmt;
    private final PreparedStatement insertEventStmt;
    private final PreparedStatement selectEventsStmt;
    private final PreparedStatement updateSnapshotStmt;
    private final PreparedStatement selectByIdStmt;
    private final PreparedStatement selectAllStmt;

    public CassandraCaseRepository(CqlSession session) {
        this.session = session;
        this.insertCaseStmt = session.prepare(
                """
                        INSERT INTO cases
                        (id, key, zone, ip, asn, country, first_seen, last_seen, status,
                         attack_rps, est_bandwidth_mbps, system_capacity_rps, af, df, bof,
                         evidence_count, mercy, justice)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, 0, 0, 0, 0, 0, 1, 0, 0.5, 0.5)
                        """);
        this.claimKeyStmt = session.prepare("INSERT INTO cases_by_key (key, case_id) VALUES (?, ?) IF NOT EXISTS");
        this.selectIdByKeyStmt = session.prepare("SELECT case_id FROM cases_by_key WHERE key = ?");
        this.deleteCaseStmt = session.prepare("DELETE FROM cases WHERE id = ?");
        this.touchCaseStmt = session.prepare("UPDATE cases SET last_seen = ? WHERE id = ? IF last_seen < ?");
        this.insertEventStmt = session.prepare(
                """
                        INSERT INTO events
                        (case_id, ts, event_id, path, method, user_agent, action, score, hits, colo)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                        """);
        this.selectEventsStmt = session.prepare("SELECT * FROM events WHERE case_id = ? AND ts >= ?");
        this.updateSnapshotStmt = session.prepare(
                """
                        UPDATE cases SET
                        last_seen = ?, status = ?, attack_rps = ?, est_bandwidth_mbps = ?, system_capacity_rps = ?,
                        af = ?, df = ?, bof = ?, evidence_count = ?, mercy = ?, justice = ?,
                        abuse_report = ?, section504_draft = ?
                        WHERE id = ? IF EXISTS
                        """);
        this.selectByIdStmt = session.prepare("SELECT * FROM cases WHERE id = ?");
        this.selectAllStmt = session.prepare("SELECT * FROM cases");
    }

    @Override
    public Uni<String> upsertCase(CaseKey key, String country, long ts) {
        return lookupId(key).flatMap(existing -> existing.isPresent()
                ? touch(existing.get(), ts).replaceWith(existing.get())
                : create(key, country, ts));
    }

    private Uni<String> create(CaseKey key, String country, long ts) {
        final var newId = UUID.randomUUID().toString();
        return execute(insertCaseStmt.bind(
                        newId,
                        key.value(),
                        key.zone(),
                        key.ip(),
                        key.asn(),
                        country,
                        ts,
                        ts,
                        CaseStatus.OPEN.name()))
                .flatMap(ignored -> execute(claimKeyStmt.bind(key.value(), newId)))
                .flatMap(rs -> {
                    if (rs.wasApplied()) {
                        return Uni.createFrom().item(newId);
                    }
                    final var winner = rs.one().getString("case_id");
                    LOG.debugf("Lost creation race for %s, adopting case %s", key, winner);
                    return execute(deleteCaseStmt.bind(newId))
                            .flatMap(deleted -> touch(winner, ts))
                            .replaceWith(winner);
                });
    }

    private Uni<Void> touch(String caseId, long ts) {
        return execute(touchCaseStmt.bind(ts, caseId, ts)).replaceWithVoid();
    }

    private Uni<Optional<String>> lookupId(CaseKey key) {
        return execute(selectIdByKeyStmt.bind(key.value())).map(rs -> {
            Row row = rs.one();
            return row != null ? Optional.of(row.getString("case_id")) : Optional.empty();
        });
    }

    @Override
    public Uni<Void> appendEvent(CaseEvent event) {
        return execute(insertEventStmt.bind(
                        event.caseId(),
                        event.ts(),
                        event.eventId(),
                        event.path(),
                        event.method(),
                        event.userAgent(),
                        event.action().wireName(),
                        event.score(),
                        event.hits(),
                        event.colo()))
                .replaceWithVoid();
    }

    @Override
    public Uni<List<CaseEvent>> selectEventsInWindow(String caseId, long fromTs) {
        // clustering order (ts, event_id)
        return executeAll(selectEventsStmt.bind(caseId, fromTs), this::eventFromRow);
    }

    @Override
    public Uni<Boolean> updateCaseSnapshot(String caseId, CaseSnapshot snapshot) {
        final var m = snapshot.metrics();
        return execute(updateSnapshotStmt.bind(
                        snapshot.lastSeen(),
                        snapshot.status().name(),
                        m.attackRps(),
                        m.estBandwidthMbps(),
                        m.systemCapacityRps(),
                        m.attackForce(),
                        m.defenseForce(),
                        m.balanceOfForce(),
                        m.evidenceCount(),
                        m.mercy(),
                        m.justice(),
                        snapshot.reports().abuseReport(),
                        snapshot.reports().section504Draft(),
                        caseId))
                .map(AsyncResultSet::wasApplied);
    }

    @Override
    public Uni<Optional<CaseRecord>> findById(String caseId) {
        return execute(selectByIdStmt.bind(caseId)).map(rs -> {
            Row row = rs.one();
            return row != null ? Optional.of(caseFromRow(row)) : Optional.empty();
        });
    }

    @Override
    public Uni<Optional<CaseRecord>> findByKey(CaseKey key) {
        return lookupId(key).flatMap(id -> id.isPresent()
                ? findById(id.get())
                : Uni.createFrom().item(Optional.<CaseRecord>empty()));
    }

    @Override
    public Uni<List<CaseRecord>> findRecent(int limit) {
        // Full scan; intended for administration, not the hot path
        return executeAll(selectAllStmt.bind(), this::caseFromRow).map(all -> all.stream()
                .sorted(Comparator.comparingLong(CaseRecord::lastSeen).reversed())
                .limit(Math.max(limit, 0))
                .toList());
    }

    private Uni<AsyncResultSet> execute(BoundStatement bound) {
        Executor executor = getContextExecutor();
        return Uni.createFrom()
                .completionStage(() -> session.executeAsync(bound))
                .emitOn(executor);
    }

    private <T> Uni<List<T>> executeAll(BoundStatement bound, Function<Row, T> mapper) {
        Executor executor = getContextExecutor();
        return Uni.createFrom()
                .completionStage(() -> session.executeAsync(bound)
                        .thenCompose(rs -> collectPages(rs, mapper, new ArrayList<>())))
                .emitOn(executor);
    }

    private static <T> CompletionStage<List<T>> collectPages(AsyncResultSet rs, Function<Row, T> mapper, List<T> acc) {
        rs.currentPage().forEach(row -> acc.add(mapper.apply(row)));
        if (rs.hasMorePages()) {
            return rs.fetchNextPage().thenCompose(next -> collectPages(next, mapper, acc));
        }
        return CompletableFuture.completedFuture(acc);
    }

    private CaseEvent eventFromRow(Row row) {
        return new CaseEvent(
                row.getString("case_id"),
                row.getString("event_id"),
                row.getLong("ts"),
                row.getString("path"),
                row.getString("method"),
                row.getString("user_agent"),
                Verdict.fromWire(row.getString("action")),
                row.getDouble("score"),
                row.getInt("hits"),
                row.getString("colo"));
    }

    private CaseRecord caseFromRow(Row row) {
        final var metrics = new ThreatMetrics(
                row.getDouble("attack_rps"),
                row.getDouble("est_bandwidth_mbps"),
                row.getDouble("system_capacity_rps"),
                row.getDouble("af"),
                row.getDouble("df"),
                row.isNull("bof") ? 1.0 : row.getDouble("bof"),
                row.getLong("evidence_count"),
                row.isNull("mercy") ? 0.5 : row.getDouble("mercy"),
                row.isNull("justice") ? 0.5 : row.getDouble("justice"));
        return new CaseRecord(
                row.getString("id"),
                row.getString("key"),
                row.getString("zone"),
                row.getString("ip"),
                row.getLong("asn"),
                row.getString("country"),
                row.getLong("first_seen"),
                row.getLong("last_seen"),
                CaseStatus.valueOf(row.getString("status")),
                metrics,
                row.getString("abuse_report"),
                row.getString("section504_draft"));
    }

    /**
     * Gets an executor that will run on the Vert.x context if available,
     * otherwise falls back to the default worker pool.
     */
    private Executor getContextExecutor() {
        Context context = Vertx.currentContext();
        if (context != null) {
            return command -> context.runOnContext(v -> command.run());
        }
        return Infrastructure.getDefaultWorkerPool();
    }
}
