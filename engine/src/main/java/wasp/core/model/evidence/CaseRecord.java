package wasp.core.model.evidence;

import java.util.Objects;
import java.util.Optional;

/**
 * Persisted aggregate for one {@link CaseKey}.
 *
 * @param id              random UUID string
 * @param key             the unique key string {@code zone:ip:asn}
 * @param zone            protected zone
 * @param ip              client IP
 * @param asn             autonomous system number
 * @param country         country code of the first event
 * @param firstSeen       epoch ms of the first event
 * @param lastSeen        epoch ms of the latest event or materialization
 * @param status          lifecycle status
 * @param metrics         latest materialized metrics
 * @param abuseReport     abuse report, null before the first materialization
 * @param section504Draft information draft, null before the first materialization
 */
public record CaseRecord(
        String id,
        String key,
        String zone,
        String ip,
        long asn,
        String country,
        long firstSeen,
        long lastSeen,
        CaseStatus status,
        ThreatMetrics metrics,
        String abuseReport,
        String section504Draft) {

    public CaseRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(status, "status must not be null");
        metrics = metrics != null ? metrics : ThreatMetrics.initial();
    }

    /**
     * Create a newly opened case with default metrics.
     */
    public static CaseRecord open(String id, CaseKey key, String country, long ts) {
        return new CaseRecord(
                id,
                key.value(),
                key.zone(),
                key.ip(),
                key.asn(),
                country,
                ts,
                ts,
                CaseStatus.OPEN,
                ThreatMetrics.initial(),
                null,
                null);
    }

    public CaseKey caseKey() {
        return new CaseKey(zone, ip, asn);
    }

    public Optional<String> abuseReportText() {
        return Optional.ofNullable(abuseReport);
    }

    public Optional<String> section504DraftText() {
        return Optional.ofNullable(section504Draft);
    }

    /**
     * Return a copy whose {@code lastSeen} is the later of the current value and {@code ts}.
     */
    public CaseRecord touchedAt(long ts) {
        if (ts <= lastSeen) {
            return this;
        }
        return new CaseRecord(
                id, key, zone, ip, asn, country, firstSeen, ts, status, metrics, abuseReport, section504Draft);
    }

    /**
     * Return a copy carrying the snapshot fields.
     */
    public CaseRecord withSnapshot(CaseSnapshot snapshot) {
        return new CaseRecord(
                id,
                key,
                zone,
                ip,
                asn,
                country,
                firstSeen,
                snapshot.lastSeen(),
                snapshot.status(),
                snapshot.metrics(),
                snapshot.reports().abuseReport(),
                snapshot.reports().section504Draft());
    }
}
