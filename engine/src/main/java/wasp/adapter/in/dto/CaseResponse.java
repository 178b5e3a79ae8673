package wasp.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import wasp.core.model.evidence.CaseRecord;

/**
 * Response DTO for a case, using the persisted field names.
 */
public record CaseResponse(
        @JsonProperty("id") String id,
        @JsonProperty("key") String key,
        @JsonProperty("zone") String zone,
        @JsonProperty("ip") String ip,
        @JsonProperty("asn") long asn,
        @JsonProperty("country") String country,
        @JsonProperty("first_seen") long firstSeen,
        @JsonProperty("last_seen") long lastSeen,
        @JsonProperty("status") String status,
        @JsonProperty("attack_rps") double attackRps,
        @JsonProperty("est_bandwidth_mbps") double estBandwidthMbps,
        @JsonProperty("system_capacity_rps") double systemCapacityRps,
        @JsonProperty("AF") double attackForce,
        @JsonProperty("DF") double defenseForce,
        @JsonProperty("BoF") double balanceOfForce,
        @JsonProperty("evidence_count") long evidenceCount,
        @JsonProperty("mercy") double mercy,
        @JsonProperty("justice") double justice,
        @JsonProperty("abuse_report") String abuseReport,
        @JsonProperty("section504_draft") String section504Draft) {

    public static CaseResponse fromModel(CaseRecord record) {
        final var m = record.metrics();
        return new CaseResponse(
                record.id(),
                record.key(),
                record.zone(),
                record.ip(),
                record.asn(),
                record.country(),
                record.firstSeen(),
                record.lastSeen(),
                record.status().name(),
                m.attackRps(),
                m.estBandwidthMbps(),
                m.systemCapacityRps(),
                m.attackForce(),
                m.defenseForce(),
                m.balanceOfForce(),
                m.evidenceCount(),
                m.mercy(),
                m.justice(),
                record.abuseReportText().orElse(null),
                record.section504DraftText().orElse(null));
    }
}
