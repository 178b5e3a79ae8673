package wasp.core.model.ingestion;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import wasp.core.model.admission.AdmissionDecision;
import wasp.core.model.admission.RequestFeatures;
import wasp.core.model.admission.Verdict;
import wasp.core.model.evidence.CaseEvent;
import wasp.core.model.evidence.CaseKey;

/**
 * Verdict event as carried on the verdict queue.
 *
 * <p>Fields are boxed so that a decoded payload with missing fields can be
 * validated and rejected instead of silently defaulting to zero.
 *
 * @param ts        epoch ms of the verdict
 * @param ip        client IP
 * @param asn       autonomous system number
 * @param country   country code
 * @param userAgent user agent, {@code ua} on the wire
 * @param path      request path
 * @param method    HTTP method
 * @param action    verdict, lowercase on the wire
 * @param score     actor score
 * @param hits      actor hits
 * @param zone      protected zone
 * @param colo      edge location tag
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerdictEvent(
        @JsonProperty("ts") Long ts,
        @JsonProperty("ip") String ip,
        @JsonProperty("asn") Long asn,
        @JsonProperty("country") String country,
        @JsonProperty("ua") String userAgent,
        @JsonProperty("path") String path,
        @JsonProperty("method") String method,
        @JsonProperty("action") Verdict action,
        @JsonProperty("score") Double score,
        @JsonProperty("hits") Integer hits,
        @JsonProperty("zone") String zone,
        @JsonProperty("colo") String colo) {

    /**
     * Build the event emitted for an evaluated request.
     */
    public static VerdictEvent of(RequestFeatures features, AdmissionDecision decision, long ts) {
        return new VerdictEvent(
                ts,
                features.ip(),
                features.asn(),
                features.country(),
                features.userAgent() != null ? features.userAgent() : "",
                features.path(),
                features.method(),
                decision.action(),
                decision.score(),
                decision.hits(),
                features.zone(),
                features.colo());
    }

    @JsonIgnore
    public CaseKey caseKey() {
        return new CaseKey(zone != null ? zone : "", ip, asn != null ? asn : 0L);
    }

    /**
     * Convert to the persisted event of the given case. Only valid after validation.
     */
    public CaseEvent toCaseEvent(String caseId, String eventId) {
        return new CaseEvent(
                caseId,
                eventId,
                ts,
                path,
                method,
                userAgent != null ? userAgent : "",
                action,
                score,
                hits,
                colo != null ? colo : "");
    }
}
