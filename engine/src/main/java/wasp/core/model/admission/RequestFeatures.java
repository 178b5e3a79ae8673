package wasp.core.model.admission;

import java.util.Objects;

/**
 * Request features extracted by the transport layer at the edge.
 *
 * <p>Carries everything the admission actor needs plus the routing metadata
 * (country, zone, edge location) recorded on the emitted verdict event.
 *
 * @param ip        client IP address
 * @param asn       autonomous system number
 * @param country   ISO country code, {@code XX} when unknown
 * @param userAgent user agent header
 * @param path      request path
 * @param method    HTTP method
 * @param zone      the protected zone (site) name
 * @param colo      edge location tag
 * @param trusted   whether the client presented a valid challenge pass
 */
public record RequestFeatures(
        String ip,
        long asn,
        String country,
        String userAgent,
        String path,
        String method,
        String zone,
        String colo,
        boolean trusted) {

    public RequestFeatures {
        Objects.requireNonNull(ip, "ip must not be null");
        country = country != null && !country.isBlank() ? country : "XX";
        zone = zone != null ? zone : "";
        colo = colo != null ? colo : "";
    }

    public AdmissionRequest toAdmissionRequest() {
        return new AdmissionRequest(ip, asn, userAgent, path, method, trusted);
    }
}
