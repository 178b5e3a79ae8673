package wasp.core.model.admission;

import java.util.Locale;
import java.util.Objects;

/**
 * Features of one request as seen by the admission actor.
 *
 * @param ip        client IP address
 * @param asn       autonomous system number
 * @param userAgent user agent header, empty when absent
 * @param path      request path
 * @param method    HTTP method, upper case
 * @param trusted   whether the client holds proof of a previously passed challenge
 */
public record AdmissionRequest(String ip, long asn, String userAgent, String path, String method, boolean trusted) {

    public AdmissionRequest {
        Objects.requireNonNull(ip, "ip must not be null");
        userAgent = userAgent != null ? userAgent : "";
        path = path != null ? path : "";
        method = method != null ? method.toUpperCase(Locale.ROOT) : "";
    }

    public IdentityKey identityKey() {
        return new IdentityKey(ip, asn);
    }
}
