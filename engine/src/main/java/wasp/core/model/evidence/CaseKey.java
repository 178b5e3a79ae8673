package wasp.core.model.evidence;

import java.util.Objects;

/**
 * Natural key of a case: one attacker identity within one protected zone.
 *
 * @param zone the protected zone
 * @param ip   the client IP
 * @param asn  the autonomous system number
 */
public record CaseKey(String zone, String ip, long asn) {

    public CaseKey {
        Objects.requireNonNull(zone, "zone must not be null");
        Objects.requireNonNull(ip, "ip must not be null");
    }

    /**
     * The persisted key string {@code zone:ip:asn}.
     *
     * @return the key string
     */
    public String value() {
        return zone + ":" + ip + ":" + asn;
    }

    @Override
    public String toString() {
        return value();
    }
}
