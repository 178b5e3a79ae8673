package wasp.core.model.admission;

import java.util.Objects;

/**
 * Identifies one admission actor: the client IP together with its autonomous system number.
 *
 * @param ip  the client IP address
 * @param asn the autonomous system number (0 when unknown)
 */
public record IdentityKey(String ip, long asn) {

    public IdentityKey {
        Objects.requireNonNull(ip, "ip must not be null");
    }

    /**
     * Converts this key to the cache key string {@code ip:asn}.
     *
     * @return the cache key string
     */
    public String toCacheKey() {
        return ip + ":" + asn;
    }
}
