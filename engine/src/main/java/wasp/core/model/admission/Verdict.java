package wasp.core.model.admission;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Admission verdict for a single request, ordered from least to most severe.
 *
 * <p>The wire form is the lowercase name ({@code allow}, {@code challenge},
 * {@code tarpit}, {@code block}).
 */
public enum Verdict {
    ALLOW,
    CHALLENGE,
    TARPIT,
    BLOCK;

    /**
     * Return the lowercase wire name of this verdict.
     *
     * @return the wire name
     */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a verdict from its wire name (case-insensitive).
     *
     * @param value the wire name
     * @return the verdict
     * @throws IllegalArgumentException if the value is null or unknown
     */
    @JsonCreator
    public static Verdict fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("verdict must not be null");
        }
        for (Verdict verdict : values()) {
            if (verdict.name().equalsIgnoreCase(value.trim())) {
                return verdict;
            }
        }
        throw new IllegalArgumentException("Unknown verdict: " + value);
    }
}
