package wasp.core.model.ingestion;

import java.util.List;

/**
 * Thrown when a verdict event fails validation. Such events are never retried.
 */
public class InvalidVerdictEventException extends RuntimeException {

    private final List<String> violations;

    public InvalidVerdictEventException(List<String> violations) {
        super("Invalid verdict event: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }
}
