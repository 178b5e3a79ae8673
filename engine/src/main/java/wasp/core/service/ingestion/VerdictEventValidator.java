package wasp.core.service.ingestion;

import java.util.ArrayList;
import java.util.List;

import wasp.core.model.ingestion.InvalidVerdictEventException;
import wasp.core.model.ingestion.VerdictEvent;

/**
 * Validates decoded verdict events before anything is written.
 */
public final class VerdictEventValidator {

    /**
     * Collect every violation of an event.
     *
     * @param event decoded event, may be null
     * @return violations, empty if the event is valid
     */
    public List<String> violations(VerdictEvent event) {
        final List<String> violations = new ArrayList<>();
        if (event == null) {
            violations.add("event is empty");
            return violations;
        }
        if (event.ts() == null || event.ts() <= 0) {
            violations.add("ts must be positive");
        }
        if (isBlank(event.ip())) {
            violations.add("ip is required");
        }
        if (event.asn() == null || event.asn() < 0) {
            violations.add("asn must be zero or positive");
        }
        if (event.action() == null) {
            violations.add("action is required");
        }
        if (event.score() == null || !Double.isFinite(event.score()) || event.score() < 0) {
            violations.add("score must be a finite non-negative number");
        }
        if (event.hits() == null || event.hits() < 0) {
            violations.add("hits must be zero or positive");
        }
        if (isBlank(event.method())) {
            violations.add("method is required");
        }
        if (event.path() == null || event.path().isEmpty()) {
            violations.add("path is required");
        }
        return violations;
    }

    /**
     * @throws InvalidVerdictEventException if the event has any violation
     */
    public void validate(VerdictEvent event) {
        final var violations = violations(event);
        if (!violations.isEmpty()) {
            throw new InvalidVerdictEventException(violations);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
