package wasp.core.model.ingestion;

/**
 * Thrown when a queue payload cannot be decoded into a verdict event.
 */
public class MalformedVerdictEventException extends RuntimeException {

    public MalformedVerdictEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
