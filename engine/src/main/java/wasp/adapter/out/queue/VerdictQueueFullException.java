package wasp.adapter.out.queue;

/**
 * Thrown when a verdict event is published to a full queue.
 */
public class VerdictQueueFullException extends RuntimeException {

    public VerdictQueueFullException(int capacity) {
        super("Verdict queue is full (capacity " + capacity + ")");
    }
}
