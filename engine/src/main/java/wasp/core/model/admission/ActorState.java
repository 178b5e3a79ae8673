package wasp.core.model.admission;

/**
 * Short-horizon state of one admission actor.
 *
 * <p>Instances are immutable; every evaluation produces a new state that
 * replaces the previous one atomically in the state store.
 *
 * @param hits          requests seen in the current tumbling window
 * @param windowStart   start of the current window, epoch milliseconds
 * @param score         decayed threat score, never negative
 * @param lastUserAgent user agent of the previous request, empty if none
 */
public record ActorState(int hits, long windowStart, double score, String lastUserAgent) {

    public ActorState {
        if (hits < 0) {
            throw new IllegalArgumentException("hits must not be negative");
        }
        if (score < 0) {
            throw new IllegalArgumentException("score must not be negative");
        }
        lastUserAgent = lastUserAgent != null ? lastUserAgent : "";
    }

    /**
     * State of an actor that has not seen any request yet.
     *
     * @param nowMillis the current time
     * @return the initial state
     */
    public static ActorState initial(long nowMillis) {
        return new ActorState(0, nowMillis, 0.0, "");
    }
}
