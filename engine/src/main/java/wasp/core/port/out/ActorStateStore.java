package wasp.core.port.out;

import java.util.function.UnaryOperator;

import io.smallrye.mutiny.Uni;

import wasp.core.model.admission.ActorState;
import wasp.core.model.admission.IdentityKey;

/**
 * Port for the short-horizon state of admission actors.
 *
 * <p>Implementations must apply {@link #update} atomically per key: two
 * concurrent updates of the same key never observe the same prior state.
 * Updates of different keys must not block each other.
 */
public interface ActorStateStore {

    /**
     * Atomically replace the state of {@code key} with {@code transition(current)}.
     *
     * <p>{@code current} is null when the key has no state (never seen or expired).
     * Storing the result refreshes the key's idle expiration.
     *
     * @param key        the actor identity
     * @param transition pure function from the current state to the next
     * @return the stored state
     */
    Uni<ActorState> update(IdentityKey key, UnaryOperator<ActorState> transition);
}
