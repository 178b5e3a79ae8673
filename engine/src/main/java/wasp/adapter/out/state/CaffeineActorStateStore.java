package wasp.adapter.out.state;

import java.time.Duration;
import java.util.function.UnaryOperator;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.smallrye.mutiny.Uni;

import wasp.core.config.AdmissionConfig;
import wasp.core.model.admission.ActorState;
import wasp.core.model.admission.IdentityKey;
import wasp.core.port.out.ActorStateStore;

/**
 * Actor state held in a Caffeine cache.
 *
 * <p>Updates go through {@code asMap().compute}, which is atomic per key and
 * does not lock other keys. Entries expire after the configured idle time; an
 * expired entry is seen by the next update as absent. The size bound evicts
 * the least valuable identities when more are tracked than configured.
 */
@ApplicationScoped
public class CaffeineActorStateStore implements ActorStateStore {

    private final Cache<String, ActorState> states;

    @Inject
    public CaffeineActorStateStore(AdmissionConfig config) {
        this(config.idleExpiration(), config.maxTrackedKeys(), Ticker.systemTicker());
    }

    public CaffeineActorStateStore(Duration idleExpiration, long maxTrackedKeys, Ticker ticker) {
        this.states = Caffeine.newBuilder()
                .expireAfterAccess(idleExpiration)
                .maximumSize(maxTrackedKeys)
                .ticker(ticker)
                .build();
    }

    @Override
    public Uni<ActorState> update(IdentityKey key, UnaryOperator<ActorState> transition) {
        final var cacheKey = key.toCacheKey();
        return Uni.createFrom().item(() -> states.asMap().compute(cacheKey, (k, current) -> transition.apply(current)));
    }
}
