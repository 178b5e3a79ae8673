package wasp.core.service.admission;

import java.time.Clock;
import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import wasp.core.config.AdmissionConfig;
import wasp.core.model.admission.AdmissionDecision;
import wasp.core.model.admission.AdmissionRequest;
import wasp.core.model.admission.Verdict;
import wasp.core.port.out.ActorStateStore;
import wasp.core.port.out.DefenseMetrics;

/**
 * Per-identity admission actor.
 *
 * <p>Each evaluation is one atomic read-modify-write of the identity's state
 * in the {@link ActorStateStore}; evaluations of one identity are therefore
 * serialized while different identities proceed independently.
 *
 * <p>If the store fails or does not answer within the configured timeout, the
 * configured fail-safe verdict is returned with zero score and hits. This also
 * applies to trusted requests: an internal error never results in an allow.
 */
@ApplicationScoped
public class AdmissionService {

    private static final Logger LOG = Logger.getLogger(AdmissionService.class);

    private final ActorStateStore stateStore;
    private final AdmissionPolicy policy;
    private final DefenseMetrics metrics;
    private final Clock clock;
    private final boolean enabled;
    private final Verdict failSafeVerdict;
    private final Duration storeTimeout;

    @Inject
    public AdmissionService(
            AdmissionConfig config, ActorStateStore stateStore, DefenseMetrics metrics, Clock clock) {
        this(
                AdmissionPolicy.from(config),
                stateStore,
                metrics,
                clock,
                config.enabled(),
                config.failSafeVerdict(),
                config.storeTimeout());
    }

    public AdmissionService(
            AdmissionPolicy policy,
            ActorStateStore stateStore,
            DefenseMetrics metrics,
            Clock clock,
            boolean enabled,
            Verdict failSafeVerdict,
            Duration storeTimeout) {
        if (failSafeVerdict == null || failSafeVerdict == Verdict.ALLOW) {
            throw new IllegalArgumentException(
                    "wasp.admission.fail-safe-verdict must be one of challenge, tarpit, block");
        }
        this.policy = policy;
        this.stateStore = stateStore;
        this.metrics = metrics;
        this.clock = clock;
        this.enabled = enabled;
        this.failSafeVerdict = failSafeVerdict;
        this.storeTimeout = storeTimeout;
    }

    /**
     * Evaluate one request and return its verdict.
     *
     * @param request the request features
     * @return the decision; never fails
     */
    public Uni<AdmissionDecision> evaluate(AdmissionRequest request) {
        if (!enabled) {
            return Uni.createFrom().item(AdmissionDecision.bypass());
        }

        final var key = request.identityKey();
        final var nowMillis = clock.millis();

        return Uni.createFrom()
                .deferred(() -> stateStore.update(key, current -> policy.advance(current, request, nowMillis)))
                .ifNoItem()
                .after(storeTimeout)
                .fail()
                .map(state -> new AdmissionDecision(
                        policy.classify(state, request.trusted()), state.score(), state.hits()))
                .invoke(decision -> metrics.recordVerdict(decision.action()))
                .onFailure()
                .recoverWithItem(error -> failSafe(key.toCacheKey(), error));
    }

    private AdmissionDecision failSafe(String cacheKey, Throwable error) {
        LOG.warnf("Actor state unavailable for %s, returning %s: %s", cacheKey, failSafeVerdict, error.toString());
        metrics.recordFailSafe();
        metrics.recordVerdict(failSafeVerdict);
        return AdmissionDecision.failSafe(failSafeVerdict);
    }

    public boolean isEnabled() {
        return enabled;
    }
}
