package wasp.core.service.admission;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import wasp.core.config.ChallengeConfig;
import wasp.core.model.admission.ChallengeResult;
import wasp.core.port.out.ChallengeVerifier;

/**
 * Verifies challenge responses through the external {@link ChallengeVerifier}.
 *
 * <p>Only an explicit acceptance passes. Blank tokens, rejections, verifier
 * errors and timeouts all ask the client to retry.
 */
@ApplicationScoped
public class ChallengeService {

    private static final Logger LOG = Logger.getLogger(ChallengeService.class);

    private final ChallengeVerifier verifier;
    private final Duration trustTtl;
    private final Duration verifyTimeout;

    @Inject
    public ChallengeService(ChallengeConfig config, ChallengeVerifier verifier) {
        this(verifier, config.trustTtl(), config.verifyTimeout());
    }

    public ChallengeService(ChallengeVerifier verifier, Duration trustTtl, Duration verifyTimeout) {
        this.verifier = verifier;
        this.trustTtl = trustTtl;
        this.verifyTimeout = verifyTimeout;
    }

    /**
     * Verify a challenge token.
     *
     * @param token    response token, may be null
     * @param remoteIp client IP
     * @return the result; never fails
     */
    public Uni<ChallengeResult> verify(String token, String remoteIp) {
        if (token == null || token.isBlank()) {
            return Uni.createFrom().item(ChallengeResult.retry());
        }

        return Uni.createFrom()
                .deferred(() -> verifier.verify(token, remoteIp))
                .ifNoItem()
                .after(verifyTimeout)
                .fail()
                .map(accepted -> Boolean.TRUE.equals(accepted) ? ChallengeResult.passed(trustTtl) : ChallengeResult.retry())
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Challenge verification inconclusive for %s: %s", remoteIp, error.toString());
                    return ChallengeResult.retry();
                });
    }

    public Duration trustTtl() {
        return trustTtl;
    }
}
