package wasp.adapter.out.challenge;

import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.arc.DefaultBean;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import wasp.core.port.out.ChallengeVerifier;

/**
 * Verifier used when no challenge provider is integrated. Rejects every token.
 */
@ApplicationScoped
@DefaultBean
public class UnconfiguredChallengeVerifier implements ChallengeVerifier {

    private static final Logger LOG = Logger.getLogger(UnconfiguredChallengeVerifier.class);

    @Override
    public Uni<Boolean> verify(String token, String remoteIp) {
        LOG.warnf("No challenge verifier configured; rejecting token from %s", remoteIp);
        return Uni.createFrom().item(false);
    }
}
