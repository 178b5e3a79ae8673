package wasp.core.port.out;

import io.smallrye.mutiny.Uni;

/**
 * Port for the external challenge verification service.
 */
public interface ChallengeVerifier {

    /**
     * Verify a challenge response token for a client.
     *
     * @param token    the token returned by the challenge widget
     * @param remoteIp the client IP
     * @return true if the verifier accepted the token
     */
    Uni<Boolean> verify(String token, String remoteIp);
}
