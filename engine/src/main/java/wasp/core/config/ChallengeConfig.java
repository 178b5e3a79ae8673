package wasp.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for challenge verification.
 *
 * <p>Configuration prefix: {@code wasp.challenge}
 */
@ConfigMapping(prefix = "wasp.challenge")
public interface ChallengeConfig {

    /**
     * How long a client stays trusted after passing a challenge.
     *
     * @return trust TTL (default: 30 minutes)
     */
    @WithDefault("PT30M")
    Duration trustTtl();

    /**
     * Maximum time to wait for the verifier.
     *
     * @return verification timeout (default: 5 seconds)
     */
    @WithDefault("PT5S")
    Duration verifyTimeout();
}
