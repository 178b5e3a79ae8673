package wasp.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for tarpit responses.
 *
 * <p>Configuration prefix: {@code wasp.tarpit}
 */
@ConfigMapping(prefix = "wasp.tarpit")
public interface TarpitConfig {

    /**
     * Total time a tarpitted response is held open.
     *
     * @return duration (default: 15 seconds)
     */
    @WithDefault("PT15S")
    Duration duration();

    /**
     * Delay between two chunks.
     *
     * @return interval (default: 1.1 seconds)
     */
    @WithDefault("PT1.1S")
    Duration interval();
}
