package wasp.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the verdict queue and its consumer.
 *
 * <p>Configuration prefix: {@code wasp.ingestion}
 */
@ConfigMapping(prefix = "wasp.ingestion")
public interface IngestionConfig {

    /**
     * Start the background consumer on application startup.
     *
     * @return true if the consumer runs (default: true)
     */
    @WithDefault("true")
    boolean consumerEnabled();

    /**
     * Maximum number of undelivered messages. Publishing beyond it fails.
     *
     * @return capacity (default: 10000)
     */
    @WithDefault("10000")
    int queueCapacity();

    /**
     * Messages taken per poll.
     *
     * @return batch size (default: 100)
     */
    @WithDefault("100")
    int batchSize();

    /**
     * Delivery attempts before a message is dead-lettered.
     *
     * @return max attempts (default: 5)
     */
    @WithDefault("5")
    int maxAttempts();

    /**
     * Delay between polls of an empty queue.
     *
     * @return poll interval (default: 100 milliseconds)
     */
    @WithDefault("PT0.1S")
    Duration pollInterval();

    /**
     * Longest a single message may spend in ingestion before it is treated as a
     * transient failure and nacked.
     *
     * @return ingestion timeout (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration ingestionTimeout();

    /**
     * Number of dead letters retained for inspection.
     *
     * @return retention (default: 1000)
     */
    @WithDefault("1000")
    int deadLetterRetention();
}
