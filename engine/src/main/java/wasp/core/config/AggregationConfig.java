package wasp.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for case metric aggregation.
 *
 * <p>Configuration prefix: {@code wasp.aggregation}
 *
 * @see wasp.core.service.evidence.CaseAggregationService
 */
@ConfigMapping(prefix = "wasp.aggregation")
public interface AggregationConfig {

    /**
     * Request rate the protected system can sustain. Zero disables attack force.
     *
     * @return capacity in requests per second (default: 500)
     */
    @WithDefault("500")
    double systemCapacityRps();

    /**
     * Trailing window of events considered by a recompute.
     *
     * @return window length (default: 60 seconds)
     */
    @WithDefault("PT60S")
    Duration window();

    /**
     * Materialization trigger thresholds.
     */
    TriggerConfig trigger();

    /**
     * A case materializes when evidence count reaches {@code evidenceCount},
     * attack force reaches {@code attackForce}, or balance of force drops below
     * {@code balanceOfForce}.
     */
    interface TriggerConfig {

        @WithDefault("50")
        long evidenceCount();

        @WithDefault("1.0")
        double attackForce();

        @WithDefault("1.0")
        double balanceOfForce();
    }
}
