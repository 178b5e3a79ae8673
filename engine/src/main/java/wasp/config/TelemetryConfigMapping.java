package wasp.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for metrics and security event monitoring.
 *
 * <p>Example configuration:
 * <pre>{@code
 * wasp.telemetry.enabled=true
 * wasp.telemetry.metrics.enabled=true
 * wasp.telemetry.security.enabled=true
 * wasp.telemetry.security.backlog=10000
 * }</pre>
 */
@ConfigMapping(prefix = "wasp.telemetry")
public interface TelemetryConfigMapping {

    /**
     * Master toggle. When disabled, all sub-features are disabled regardless of their own settings.
     */
    @WithDefault("true")
    boolean enabled();

    MetricsConfig metrics();

    SecurityConfig security();

    interface MetricsConfig {
        /**
         * Record Micrometer counters for verdicts, ingestion and materialization.
         */
        @WithDefault("true")
        boolean enabled();
    }

    interface SecurityConfig {
        /**
         * Dispatch security events to the registered handlers.
         */
        @WithDefault("true")
        boolean enabled();

        /** Undelivered events held before new ones are dropped. */
        @WithDefault("10000")
        int backlog();
    }
}
