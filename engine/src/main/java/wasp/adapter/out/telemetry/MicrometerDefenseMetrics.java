package wasp.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import wasp.config.TelemetryConfigMapping;
import wasp.core.model.admission.Verdict;
import wasp.core.port.out.DefenseMetrics;

/**
 * Records defense metrics using Micrometer.
 *
 * <p>All methods are no-ops when telemetry or metrics are disabled.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code wasp.admission.verdicts} - verdicts issued, by action</li>
 *   <li>{@code wasp.admission.failsafe} - evaluations answered with the fail-safe verdict</li>
 *   <li>{@code wasp.verdicts.publish.failures} - verdict events that could not be queued</li>
 *   <li>{@code wasp.ingestion.messages} - settled queue deliveries, by outcome</li>
 *   <li>{@code wasp.cases.materialized} - case snapshots written</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerDefenseMetrics implements DefenseMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerDefenseMetrics(MeterRegistry registry, TelemetryConfigMapping config) {
        this(registry, config != null && config.enabled() && config.metrics().enabled());
    }

    public MicrometerDefenseMetrics(MeterRegistry registry, boolean enabled) {
        this.registry = registry;
        this.enabled = enabled;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordVerdict(Verdict verdict) {
        if (!enabled) {
            return;
        }
        Counter.builder("wasp.admission.verdicts")
                .description("Admission verdicts issued")
                .tag("action", verdict.wireName())
                .register(registry)
                .increment();
    }

    @Override
    public void recordFailSafe() {
        if (!enabled) {
            return;
        }
        Counter.builder("wasp.admission.failsafe")
                .description("Admission evaluations answered with the fail-safe verdict")
                .register(registry)
                .increment();
    }

    @Override
    public void recordPublishFailure() {
        if (!enabled) {
            return;
        }
        Counter.builder("wasp.verdicts.publish.failures")
                .description("Verdict events that could not be queued")
                .register(registry)
                .increment();
    }

    @Override
    public void recordIngestion(IngestionOutcome outcome) {
        if (!enabled) {
            return;
        }
        Counter.builder("wasp.ingestion.messages")
                .description("Verdict queue deliveries by outcome")
                .tag("outcome", outcome.tagValue())
                .register(registry)
                .increment();
    }

    @Override
    public void recordMaterialization() {
        if (!enabled) {
            return;
        }
        Counter.builder("wasp.cases.materialized")
                .description("Case snapshots written")
                .register(registry)
                .increment();
    }
}
