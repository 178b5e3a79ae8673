package wasp.core.service.evidence;

import wasp.core.config.AggregationConfig;
import wasp.core.model.evidence.ThreatMetrics;

/**
 * Decides whether a case has enough evidence to materialize its reports.
 *
 * @param evidenceCount  fires when {@code EF >= evidenceCount}
 * @param attackForce    fires when {@code AF >= attackForce}
 * @param balanceOfForce fires when {@code BoF < balanceOfForce}
 */
public record MaterializationTrigger(long evidenceCount, double attackForce, double balanceOfForce) {

    public static MaterializationTrigger defaults() {
        return new MaterializationTrigger(50, 1.0, 1.0);
    }

    public static MaterializationTrigger from(AggregationConfig.TriggerConfig config) {
        return new MaterializationTrigger(config.evidenceCount(), config.attackForce(), config.balanceOfForce());
    }

    public boolean fires(ThreatMetrics metrics) {
        return metrics.evidenceCount() >= evidenceCount
                || metrics.attackForce() >= attackForce
                || metrics.balanceOfForce() < balanceOfForce;
    }
}
