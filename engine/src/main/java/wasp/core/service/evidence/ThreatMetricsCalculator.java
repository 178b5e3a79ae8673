package wasp.core.service.evidence;

import java.time.Duration;

import wasp.core.model.evidence.ThreatMetrics;
import wasp.core.model.evidence.WindowSummary;

/**
 * Computes the threat metrics of one case window.
 *
 * <p>Pure and deterministic: the same summary always yields bit-identical metrics.
 * <ul>
 *   <li>{@code attackRps = n / W}</li>
 *   <li>{@code estBandwidthMbps = attackRps * 2 * 8 / 1024}</li>
 *   <li>{@code AF = attackRps / capacity}, 0 without capacity</li>
 *   <li>{@code DF = (challenged * 0.6 + tarpitted * 0.9 + blocked) / W}</li>
 *   <li>{@code BoF = DF / AF}, 1 without attack force</li>
 *   <li>{@code EF = round(n + avgScore * 3)}</li>
 *   <li>{@code mercy = 1 / (1 + e^(avgScore - 6))}</li>
 *   <li>{@code justice = clamp(nonAllowed / n + avgScore / 12, 0, 1)}</li>
 * </ul>
 */
public final class ThreatMetricsCalculator {

    private static final double AVG_REQUEST_KB = 2.0;
    private static final double CHALLENGE_WEIGHT = 0.6;
    private static final double TARPIT_WEIGHT = 0.9;
    private static final double BLOCK_WEIGHT = 1.0;
    private static final double EVIDENCE_SCORE_WEIGHT = 3.0;
    private static final double MERCY_MIDPOINT = 6.0;
    private static final double JUSTICE_SCORE_SCALE = 12.0;

    private final double windowSeconds;
    private final double systemCapacityRps;

    public ThreatMetricsCalculator(Duration window, double systemCapacityRps) {
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("wasp.aggregation.window must be positive");
        }
        this.windowSeconds = window.toMillis() / 1000.0;
        this.systemCapacityRps = systemCapacityRps;
    }

    public ThreatMetrics compute(WindowSummary summary) {
        final var n = summary.eventCount();
        final var avgScore = summary.averageScore();

        final var attackRps = n / windowSeconds;
        final var bandwidth = attackRps * AVG_REQUEST_KB * 8 / 1024;
        final var attackForce = systemCapacityRps > 0 ? attackRps / systemCapacityRps : 0.0;
        final var defenseForce = (summary.challenged() * CHALLENGE_WEIGHT
                        + summary.tarpitted() * TARPIT_WEIGHT
                        + summary.blocked() * BLOCK_WEIGHT)
                / windowSeconds;
        final var balanceOfForce = attackForce > 0 ? defenseForce / attackForce : 1.0;
        final var evidenceCount = Math.round(n + avgScore * EVIDENCE_SCORE_WEIGHT);
        final var mercy = 1.0 / (1.0 + Math.exp(avgScore - MERCY_MIDPOINT));
        final var nonAllowFraction = n > 0 ? (double) summary.nonAllowed() / n : 0.0;
        final var justice = clamp(nonAllowFraction + avgScore / JUSTICE_SCORE_SCALE);

        return new ThreatMetrics(
                attackRps,
                bandwidth,
                systemCapacityRps,
                attackForce,
                defenseForce,
                balanceOfForce,
                evidenceCount,
                mercy,
                justice);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
