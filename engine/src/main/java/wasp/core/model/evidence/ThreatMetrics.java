package wasp.core.model.evidence;

/**
 * Derived threat metrics for one case over one evaluation window.
 *
 * @param attackRps         observed request rate
 * @param estBandwidthMbps  estimated attack bandwidth assuming 2 KB per request
 * @param systemCapacityRps configured capacity of the protected system
 * @param attackForce       attack rate relative to capacity ({@code AF})
 * @param defenseForce      weighted mitigation rate ({@code DF})
 * @param balanceOfForce    {@code DF / AF}, 1 when there is no attack force ({@code BoF})
 * @param evidenceCount     evidence factor ({@code EF})
 * @param mercy             logistic mercy factor in (0, 1)
 * @param justice           justice factor in [0, 1]
 */
public record ThreatMetrics(
        double attackRps,
        double estBandwidthMbps,
        double systemCapacityRps,
        double attackForce,
        double defenseForce,
        double balanceOfForce,
        long evidenceCount,
        double mercy,
        double justice) {

    /**
     * Metrics of a freshly created case that has never been materialized.
     *
     * @return the initial metrics
     */
    public static ThreatMetrics initial() {
        return new ThreatMetrics(0, 0, 0, 0, 0, 1, 0, 0.5, 0.5);
    }
}
