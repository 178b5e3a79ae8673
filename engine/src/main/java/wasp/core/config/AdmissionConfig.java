package wasp.core.config;

import java.time.Duration;
import java.util.List;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import wasp.core.model.admission.Verdict;

/**
 * Configuration mapping for the per-identity admission actor.
 *
 * <p>Configuration prefix: {@code wasp.admission}
 *
 * <p>Thresholds are strict: a verdict applies when hits or score are greater
 * than the configured value. Severity is checked from block down to challenge.
 *
 * @see wasp.core.service.admission.AdmissionPolicy
 * @see wasp.core.service.admission.AdmissionService
 */
@ConfigMapping(prefix = "wasp.admission")
public interface AdmissionConfig {

    /**
     * Enable admission evaluation. When disabled every request is allowed.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Length of the tumbling hit-counting window.
     *
     * @return window length (default: 1 second)
     */
    @WithDefault("PT1S")
    Duration window();

    /**
     * Actor state is discarded after this much inactivity.
     *
     * @return idle expiration (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration idleExpiration();

    /**
     * Upper bound on tracked identities held in memory.
     *
     * @return max tracked keys (default: 1,000,000)
     */
    @WithDefault("1000000")
    long maxTrackedKeys();

    @WithDefault("120")
    int blockHits();

    @WithDefault("12")
    double blockScore();

    @WithDefault("70")
    int tarpitHits();

    @WithDefault("8")
    double tarpitScore();

    @WithDefault("30")
    int challengeHits();

    @WithDefault("5")
    double challengeScore();

    /**
     * Verdict returned when actor state cannot be read or written.
     *
     * <p>Must not be {@code ALLOW}.
     *
     * @return fail-safe verdict (default: CHALLENGE)
     */
    @WithDefault("CHALLENGE")
    Verdict failSafeVerdict();

    /**
     * Maximum time to wait for the state store before failing safe.
     *
     * @return store timeout (default: 250 milliseconds)
     */
    @WithDefault("PT0.25S")
    Duration storeTimeout();

    /**
     * Path prefixes that skip evaluation entirely, such as health checks.
     *
     * @return bypass prefixes (default: /healthz, /status)
     */
    @WithDefault("/healthz,/status")
    List<String> bypassPaths();
}
