package wasp.core.service.admission;

import java.time.Duration;
import java.util.Set;

import wasp.core.config.AdmissionConfig;
import wasp.core.model.admission.ActorState;
import wasp.core.model.admission.AdmissionRequest;
import wasp.core.model.admission.Verdict;

/**
 * Pure admission transition and classification.
 *
 * <p>{@link #advance} is applied inside the state store's atomic update, so it
 * must not have side effects. Each request:
 * <ol>
 *   <li>resets the tumbling window if it has elapsed,</li>
 *   <li>counts one hit,</li>
 *   <li>adds the heuristic delta and decays the score by one, floored at zero.</li>
 * </ol>
 */
public final class AdmissionPolicy {

    private static final String API_PREFIX = "/api/";
    private static final Set<String> SAFE_METHODS = Set.of("GET", "HEAD");

    private static final int API_BURST_HITS = 15;
    private static final int PAGE_BURST_HITS = 35;
    private static final int WRITE_BURST_HITS = 5;
    private static final double DECAY = 1.0;

    private final long windowMillis;
    private final Thresholds thresholds;

    public AdmissionPolicy(Duration window, Thresholds thresholds) {
        this.windowMillis = window.toMillis();
        this.thresholds = thresholds;
    }

    public static AdmissionPolicy from(AdmissionConfig config) {
        return new AdmissionPolicy(
                config.window(),
                new Thresholds(
                        config.blockHits(),
                        config.blockScore(),
                        config.tarpitHits(),
                        config.tarpitScore(),
                        config.challengeHits(),
                        config.challengeScore()));
    }

    public static AdmissionPolicy defaults() {
        return new AdmissionPolicy(Duration.ofSeconds(1), Thresholds.defaults());
    }

    /**
     * Compute the next actor state for one request.
     *
     * @param current   current state, or null if the actor has none
     * @param request   the request
     * @param nowMillis current time
     * @return the next state
     */
    public ActorState advance(ActorState current, AdmissionRequest request, long nowMillis) {
        final var state = current != null ? current : ActorState.initial(nowMillis);

        var hits = state.hits();
        var windowStart = state.windowStart();
        if (nowMillis - windowStart > windowMillis) {
            hits = 0;
            windowStart = nowMillis;
        }
        hits++;

        final var delta = heuristicDelta(state.lastUserAgent(), request, hits);
        final var score = Math.max(0.0, state.score() + delta - DECAY);

        return new ActorState(hits, windowStart, score, request.userAgent());
    }

    /**
     * Map a state to a verdict, most severe first. Trusted clients are always allowed.
     */
    public Verdict classify(ActorState state, boolean trusted) {
        if (trusted) {
            return Verdict.ALLOW;
        }
        final var hits = state.hits();
        final var score = state.score();
        if (hits > thresholds.blockHits() || score > thresholds.blockScore()) {
            return Verdict.BLOCK;
        }
        if (hits > thresholds.tarpitHits() || score > thresholds.tarpitScore()) {
            return Verdict.TARPIT;
        }
        if (hits > thresholds.challengeHits() || score > thresholds.challengeScore()) {
            return Verdict.CHALLENGE;
        }
        return Verdict.ALLOW;
    }

    double heuristicDelta(String lastUserAgent, AdmissionRequest request, int hits) {
        double delta = 0;
        final var path = request.path();
        final var userAgent = request.userAgent();

        if (path.startsWith(API_PREFIX)) {
            if (hits > API_BURST_HITS) {
                delta += 2;
            }
        } else if (hits > PAGE_BURST_HITS) {
            delta += 1;
        }
        if (userAgent.isEmpty() || "-".equals(userAgent)) {
            delta += 1;
        }
        if (!SAFE_METHODS.contains(request.method()) && hits > WRITE_BURST_HITS) {
            delta += 2;
        }
        // UA rotation within one identity
        if (!lastUserAgent.isEmpty() && !lastUserAgent.equals(userAgent)) {
            delta += 1;
        }
        return delta;
    }

    /**
     * Strict verdict thresholds on hits and score.
     */
    public record Thresholds(
            int blockHits,
            double blockScore,
            int tarpitHits,
            double tarpitScore,
            int challengeHits,
            double challengeScore) {

        public static Thresholds defaults() {
            return new Thresholds(120, 12, 70, 8, 30, 5);
        }
    }
}
