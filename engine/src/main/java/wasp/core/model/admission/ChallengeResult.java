package wasp.core.model.admission;

import java.time.Duration;

/**
 * Outcome of verifying a challenge response.
 *
 * @param status   whether the client passed
 * @param trustTtl how long the client may be treated as trusted; zero unless passed
 */
public record ChallengeResult(Status status, Duration trustTtl) {

    public static ChallengeResult passed(Duration trustTtl) {
        return new ChallengeResult(Status.PASSED, trustTtl);
    }

    public static ChallengeResult retry() {
        return new ChallengeResult(Status.RETRY, Duration.ZERO);
    }

    public boolean isPassed() {
        return status == Status.PASSED;
    }

    /**
     * Verification status. A failed or inconclusive verification is always a retry, never a block.
     */
    public enum Status {
        PASSED,
        RETRY
    }
}
