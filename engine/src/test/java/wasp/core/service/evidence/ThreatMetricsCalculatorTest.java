package wasp.core.service.evidence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import wasp.core.model.admission.Verdict;
import wasp.core.model.evidence.CaseEvent;
import wasp.core.model.evidence.WindowSummary;

@DisplayName("ThreatMetricsCalculator")
class ThreatMetricsCalculatorTest {

    private static final double EPSILON = 1e-9;

    private ThreatMetricsCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new ThreatMetricsCalculator(Duration.ofSeconds(60), 500);
    }

    private static List<CaseEvent> events(Verdict action, int count, double score) {
        final List<CaseEvent> events = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            events.add(new CaseEvent("case-1", "e-" + i, 1_000L * i, "/", "GET", "ua", action, score, 1, "YYZ"));
        }
        return events;
    }

    private static WindowSummary summary(int n, double avgScore, int allowed, int challenged, int tarpitted, int blocked) {
        return new WindowSummary(n, avgScore, allowed, challenged, tarpitted, blocked);
    }

    @Nested
    @DisplayName("compute()")
    class Compute {

        @Test
        @DisplayName("should compute one allowed request per second")
        void shouldComputeSteadyAllowedTraffic() {
            var metrics = calculator.compute(WindowSummary.of(events(Verdict.ALLOW, 60, 0)));

            assertEquals(1.0, metrics.attackRps(), EPSILON);
            assertEquals(1.0 * 2 * 8 / 1024, metrics.estBandwidthMbps(), EPSILON);
            assertEquals(500.0, metrics.systemCapacityRps(), EPSILON);
            assertEquals(0.002, metrics.attackForce(), EPSILON);
            assertEquals(0.0, metrics.defenseForce(), EPSILON);
            assertEquals(0.0, metrics.balanceOfForce(), EPSILON);
            assertEquals(60, metrics.evidenceCount());
            assertEquals(0.0, metrics.justice(), EPSILON);
        }

        @Test
        @DisplayName("should compute a blocked burst with a high average score")
        void shouldComputeBlockedBurst() {
            var window = new ArrayList<CaseEvent>();
            window.addAll(events(Verdict.BLOCK, 30, 10));
            window.addAll(events(Verdict.ALLOW, 20, 10));

            var metrics = calculator.compute(WindowSummary.of(window));

            assertEquals(50.0 / 60, metrics.attackRps(), EPSILON);
            assertEquals(0.5, metrics.defenseForce(), EPSILON);
            assertEquals((50.0 / 60) / 500, metrics.attackForce(), EPSILON);
            assertEquals(0.5 / ((50.0 / 60) / 500), metrics.balanceOfForce(), 1e-6);
            assertEquals(80, metrics.evidenceCount());
            assertTrue(MaterializationTrigger.defaults().fires(metrics));
        }

        @Test
        @DisplayName("should weight challenge, tarpit and block differently")
        void shouldWeightMitigations() {
            var metrics = calculator.compute(summary(3, 0, 0, 1, 1, 1));

            assertEquals((0.6 + 0.9 + 1.0) / 60, metrics.defenseForce(), EPSILON);
        }

        @Test
        @DisplayName("should handle an empty window")
        void shouldHandleEmptyWindow() {
            var metrics = calculator.compute(WindowSummary.of(List.of()));

            assertEquals(0.0, metrics.attackRps(), EPSILON);
            assertEquals(0.0, metrics.attackForce(), EPSILON);
            assertEquals(1.0, metrics.balanceOfForce(), EPSILON);
            assertEquals(0, metrics.evidenceCount());
            assertEquals(1.0 / (1.0 + Math.exp(-6)), metrics.mercy(), EPSILON);
            assertEquals(0.0, metrics.justice(), EPSILON);
        }

        @Test
        @DisplayName("should report no attack force without configured capacity")
        void shouldGuardZeroCapacity() {
            var uncapped = new ThreatMetricsCalculator(Duration.ofSeconds(60), 0);

            var metrics = uncapped.compute(summary(120, 2, 120, 0, 0, 0));

            assertEquals(0.0, metrics.attackForce(), EPSILON);
            assertEquals(1.0, metrics.balanceOfForce(), EPSILON);
        }

        @Test
        @DisplayName("should round evidence to the nearest count")
        void shouldRoundEvidenceHalfUp() {
            assertEquals(3, calculator.compute(summary(1, 0.5, 1, 0, 0, 0)).evidenceCount());
            assertEquals(1, calculator.compute(summary(1, 0.1, 1, 0, 0, 0)).evidenceCount());
        }
    }

    @Nested
    @DisplayName("mercy and justice")
    class MercyAndJustice {

        @Test
        @DisplayName("should give mercy 0.5 at an average score of 6")
        void shouldCenterMercyAtSix() {
            assertEquals(0.5, calculator.compute(summary(1, 6, 1, 0, 0, 0)).mercy());
        }

        @Test
        @DisplayName("should decrease mercy as the average score grows")
        void shouldDecreaseMercy() {
            var previous = Double.MAX_VALUE;
            for (int tenths = 0; tenths <= 200; tenths++) {
                var mercy = calculator.compute(summary(10, tenths / 10.0, 10, 0, 0, 0)).mercy();
                assertTrue(mercy < previous, "mercy did not decrease at " + tenths / 10.0);
                assertTrue(mercy > 0 && mercy < 1);
                previous = mercy;
            }
        }

        @Test
        @DisplayName("should clamp justice to one")
        void shouldClampJustice() {
            var metrics = calculator.compute(summary(10, 24, 0, 0, 0, 10));

            assertEquals(1.0, metrics.justice());
        }

        @Test
        @DisplayName("should combine non-allowed fraction and score")
        void shouldCombineJusticeInputs() {
            var metrics = calculator.compute(summary(4, 3, 2, 1, 1, 0));

            assertEquals(0.5 + 0.25, metrics.justice(), EPSILON);
        }
    }

    @Test
    @DisplayName("should produce identical metrics for an unchanged window")
    void shouldBeDeterministic() {
        var window = new ArrayList<CaseEvent>();
        window.addAll(events(Verdict.CHALLENGE, 7, 5.5));
        window.addAll(events(Verdict.TARPIT, 3, 9.25));

        var first = calculator.compute(WindowSummary.of(window));
        var second = calculator.compute(WindowSummary.of(List.copyOf(window)));

        assertEquals(first, second);
    }
}
