package wasp.core.service.admission;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import wasp.core.model.admission.AdmissionDecision;
import wasp.core.model.admission.AdmissionRequest;
import wasp.core.model.admission.RequestFeatures;
import wasp.core.model.admission.Verdict;
import wasp.core.model.ingestion.VerdictEvent;
import wasp.core.port.out.DefenseMetrics;
import wasp.core.port.out.SecurityMonitoring;
import wasp.core.port.out.VerdictEventPublisher;
import wasp.mock.MutableClock;
import wasp.spi.SecurityEvent;

@DisplayName("EdgeAdmissionService")
@ExtendWith(MockitoExtension.class)
class EdgeAdmissionServiceTest {

    private static final long NOW = 1_700_000_000_000L;

    @Mock
    private AdmissionService admissionService;

    @Mock
    private VerdictEventPublisher publisher;

    @Mock
    private SecurityMonitoring securityMonitoring;

    @Mock
    private DefenseMetrics metrics;

    private EdgeAdmissionService service;

    @BeforeEach
    void setUp() {
        service = new EdgeAdmissionService(
                admissionService,
                publisher,
                securityMonitoring,
                metrics,
                new MutableClock(NOW),
                List.of("/healthz", "/status"));
    }

    private static RequestFeatures features(String path) {
        return new RequestFeatures("192.0.2.10", 13335, "CA", "curl/8", path, "GET", "example.org", "YYZ", false);
    }

    private void decide(Verdict verdict, double score, int hits) {
        when(admissionService.evaluate(any(AdmissionRequest.class)))
                .thenReturn(Uni.createFrom().item(new AdmissionDecision(verdict, score, hits)));
    }

    @Nested
    @DisplayName("bypass")
    class Bypass {

        @Test
        @DisplayName("should allow health checks without evaluating or publishing")
        void shouldBypassHealthChecks() {
            var decision = service.admit(features("/healthz/live")).await().atMost(Duration.ofSeconds(1));

            assertEquals(Verdict.ALLOW, decision.action());
            assertEquals(0, decision.hits());
            verifyNoInteractions(admissionService, publisher, securityMonitoring);
        }

        @Test
        @DisplayName("should evaluate paths that merely contain a bypass prefix")
        void shouldNotBypassOtherPaths() {
            decide(Verdict.ALLOW, 0, 1);
            when(publisher.publish(any())).thenReturn(Uni.createFrom().voidItem());

            service.admit(features("/api/status")).await().atMost(Duration.ofSeconds(1));

            verify(admissionService).evaluate(any());
        }
    }

    @Nested
    @DisplayName("admit()")
    class Admit {

        @Test
        @DisplayName("should publish the verdict event with request metadata")
        void shouldPublishVerdictEvent() {
            decide(Verdict.CHALLENGE, 6.0, 12);
            when(publisher.publish(any())).thenReturn(Uni.createFrom().voidItem());

            var decision = service.admit(features("/login")).await().atMost(Duration.ofSeconds(1));

            assertEquals(Verdict.CHALLENGE, decision.action());
            var captor = ArgumentCaptor.forClass(VerdictEvent.class);
            verify(publisher).publish(captor.capture());
            var event = captor.getValue();
            assertEquals(NOW, event.ts());
            assertEquals("192.0.2.10", event.ip());
            assertEquals(13335L, event.asn());
            assertEquals("CA", event.country());
            assertEquals("curl/8", event.userAgent());
            assertEquals(Verdict.CHALLENGE, event.action());
            assertEquals(6.0, event.score());
            assertEquals(12, event.hits());
            assertEquals("example.org", event.zone());
            assertEquals("YYZ", event.colo());
            verifyNoInteractions(securityMonitoring);
        }

        @Test
        @DisplayName("should keep the verdict when publishing fails")
        void shouldKeepVerdictWhenPublishFails() {
            decide(Verdict.ALLOW, 0, 1);
            when(publisher.publish(any())).thenReturn(Uni.createFrom().failure(new IllegalStateException("full")));

            var decision = service.admit(features("/")).await().atMost(Duration.ofSeconds(1));

            assertEquals(Verdict.ALLOW, decision.action());
            verify(metrics).recordPublishFailure();
        }

        @Test
        @DisplayName("should keep the verdict when the publisher throws")
        void shouldKeepVerdictWhenPublisherThrows() {
            decide(Verdict.ALLOW, 0, 1);
            when(publisher.publish(any())).thenThrow(new IllegalStateException("boom"));

            var decision = service.admit(features("/")).await().atMost(Duration.ofSeconds(1));

            assertEquals(Verdict.ALLOW, decision.action());
            verify(metrics).recordPublishFailure();
        }

        @Test
        @DisplayName("should dispatch a security event for blocked clients")
        void shouldDispatchEscalation() {
            decide(Verdict.BLOCK, 14.0, 130);
            when(publisher.publish(any())).thenReturn(Uni.createFrom().voidItem());

            service.admit(features("/")).await().atMost(Duration.ofSeconds(1));

            var captor = ArgumentCaptor.forClass(SecurityEvent.class);
            verify(securityMonitoring).dispatch(captor.capture());
            var event = assertInstanceOf(SecurityEvent.ClientEscalated.class, captor.getValue());
            assertEquals("192.0.2.10:13335", event.clientIdentifier());
            assertEquals("block", event.verdict());
            assertEquals(SecurityEvent.Severity.WARNING, event.severity());
            verify(metrics, never()).recordPublishFailure();
        }
    }
}
