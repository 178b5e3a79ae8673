package wasp.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import wasp.spi.SecurityEvent;

@DisplayName("LoggingSecurityEventHandler")
class LoggingSecurityEventHandlerTest {

    private final LoggingSecurityEventHandler handler = new LoggingSecurityEventHandler();

    @Nested
    @DisplayName("format()")
    class Format {

        @Test
        @DisplayName("should describe an escalated client")
        void shouldFormatClientEscalated() {
            var event = new SecurityEvent.ClientEscalated(
                    Instant.EPOCH, "203.0.113.4:64496", "example.org", "tarpit", 71.456, 14);

            assertEquals(
                    "CLIENT_ESCALATED: client=203.0.113.4:64496 zone=example.org verdict=tarpit score=71.46 hits=14",
                    LoggingSecurityEventHandler.format(event));
        }

        @Test
        @DisplayName("should describe a materialized case")
        void shouldFormatCaseMaterialized() {
            var event = new SecurityEvent.CaseMaterialized(
                    Instant.EPOCH, "203.0.113.4:64496", "c-1", "example.org:203.0.113.4:64496", 1.25, 0.4, 80);

            assertEquals(
                    "CASE_MATERIALIZED: client=203.0.113.4:64496 case=c-1 key=example.org:203.0.113.4:64496"
                            + " AF=1.25 BoF=0.40 EF=80",
                    LoggingSecurityEventHandler.format(event));
        }

        @Test
        @DisplayName("should describe a dead-lettered event")
        void shouldFormatEventDeadLettered() {
            var event = new SecurityEvent.EventDeadLettered(Instant.EPOCH, "m-1", "ip is required", 1);

            assertEquals(
                    "EVENT_DEAD_LETTERED: message=m-1 attempts=1 reason=ip is required",
                    LoggingSecurityEventHandler.format(event));
        }
    }

    @Nested
    @DisplayName("severity")
    class Severity {

        @Test
        @DisplayName("should raise a critical case above capacity")
        void shouldMapCaseSeverity() {
            var critical = new SecurityEvent.CaseMaterialized(Instant.EPOCH, "c", "id", "k", 1.0, 0.5, 60);
            var warning = new SecurityEvent.CaseMaterialized(Instant.EPOCH, "c", "id", "k", 0.2, 0.5, 60);

            assertEquals(SecurityEvent.Severity.CRITICAL, critical.severity());
            assertEquals(SecurityEvent.Severity.WARNING, warning.severity());
        }

        @Test
        @DisplayName("should log every severity without failing")
        void shouldHandleEverySeverity() {
            assertDoesNotThrow(() -> {
                handler.handle(new SecurityEvent.ClientEscalated(Instant.EPOCH, "c", "z", "tarpit", 1, 1));
                handler.handle(new SecurityEvent.ClientEscalated(Instant.EPOCH, "c", "z", "block", 1, 1));
                handler.handle(new SecurityEvent.CaseMaterialized(Instant.EPOCH, "c", "id", "k", 2.0, 0.5, 60));
            });
        }
    }
}
