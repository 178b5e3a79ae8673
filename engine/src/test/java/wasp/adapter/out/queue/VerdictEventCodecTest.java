package wasp.adapter.out.queue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import wasp.core.model.admission.Verdict;
import wasp.core.model.ingestion.MalformedVerdictEventException;
import wasp.core.model.ingestion.VerdictEvent;

@DisplayName("VerdictEventCodec")
class VerdictEventCodecTest {

    private final VerdictEventCodec codec = new VerdictEventCodec();

    @Nested
    @DisplayName("encode()")
    class Encode {

        @Test
        @DisplayName("should use the wire field names and lowercase verdicts")
        void shouldUseWireNames() {
            var json = codec.encode(new VerdictEvent(
                    1_700_000_000_000L, "203.0.113.9", 64496L, "CA", "curl/8", "/", "GET",
                    Verdict.TARPIT, 71.5, 14, "example.org", "YYZ"));

            assertTrue(json.contains("\"ua\":\"curl/8\""));
            assertTrue(json.contains("\"action\":\"tarpit\""));
            assertFalse(json.contains("userAgent"));
            assertFalse(json.contains("caseKey"));
        }

        @Test
        @DisplayName("should leave out absent fields")
        void shouldOmitNulls() {
            var json = codec.encode(new VerdictEvent(
                    1L, "203.0.113.9", 1L, null, null, "/", "GET", Verdict.ALLOW, 0.0, 1, null, null));

            assertFalse(json.contains("country"));
            assertFalse(json.contains("colo"));
        }
    }

    @Nested
    @DisplayName("decode()")
    class Decode {

        @Test
        @DisplayName("should read a producer payload")
        void shouldDecodePayload() {
            var event = codec.decode("""
                    {"ts":1700000000000,"ip":"203.0.113.9","asn":64496,"country":"CA","ua":"",
                     "path":"/login","method":"POST","action":"block","score":33.0,"hits":31,
                     "zone":"example.org","colo":"YYZ"}""");

            assertEquals(Verdict.BLOCK, event.action());
            assertEquals(1_700_000_000_000L, event.ts());
            assertEquals("", event.userAgent());
            assertEquals(31, event.hits());
        }

        @Test
        @DisplayName("should ignore unknown fields")
        void shouldIgnoreUnknownFields() {
            var event = codec.decode("{\"ip\":\"203.0.113.9\",\"action\":\"allow\",\"ray\":\"abc\"}");

            assertEquals("203.0.113.9", event.ip());
            assertNull(event.ts());
        }

        @Test
        @DisplayName("should reject payloads that are not JSON")
        void shouldRejectGarbage() {
            assertThrows(MalformedVerdictEventException.class, () -> codec.decode("not json"));
        }

        @Test
        @DisplayName("should reject empty payloads")
        void shouldRejectEmpty() {
            assertThrows(MalformedVerdictEventException.class, () -> codec.decode(" "));
            assertThrows(MalformedVerdictEventException.class, () -> codec.decode(null));
        }

        @Test
        @DisplayName("should reject unknown verdicts")
        void shouldRejectUnknownVerdict() {
            assertThrows(MalformedVerdictEventException.class, () -> codec.decode("{\"action\":\"nuke\"}"));
        }
    }
}
