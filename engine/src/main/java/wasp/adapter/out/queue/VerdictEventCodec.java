package wasp.adapter.out.queue;

import jakarta.enterprise.context.ApplicationScoped;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import wasp.core.model.ingestion.MalformedVerdictEventException;
import wasp.core.model.ingestion.VerdictEvent;

/**
 * JSON codec for verdict events on the queue.
 *
 * <p>Unknown fields are ignored so producers can add fields ahead of consumers.
 */
@ApplicationScoped
public class VerdictEventCodec {

    private final ObjectMapper objectMapper;

    public VerdictEventCodec() {
        this.objectMapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String encode(VerdictEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode verdict event", e);
        }
    }

    /**
     * @throws MalformedVerdictEventException if the payload is not a verdict event
     */
    public VerdictEvent decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MalformedVerdictEventException("Empty payload", null);
        }
        try {
            return objectMapper.readValue(payload, VerdictEvent.class);
        } catch (JsonProcessingException e) {
            throw new MalformedVerdictEventException("Undecodable payload: " + e.getOriginalMessage(), e);
        }
    }
}
