package wasp.adapter.in.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

import wasp.core.model.ingestion.DeadLetter;

/**
 * Response DTO for a dead-lettered verdict event.
 */
public record DeadLetterResponse(
        @JsonProperty("message_id") String messageId,
        @JsonProperty("payload") String payload,
        @JsonProperty("reason") String reason,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("dead_lettered_at") Instant deadLetteredAt) {

    public static DeadLetterResponse fromModel(DeadLetter deadLetter) {
        return new DeadLetterResponse(
                deadLetter.messageId(),
                deadLetter.payload(),
                deadLetter.reason(),
                deadLetter.attempts(),
                deadLetter.deadLetteredAt());
    }
}
