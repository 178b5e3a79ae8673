package wasp.core.model.ingestion;

import java.time.Instant;

/**
 * A queue message that was given up on.
 *
 * @param messageId    queue message id
 * @param payload      raw payload
 * @param reason       why the message was dead-lettered
 * @param attempts     delivery attempts made
 * @param deadLetteredAt when it was dead-lettered
 */
public record DeadLetter(String messageId, String payload, String reason, int attempts, Instant deadLetteredAt) {}
