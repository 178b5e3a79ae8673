package wasp.core.model.ingestion;

import java.time.Instant;

/**
 * A delivery of one payload from the verdict queue.
 *
 * @param id         message id, stable across redeliveries
 * @param payload    JSON payload
 * @param attempt    delivery attempt, starting at 1
 * @param enqueuedAt when the payload was first published
 */
public record QueueMessage(String id, String payload, int attempt, Instant enqueuedAt) {

    public QueueMessage redelivery() {
        return new QueueMessage(id, payload, attempt + 1, enqueuedAt);
    }
}
