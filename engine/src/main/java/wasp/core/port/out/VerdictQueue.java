package wasp.core.port.out;

import java.util.List;

import wasp.core.model.ingestion.QueueMessage;

/**
 * Consumer side of the verdict queue, with per-message acknowledgment.
 *
 * <p>Every polled message is in flight until it is acked, nacked or rejected.
 * A nacked message is delivered again with its attempt number incremented.
 */
public interface VerdictQueue extends VerdictEventPublisher {

    /**
     * Take up to {@code max} messages, redeliveries first.
     */
    List<QueueMessage> poll(int max);

    /**
     * The message was processed; drop it.
     */
    void ack(String messageId);

    /**
     * The message failed transiently; deliver it again.
     */
    void nack(QueueMessage message);

    /**
     * The message will never succeed; drop it without redelivery.
     */
    void reject(String messageId);

    /**
     * Messages waiting for delivery.
     */
    int depth();

    int inFlight();
}
