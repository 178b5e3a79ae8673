package wasp.adapter.out.queue;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import wasp.core.config.IngestionConfig;
import wasp.core.model.ingestion.QueueMessage;
import wasp.core.model.ingestion.VerdictEvent;
import wasp.core.port.out.VerdictQueue;

/**
 * Bounded in-process verdict queue with per-message acknowledgment.
 *
 * <p>
 * New messages are bounded by the configured capacity; publishing to a full
 * queue fails with {@link VerdictQueueFullException}. Redeliveries bypass the
 * bound so a nack can never lose a message.
 *
 * <p>
 * Limitations:
 * <ul>
 * <li>Messages are lost on restart</li>
 * <li>Not shared across instances</li>
 * </ul>
 */
@ApplicationScoped
public class InMemoryVerdictQueue implements VerdictQueue {

    private static final Logger LOG = Logger.getLogger(InMemoryVerdictQueue.class);

    private final BlockingQueue<QueueMessage> pending;
    private final Queue<QueueMessage> redeliveries = new ConcurrentLinkedQueue<>();
    private final ConcurrentMap<String, QueueMessage> inFlight = new ConcurrentHashMap<>();
    private final VerdictEventCodec codec;
    private final Clock clock;
    private final int capacity;

    @Inject
    public InMemoryVerdictQueue(IngestionConfig config, VerdictEventCodec codec, Clock clock) {
        this(config.queueCapacity(), codec, clock);
    }

    public InMemoryVerdictQueue(int capacity, VerdictEventCodec codec, Clock clock) {
        this.capacity = capacity;
        this.pending = new ArrayBlockingQueue<>(capacity);
        this.codec = codec;
        this.clock = clock;
    }

    @Override
    public Uni<Void> publish(VerdictEvent event) {
        return Uni.createFrom().item(() -> {
            offer(codec.encode(event));
            return null;
        });
    }

    /**
     * Enqueue a raw payload.
     *
     * @return the message id
     * @throws VerdictQueueFullException if the queue is at capacity
     */
    public String offer(String payload) {
        final var message = new QueueMessage(UUID.randomUUID().toString(), payload, 1, clock.instant());
        if (!pending.offer(message)) {
            throw new VerdictQueueFullException(capacity);
        }
        return message.id();
    }

    @Override
    public List<QueueMessage> poll(int max) {
        final List<QueueMessage> batch = new ArrayList<>(Math.min(max, 64));
        QueueMessage message;
        while (batch.size() < max && (message = redeliveries.poll()) != null) {
            batch.add(message);
        }
        if (batch.size() < max) {
            pending.drainTo(batch, max - batch.size());
        }
        batch.forEach(m -> inFlight.put(m.id(), m));
        return batch;
    }

    @Override
    public void ack(String messageId) {
        inFlight.remove(messageId);
    }

    @Override
    public void nack(QueueMessage message) {
        if (inFlight.remove(message.id()) == null) {
            LOG.debugf("Nack for unknown message %s ignored", message.id());
            return;
        }
        redeliveries.add(message.redelivery());
    }

    @Override
    public void reject(String messageId) {
        inFlight.remove(messageId);
    }

    @Override
    public int depth() {
        return pending.size() + redeliveries.size();
    }

    @Override
    public int inFlight() {
        return inFlight.size();
    }
}
