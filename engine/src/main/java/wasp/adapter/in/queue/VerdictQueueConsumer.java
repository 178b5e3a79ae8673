package wasp.adapter.in.queue;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import wasp.adapter.out.queue.VerdictEventCodec;
import wasp.core.config.IngestionConfig;
import wasp.core.model.ingestion.DeadLetter;
import wasp.core.model.ingestion.InvalidVerdictEventException;
import wasp.core.model.ingestion.MalformedVerdictEventException;
import wasp.core.model.ingestion.QueueMessage;
import wasp.core.model.ingestion.VerdictEvent;
import wasp.core.port.out.DeadLetterRepository;
import wasp.core.port.out.DefenseMetrics;
import wasp.core.port.out.DefenseMetrics.IngestionOutcome;
import wasp.core.port.out.SecurityMonitoring;
import wasp.core.port.out.VerdictQueue;
import wasp.core.service.ingestion.VerdictIngestionService;
import wasp.spi.SecurityEvent;

/**
 * Drains the verdict queue into the ingestion pipeline.
 *
 * <p>Each message is settled on its own:
 * <ul>
 *   <li>ingested: acked</li>
 *   <li>undecodable or invalid: dead-lettered at once</li>
 *   <li>any other failure, or no result within {@code wasp.ingestion.ingestion-timeout}:
 *       nacked for redelivery, dead-lettered after the last attempt</li>
 * </ul>
 *
 * <p>The message id doubles as the event id, so a redelivery never appends a second copy.
 */
@ApplicationScoped
public class VerdictQueueConsumer {

    private static final Logger LOG = Logger.getLogger(VerdictQueueConsumer.class);

    private final VerdictQueue queue;
    private final VerdictEventCodec codec;
    private final VerdictIngestionService ingestionService;
    private final DeadLetterRepository deadLetters;
    private final DefenseMetrics metrics;
    private final SecurityMonitoring securityMonitoring;
    private final Clock clock;
    private final IngestionConfig config;

    private ScheduledExecutorService scheduler;

    @Inject
    public VerdictQueueConsumer(
            IngestionConfig config,
            VerdictQueue queue,
            VerdictEventCodec codec,
            VerdictIngestionService ingestionService,
            DeadLetterRepository deadLetters,
            DefenseMetrics metrics,
            SecurityMonitoring securityMonitoring,
            Clock clock) {
        this.config = config;
        this.queue = queue;
        this.codec = codec;
        this.ingestionService = ingestionService;
        this.deadLetters = deadLetters;
        this.metrics = metrics;
        this.securityMonitoring = securityMonitoring;
        this.clock = clock;
    }

    void onStart(@Observes StartupEvent event) {
        if (!config.consumerEnabled()) {
            LOG.info("Verdict queue consumer disabled (wasp.ingestion.consumer-enabled=false)");
            return;
        }
        start();
    }

    synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final var thread = new Thread(r, "verdict-queue-consumer");
            thread.setDaemon(true);
            return thread;
        });
        final var delay = config.pollInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::drainSafely, delay, delay, TimeUnit.MILLISECONDS);
        LOG.infof("Verdict queue consumer started (batch=%d, maxAttempts=%d)", config.batchSize(), config.maxAttempts());
    }

    @PreDestroy
    synchronized void shutdown() {
        if (scheduler != null) {
            scheduler.shutdown();
            scheduler = null;
        }
    }

    /**
     * Process one batch of messages concurrently and settle each of them.
     *
     * @return the outcome of each message in the batch
     */
    public Uni<List<IngestionOutcome>> drainOnce() {
        final var batch = queue.poll(config.batchSize());
        if (batch.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }
        return Multi.createFrom()
                .iterable(batch)
                .onItem()
                .transformToUniAndMerge(this::process)
                .collect()
                .asList();
    }

    Uni<IngestionOutcome> process(QueueMessage message) {
        final VerdictEvent event;
        try {
            event = codec.decode(message.payload());
        } catch (MalformedVerdictEventException e) {
            return Uni.createFrom().item(deadLetter(message, e.getMessage()));
        }

        return ingestionService
                .ingest(message.id(), event)
                .ifNoItem()
                .after(config.ingestionTimeout())
                .fail()
                .map(result -> {
                    queue.ack(message.id());
                    metrics.recordIngestion(IngestionOutcome.ACKED);
                    return IngestionOutcome.ACKED;
                })
                .onFailure(InvalidVerdictEventException.class)
                .recoverWithItem(error -> deadLetter(message, error.getMessage()))
                .onFailure()
                .recoverWithItem(error -> retryOrDeadLetter(message, error));
    }

    private IngestionOutcome retryOrDeadLetter(QueueMessage message, Throwable error) {
        if (message.attempt() >= config.maxAttempts()) {
            return deadLetter(
                    message, "Gave up after " + message.attempt() + " attempts: " + error.getMessage());
        }
        LOG.warnf(
                "Ingestion of message %s failed (attempt %d/%d), redelivering: %s",
                message.id(), message.attempt(), config.maxAttempts(), error.getMessage());
        queue.nack(message);
        metrics.recordIngestion(IngestionOutcome.RETRIED);
        return IngestionOutcome.RETRIED;
    }

    private IngestionOutcome deadLetter(QueueMessage message, String reason) {
        LOG.warnf("Dead-lettering message %s after %d attempt(s): %s", message.id(), message.attempt(), reason);
        queue.reject(message.id());
        final var now = clock.instant();
        deadLetters.record(new DeadLetter(message.id(), message.payload(), reason, message.attempt(), now));
        metrics.recordIngestion(IngestionOutcome.DEAD_LETTERED);
        securityMonitoring.dispatch(
                new SecurityEvent.EventDeadLettered(now, message.id(), reason, message.attempt()));
        return IngestionOutcome.DEAD_LETTERED;
    }

    // every message settles within the ingestion timeout; the margin covers settling itself
    private Duration drainTimeout() {
        return config.ingestionTimeout().multipliedBy(2);
    }

    private void drainSafely() {
        try {
            List<IngestionOutcome> outcomes;
            do {
                outcomes = drainOnce().await().atMost(drainTimeout());
            } while (outcomes.size() >= config.batchSize() && !outcomes.contains(IngestionOutcome.RETRIED));
        } catch (RuntimeException e) {
            LOG.errorf(e, "Verdict queue drain failed");
        }
    }
}
