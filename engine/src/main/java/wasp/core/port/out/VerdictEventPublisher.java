package wasp.core.port.out;

import io.smallrye.mutiny.Uni;

import wasp.core.model.ingestion.VerdictEvent;

/**
 * Port for emitting verdict events towards the ingestion pipeline.
 */
public interface VerdictEventPublisher {

    /**
     * Enqueue an event for asynchronous ingestion.
     *
     * @param event the verdict event
     * @return completes once the event is accepted by the queue
     */
    Uni<Void> publish(VerdictEvent event);
}
