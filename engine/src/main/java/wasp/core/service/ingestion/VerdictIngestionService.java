package wasp.core.service.ingestion;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import wasp.core.model.evidence.AggregationResult;
import wasp.core.model.ingestion.InvalidVerdictEventException;
import wasp.core.model.ingestion.VerdictEvent;
import wasp.core.port.out.CaseRepository;
import wasp.core.service.evidence.CaseAggregationService;

/**
 * Persists one verdict event: upsert its case, append the event, recompute the case.
 *
 * <p>Invalid events fail with {@link InvalidVerdictEventException} before any
 * write. Storage failures propagate so the caller can redeliver the event;
 * redelivering under the same event id is safe once the append has succeeded,
 * since the repository keeps one event per id and the recompute reads the log.
 */
@ApplicationScoped
public class VerdictIngestionService {

    private static final Logger LOG = Logger.getLogger(VerdictIngestionService.class);

    private final CaseRepository repository;
    private final CaseAggregationService aggregationService;
    private final VerdictEventValidator validator = new VerdictEventValidator();

    public VerdictIngestionService(CaseRepository repository, CaseAggregationService aggregationService) {
        this.repository = repository;
        this.aggregationService = aggregationService;
    }

    /**
     * @param eventId stable id of the delivery, reused on every redelivery
     * @param event   the verdict event
     */
    public Uni<AggregationResult> ingest(String eventId, VerdictEvent event) {
        try {
            validator.validate(event);
        } catch (InvalidVerdictEventException e) {
            return Uni.createFrom().failure(e);
        }

        final var key = event.caseKey();
        return repository
                .upsertCase(key, event.country(), event.ts())
                .flatMap(caseId -> repository
                        .appendEvent(event.toCaseEvent(caseId, eventId))
                        .flatMap(ignored -> aggregationService.recompute(caseId)))
                .invoke(result -> LOG.debugf(
                        "Ingested %s event for case %s (%s)", event.action().wireName(), result.caseId(), key));
    }
}
