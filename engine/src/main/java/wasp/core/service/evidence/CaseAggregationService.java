package wasp.core.service.evidence;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import wasp.core.config.AggregationConfig;
import wasp.core.model.evidence.AggregationResult;
import wasp.core.model.evidence.CaseEvent;
import wasp.core.model.evidence.CaseRecord;
import wasp.core.model.evidence.CaseSnapshot;
import wasp.core.model.evidence.CaseStatus;
import wasp.core.model.evidence.ThreatMetrics;
import wasp.core.model.evidence.WindowSummary;
import wasp.core.port.out.CaseRepository;
import wasp.core.port.out.DefenseMetrics;
import wasp.core.port.out.ReportGenerator;
import wasp.core.port.out.SecurityMonitoring;
import wasp.core.service.common.KeyedSerialExecutor;
import wasp.spi.SecurityEvent;

/**
 * Recomputes the threat metrics of a case from its persisted event log and
 * materializes its reports when the trigger fires.
 *
 * <p>Recomputes of one case are serialized; different cases run concurrently.
 * Every recompute reads the trailing window from storage, so events arriving
 * out of order are accounted for by the next recompute.
 */
@ApplicationScoped
public class CaseAggregationService {

    private static final Logger LOG = Logger.getLogger(CaseAggregationService.class);

    private final CaseRepository repository;
    private final ReportGenerator reportGenerator;
    private final DefenseMetrics metrics;
    private final SecurityMonitoring securityMonitoring;
    private final Clock clock;
    private final ThreatMetricsCalculator calculator;
    private final MaterializationTrigger trigger;
    private final long windowMillis;
    private final KeyedSerialExecutor serial = new KeyedSerialExecutor();

    @Inject
    public CaseAggregationService(
            AggregationConfig config,
            CaseRepository repository,
            ReportGenerator reportGenerator,
            DefenseMetrics metrics,
            SecurityMonitoring securityMonitoring,
            Clock clock) {
        this(
                repository,
                reportGenerator,
                metrics,
                securityMonitoring,
                clock,
                new ThreatMetricsCalculator(config.window(), config.systemCapacityRps()),
                MaterializationTrigger.from(config.trigger()),
                config.window().toMillis());
    }

    public CaseAggregationService(
            CaseRepository repository,
            ReportGenerator reportGenerator,
            DefenseMetrics metrics,
            SecurityMonitoring securityMonitoring,
            Clock clock,
            ThreatMetricsCalculator calculator,
            MaterializationTrigger trigger,
            long windowMillis) {
        this.repository = repository;
        this.reportGenerator = reportGenerator;
        this.metrics = metrics;
        this.securityMonitoring = securityMonitoring;
        this.clock = clock;
        this.calculator = calculator;
        this.trigger = trigger;
        this.windowMillis = windowMillis;
    }

    /**
     * Recompute a case, queued behind any pending recompute of the same case.
     *
     * @param caseId the case
     * @return the computed metrics and whether they were materialized
     */
    public Uni<AggregationResult> recompute(String caseId) {
        return serial.submit(caseId, () -> recomputeNow(caseId));
    }

    private Uni<AggregationResult> recomputeNow(String caseId) {
        final var now = clock.millis();
        return repository
                .selectEventsInWindow(caseId, now - windowMillis)
                .map(events -> inWindow(events, now))
                .flatMap(events -> {
                    final var summary = WindowSummary.of(events);
                    final var computed = calculator.compute(summary);
                    if (!trigger.fires(computed)) {
                        LOG.debugf(
                                "Case %s below trigger (n=%d, EF=%d)",
                                caseId, summary.eventCount(), computed.evidenceCount());
                        return Uni.createFrom().item(new AggregationResult(caseId, summary, computed, false));
                    }
                    return materialize(caseId, summary, computed, now);
                });
    }

    private Uni<AggregationResult> materialize(String caseId, WindowSummary summary, ThreatMetrics computed, long now) {
        return repository
                .findById(caseId)
                .map(found -> found.orElseThrow(() -> new IllegalStateException("Case not found: " + caseId)))
                .flatMap(record -> {
                    final var reports =
                            reportGenerator.generate(record.caseKey(), record.country(), summary, computed, now);
                    final var snapshot = new CaseSnapshot(now, CaseStatus.OPEN, computed, reports);
                    return repository
                            .updateCaseSnapshot(caseId, snapshot)
                            .invoke(updated -> {
                                if (updated) {
                                    onMaterialized(record, computed, now);
                                }
                            })
                            .map(updated -> new AggregationResult(caseId, summary, computed, updated));
                });
    }

    private void onMaterialized(CaseRecord record, ThreatMetrics computed, long now) {
        LOG.infof(
                "Materialized case %s (%s): AF=%.2f BoF=%.2f EF=%d",
                record.id(),
                record.key(),
                computed.attackForce(),
                computed.balanceOfForce(),
                computed.evidenceCount());
        metrics.recordMaterialization();
        securityMonitoring.dispatch(new SecurityEvent.CaseMaterialized(
                Instant.ofEpochMilli(now),
                record.ip() + ":" + record.asn(),
                record.id(),
                record.key(),
                computed.attackForce(),
                computed.balanceOfForce(),
                computed.evidenceCount()));
    }

    private static List<CaseEvent> inWindow(List<CaseEvent> events, long now) {
        return events.stream().filter(event -> event.ts() <= now).toList();
    }
}
