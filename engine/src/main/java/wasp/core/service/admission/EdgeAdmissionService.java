package wasp.core.service.admission;

import java.time.Clock;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import wasp.core.config.AdmissionConfig;
import wasp.core.model.admission.AdmissionDecision;
import wasp.core.model.admission.RequestFeatures;
import wasp.core.model.admission.Verdict;
import wasp.core.model.ingestion.VerdictEvent;
import wasp.core.port.out.DefenseMetrics;
import wasp.core.port.out.SecurityMonitoring;
import wasp.core.port.out.VerdictEventPublisher;
import wasp.spi.SecurityEvent;

/**
 * Entry point for the transport layer: admit one request at the edge.
 *
 * <p>Health-check paths bypass the actor. Every other request is evaluated,
 * its verdict returned to the caller and published as a {@link VerdictEvent}
 * without waiting for the queue. Publish failures are logged and counted but
 * never change the verdict.
 */
@ApplicationScoped
public class EdgeAdmissionService {

    private static final Logger LOG = Logger.getLogger(EdgeAdmissionService.class);

    private final AdmissionService admissionService;
    private final VerdictEventPublisher publisher;
    private final SecurityMonitoring securityMonitoring;
    private final DefenseMetrics metrics;
    private final Clock clock;
    private final List<String> bypassPaths;

    @Inject
    public EdgeAdmissionService(
            AdmissionConfig config,
            AdmissionService admissionService,
            VerdictEventPublisher publisher,
            SecurityMonitoring securityMonitoring,
            DefenseMetrics metrics,
            Clock clock) {
        this(admissionService, publisher, securityMonitoring, metrics, clock, config.bypassPaths());
    }

    public EdgeAdmissionService(
            AdmissionService admissionService,
            VerdictEventPublisher publisher,
            SecurityMonitoring securityMonitoring,
            DefenseMetrics metrics,
            Clock clock,
            List<String> bypassPaths) {
        this.admissionService = admissionService;
        this.publisher = publisher;
        this.securityMonitoring = securityMonitoring;
        this.metrics = metrics;
        this.clock = clock;
        this.bypassPaths = List.copyOf(bypassPaths);
    }

    /**
     * Admit one request.
     *
     * @param features the extracted request features
     * @return the decision to enforce
     */
    public Uni<AdmissionDecision> admit(RequestFeatures features) {
        if (isBypassed(features.path())) {
            return Uni.createFrom().item(AdmissionDecision.bypass());
        }

        return admissionService.evaluate(features.toAdmissionRequest()).invoke(decision -> {
            publish(features, decision);
            escalate(features, decision);
        });
    }

    boolean isBypassed(String path) {
        if (path == null) {
            return false;
        }
        for (var prefix : bypassPaths) {
            if (!prefix.isBlank() && path.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private void publish(RequestFeatures features, AdmissionDecision decision) {
        final var event = VerdictEvent.of(features, decision, clock.millis());
        Uni<Void> publication;
        try {
            publication = publisher.publish(event);
        } catch (RuntimeException e) {
            publication = Uni.createFrom().failure(e);
        }
        publication.subscribe().with(ignored -> {}, error -> {
            LOG.warnf("Failed to publish verdict event for %s:%d: %s", features.ip(), features.asn(), error.getMessage());
            metrics.recordPublishFailure();
        });
    }

    private void escalate(RequestFeatures features, AdmissionDecision decision) {
        if (decision.action() != Verdict.TARPIT && decision.action() != Verdict.BLOCK) {
            return;
        }
        securityMonitoring.dispatch(new SecurityEvent.ClientEscalated(
                clock.instant(),
                features.ip() + ":" + features.asn(),
                features.zone(),
                decision.action().wireName(),
                decision.score(),
                decision.hits()));
    }
}
