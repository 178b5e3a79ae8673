package wasp.adapter.out.report;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import wasp.core.config.AggregationConfig;
import wasp.core.model.evidence.CaseKey;
import wasp.core.model.evidence.CaseReports;
import wasp.core.model.evidence.ThreatMetrics;
import wasp.core.model.evidence.WindowSummary;
import wasp.core.port.out.ReportGenerator;

/**
 * Renders the abuse report and the Section 504 information draft as plain text.
 *
 * <p>Metrics are printed with two decimals. The draft is dated with the
 * generation time so the output depends only on the arguments.
 */
@ApplicationScoped
public class PlainTextReportGenerator implements ReportGenerator {

    private static final String ABUSE_TEMPLATE =
            """
            ABUSE REPORT - %s
            Source: %s (AS%d, %s)
            Summary:
            - Est. attack RPS: %s
            - Est. bandwidth: %s Mbps
            - AF (attack force): %s
            - DF (defence force): %s
            - BoF (balance): %s
            - Evidence count (%ds): %d
            - Verdicts: %d allowed, %d challenged, %d tarpitted, %d blocked

            Request: Please investigate and mitigate sources associated with the enclosed evidence.
            This is a good-faith report of interference with lawful computer use.""";

    private static final String SECTION_504_TEMPLATE =
            """
            SECTION 504 INFORMATION - Draft
            I, [Your Name], believe on reasonable grounds that an indictable offence has been committed,
            namely unauthorized use of computer and mischief in relation to data.

            Facts (last %ds window):
            - Estimated attack rate (RPS): %s
            - Estimated bandwidth: %s Mbps
            - AF: %s, DF: %s, BoF: %s
            - Evidence count: %d

            I request that this information be received and that process issue as the justice deems appropriate.
            Date: %s
            Signature: ________________________""";

    private final long windowSeconds;

    @Inject
    public PlainTextReportGenerator(AggregationConfig config) {
        this(config.window());
    }

    public PlainTextReportGenerator(Duration window) {
        this.windowSeconds = window.toSeconds();
    }

    @Override
    public CaseReports generate(
            CaseKey key, String country, WindowSummary summary, ThreatMetrics metrics, long generatedAt) {
        return new CaseReports(abuseReport(key, country, summary, metrics), section504Draft(metrics, generatedAt));
    }

    String abuseReport(CaseKey key, String country, WindowSummary summary, ThreatMetrics m) {
        return ABUSE_TEMPLATE.formatted(
                key.zone(),
                key.ip(),
                key.asn(),
                country != null ? country : "XX",
                fixed(m.attackRps()),
                fixed(m.estBandwidthMbps()),
                fixed(m.attackForce()),
                fixed(m.defenseForce()),
                fixed(m.balanceOfForce()),
                windowSeconds,
                m.evidenceCount(),
                summary.allowed(),
                summary.challenged(),
                summary.tarpitted(),
                summary.blocked());
    }

    String section504Draft(ThreatMetrics m, long generatedAt) {
        return SECTION_504_TEMPLATE.formatted(
                windowSeconds,
                fixed(m.attackRps()),
                fixed(m.estBandwidthMbps()),
                fixed(m.attackForce()),
                fixed(m.defenseForce()),
                fixed(m.balanceOfForce()),
                m.evidenceCount(),
                Instant.ofEpochMilli(generatedAt));
    }

    private static String fixed(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
