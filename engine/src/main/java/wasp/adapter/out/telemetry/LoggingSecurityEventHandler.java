package wasp.adapter.out.telemetry;

import java.util.Locale;

import org.jboss.logging.Logger;

import wasp.spi.SecurityEvent;
import wasp.spi.SecurityEventHandler;

/**
 * Security event handler that logs events under the {@code wasp.security} category.
 *
 * <p>Log levels follow event severity:
 * <ul>
 *   <li>INFO severity → INFO level</li>
 *   <li>WARNING severity → WARN level</li>
 *   <li>CRITICAL severity → ERROR level</li>
 * </ul>
 */
public class LoggingSecurityEventHandler implements SecurityEventHandler {

    private static final Logger LOG = Logger.getLogger("wasp.security");

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public void handle(SecurityEvent event) {
        final var message = format(event);
        switch (event.severity()) {
            case INFO -> LOG.info(message);
            case WARNING -> LOG.warn(message);
            case CRITICAL -> LOG.error(message);
        }
    }

    static String format(SecurityEvent event) {
        if (event instanceof SecurityEvent.ClientEscalated e) {
            return String.format(
                    Locale.ROOT,
                    "CLIENT_ESCALATED: client=%s zone=%s verdict=%s score=%.2f hits=%d",
                    e.clientIdentifier(),
                    e.zone(),
                    e.verdict(),
                    e.score(),
                    e.hits());
        }
        if (event instanceof SecurityEvent.CaseMaterialized e) {
            return String.format(
                    Locale.ROOT,
                    "CASE_MATERIALIZED: client=%s case=%s key=%s AF=%.2f BoF=%.2f EF=%d",
                    e.clientIdentifier(),
                    e.caseId(),
                    e.caseKey(),
                    e.attackForce(),
                    e.balanceOfForce(),
                    e.evidenceCount());
        }
        if (event instanceof SecurityEvent.EventDeadLettered e) {
            return String.format(
                    Locale.ROOT,
                    "EVENT_DEAD_LETTERED: message=%s attempts=%d reason=%s",
                    e.clientIdentifier(), e.attempts(), e.reason());
        }
        return "SECURITY_EVENT: " + event;
    }
}
