package wasp.spi;

/**
 * Receives escalations, materialized cases and dead-lettered verdict events.
 *
 * <p>Handlers are listed in {@code META-INF/services/wasp.spi.SecurityEventHandler}
 * and all run on the dispatcher's single delivery thread, so a slow handler
 * delays the others. The bundled {@code logging} handler sits at priority 0;
 * a pager or SIEM forwarder that must see events first uses a higher value:
 *
 * <pre>{@code
 * public final class AbuseDeskForwarder implements SecurityEventHandler {
 *     public String name() { return "abuse-desk"; }
 *     public int priority() { return 50; }
 *     public boolean isAvailable() { return System.getenv("ABUSE_DESK_URL") != null; }
 *
 *     public void handle(SecurityEvent event) {
 *         if (event instanceof SecurityEvent.CaseMaterialized c) {
 *             desk.open(c.caseId(), c.caseKey());
 *         }
 *     }
 * }
 * }</pre>
 */
public interface SecurityEventHandler {

    String name();

    /** Delivery order, highest first. */
    default int priority() {
        return 0;
    }

    /**
     * Checked once at startup; unavailable handlers never receive events.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Runtime exceptions are logged by the dispatcher and do not stop delivery to
     * the remaining handlers.
     */
    void handle(SecurityEvent event);

    /** Called on shutdown. */
    default void close() {}
}
