package wasp.adapter.out.telemetry;

import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import wasp.config.TelemetryConfigMapping;
import wasp.core.port.out.SecurityMonitoring;
import wasp.spi.SecurityEvent;
import wasp.spi.SecurityEventHandler;

/**
 * Hands security events to the {@link SecurityEventHandler}s found on the classpath.
 *
 * <p>Handlers run in descending priority on one background thread. The
 * backlog is bounded: under an attack escalations arrive far faster than a
 * remote handler can take them, so events beyond the backlog are dropped and
 * counted instead of queued.
 */
@ApplicationScoped
public class SecurityEventDispatcher implements SecurityMonitoring {

    private static final Logger LOG = Logger.getLogger(SecurityEventDispatcher.class);

    private final boolean enabled;
    private final int backlog;
    private final AtomicLong dropped = new AtomicLong();

    private List<SecurityEventHandler> handlers = List.of();
    private ThreadPoolExecutor executor;

    @Inject
    public SecurityEventDispatcher(TelemetryConfigMapping config) {
        this.enabled = config != null && config.enabled() && config.security().enabled();
        this.backlog = enabled ? config.security().backlog() : 0;
    }

    SecurityEventDispatcher(List<SecurityEventHandler> candidates, int backlog) {
        this.enabled = true;
        this.backlog = backlog;
        start(candidates, backlog);
    }

    @PostConstruct
    void init() {
        if (!enabled) {
            LOG.debug("Security monitoring disabled, security events will be dropped");
            return;
        }
        start(ServiceLoader.load(SecurityEventHandler.class).stream()
                .map(ServiceLoader.Provider::get)
                .toList(), backlog);
    }

    private void start(List<SecurityEventHandler> candidates, int backlog) {
        handlers = candidates.stream()
                .filter(SecurityEventHandler::isAvailable)
                .sorted(Comparator.comparingInt(SecurityEventHandler::priority).reversed())
                .toList();
        if (handlers.isEmpty()) {
            LOG.warn("No security event handlers available");
            return;
        }
        LOG.infof("Security event handlers: %s", handlers.stream().map(SecurityEventHandler::name).toList());

        executor = new ThreadPoolExecutor(
                1,
                1,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(backlog),
                task -> {
                    final var thread = new Thread(task, "wasp-security-events");
                    thread.setDaemon(true);
                    return thread;
                },
                (task, pool) -> onOverflow());
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
        for (var handler : handlers) {
            try {
                handler.close();
            } catch (RuntimeException e) {
                LOG.warnf("Closing security event handler %s failed: %s", handler.name(), e.getMessage());
            }
        }
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void dispatch(SecurityEvent event) {
        if (!enabled || executor == null) {
            return;
        }
        executor.execute(() -> deliver(event));
    }

    private void deliver(SecurityEvent event) {
        for (var handler : handlers) {
            try {
                handler.handle(event);
            } catch (RuntimeException e) {
                LOG.warnf("Security event handler %s failed on %s: %s",
                        handler.name(), event.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    private void onOverflow() {
        final var total = dropped.incrementAndGet();
        // one line per thousand drops
        if (total % 1000 == 1) {
            LOG.warnf("Security event backlog full, %d event(s) dropped so far", total);
        }
    }

    /**
     * Events dropped because the backlog was full.
     */
    public long droppedEvents() {
        return dropped.get();
    }

    public List<SecurityEventHandler> handlers() {
        return handlers;
    }
}
