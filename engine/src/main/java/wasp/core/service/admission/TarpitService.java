package wasp.core.service.admission;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;

import wasp.core.config.TarpitConfig;

/**
 * Produces the slow-drip body of a tarpitted response.
 *
 * <p>The first chunk is emitted immediately and one more per interval until
 * the duration has elapsed, {@code ceil(duration / interval)} chunks in total.
 * Cancelling the subscription stops the ticker.
 */
@ApplicationScoped
public class TarpitService {

    static final String CHUNK = ".";

    private final Duration duration;
    private final Duration interval;

    @Inject
    public TarpitService(TarpitConfig config) {
        this(config.duration(), config.interval());
    }

    public TarpitService(Duration duration, Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("wasp.tarpit.interval must be positive");
        }
        this.duration = duration;
        this.interval = interval;
    }

    public Multi<String> drip() {
        final var chunks = chunkCount(duration, interval);
        if (chunks <= 0) {
            return Multi.createFrom().empty();
        }

        final Multi<String> ticks = Multi.createFrom()
                .ticks()
                .startingAfter(interval)
                .every(interval)
                .onOverflow()
                .drop()
                .select()
                .first(chunks - 1)
                .map(tick -> CHUNK);

        return Multi.createBy().concatenating().streams(Multi.createFrom().item(CHUNK), ticks);
    }

    public long chunkCount() {
        return chunkCount(duration, interval);
    }

    static long chunkCount(Duration duration, Duration interval) {
        if (duration.isZero() || duration.isNegative()) {
            return 0;
        }
        final var d = duration.toNanos();
        final var i = interval.toNanos();
        return (d + i - 1) / i;
    }
}
