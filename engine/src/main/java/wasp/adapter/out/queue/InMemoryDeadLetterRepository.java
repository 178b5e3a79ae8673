package wasp.adapter.out.queue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import wasp.core.config.IngestionConfig;
import wasp.core.model.ingestion.DeadLetter;
import wasp.core.port.out.DeadLetterRepository;

/**
 * Keeps the most recent dead letters in memory; older ones are evicted.
 */
@ApplicationScoped
public class InMemoryDeadLetterRepository implements DeadLetterRepository {

    private final Deque<DeadLetter> deadLetters = new ArrayDeque<>();
    private final int retention;
    private long total;

    @Inject
    public InMemoryDeadLetterRepository(IngestionConfig config) {
        this(config.deadLetterRetention());
    }

    public InMemoryDeadLetterRepository(int retention) {
        this.retention = retention;
    }

    @Override
    public synchronized void record(DeadLetter deadLetter) {
        total++;
        if (retention <= 0) {
            return;
        }
        deadLetters.addFirst(deadLetter);
        while (deadLetters.size() > retention) {
            deadLetters.removeLast();
        }
    }

    @Override
    public synchronized List<DeadLetter> findRecent(int limit) {
        return new ArrayList<>(deadLetters).subList(0, Math.min(Math.max(limit, 0), deadLetters.size()));
    }

    @Override
    public synchronized long count() {
        return total;
    }
}
