package wasp.adapter.out.queue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import wasp.core.model.ingestion.DeadLetter;

@DisplayName("InMemoryDeadLetterRepository")
class InMemoryDeadLetterRepositoryTest {

    private static DeadLetter letter(String id) {
        return new DeadLetter(id, "{}", "invalid", 1, Instant.EPOCH);
    }

    @Test
    @DisplayName("should list the newest dead letters first")
    void shouldListNewestFirst() {
        var repository = new InMemoryDeadLetterRepository(10);
        repository.record(letter("m1"));
        repository.record(letter("m2"));
        repository.record(letter("m3"));

        var recent = repository.findRecent(2);

        assertEquals(List.of("m3", "m2"), recent.stream().map(DeadLetter::messageId).toList());
    }

    @Test
    @DisplayName("should evict beyond retention but keep counting")
    void shouldEvictOldest() {
        var repository = new InMemoryDeadLetterRepository(2);
        for (int i = 0; i < 5; i++) {
            repository.record(letter("m" + i));
        }

        assertEquals(List.of("m4", "m3"), repository.findRecent(10).stream().map(DeadLetter::messageId).toList());
        assertEquals(5, repository.count());
    }

    @Test
    @DisplayName("should only count when retention is zero")
    void shouldOnlyCountWithoutRetention() {
        var repository = new InMemoryDeadLetterRepository(0);
        repository.record(letter("m1"));

        assertTrue(repository.findRecent(10).isEmpty());
        assertEquals(1, repository.count());
        assertTrue(repository.findRecent(-5).isEmpty());
    }
}
