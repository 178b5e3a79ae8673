package wasp.core.service.admission;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.helpers.test.AssertSubscriber;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TarpitService")
class TarpitServiceTest {

    @Nested
    @DisplayName("chunkCount()")
    class ChunkCount {

        @Test
        @DisplayName("should send 14 chunks for the default 15s at 1.1s")
        void shouldMatchDefaults() {
            assertEquals(14, TarpitService.chunkCount(Duration.ofSeconds(15), Duration.ofMillis(1100)));
        }

        @Test
        @DisplayName("should round up partial intervals")
        void shouldRoundUp() {
            assertEquals(3, TarpitService.chunkCount(Duration.ofMillis(250), Duration.ofMillis(100)));
            assertEquals(2, TarpitService.chunkCount(Duration.ofMillis(200), Duration.ofMillis(100)));
        }

        @Test
        @DisplayName("should send nothing for a zero duration")
        void shouldSendNothingForZeroDuration() {
            assertEquals(0, TarpitService.chunkCount(Duration.ZERO, Duration.ofMillis(100)));
        }

        @Test
        @DisplayName("should reject a non-positive interval")
        void shouldRejectNonPositiveInterval() {
            assertThrows(IllegalArgumentException.class, () -> new TarpitService(Duration.ofSeconds(1), Duration.ZERO));
        }
    }

    @Nested
    @DisplayName("drip()")
    class Drip {

        @Test
        @DisplayName("should emit the first chunk at once and complete after all chunks")
        void shouldEmitAllChunks() {
            var service = new TarpitService(Duration.ofMillis(100), Duration.ofMillis(20));

            var subscriber = service.drip().subscribe().withSubscriber(AssertSubscriber.<String>create(Long.MAX_VALUE));

            subscriber.awaitItems(1, Duration.ofMillis(15));
            subscriber.awaitCompletion(Duration.ofSeconds(2));
            assertEquals(5, subscriber.getItems().size());
            assertTrue(subscriber.getItems().stream().allMatch(TarpitService.CHUNK::equals));
        }

        @Test
        @DisplayName("should space chunks one interval apart from the first")
        void shouldSpaceChunksByInterval() {
            var service = new TarpitService(Duration.ofMillis(1000), Duration.ofMillis(200));
            var offsets = new CopyOnWriteArrayList<Long>();
            var start = System.nanoTime();

            var subscriber = service.drip()
                    .onItem()
                    .invoke(chunk -> offsets.add(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)))
                    .subscribe()
                    .withSubscriber(AssertSubscriber.<String>create(Long.MAX_VALUE));
            subscriber.awaitCompletion(Duration.ofSeconds(5));

            assertEquals(5, offsets.size());
            var firstGap = offsets.get(1) - offsets.get(0);
            assertTrue(firstGap >= 150, "second chunk came " + firstGap + "ms after the first");
            assertTrue(offsets.get(4) >= 750, "last chunk at " + offsets.get(4) + "ms");
        }

        @Test
        @DisplayName("should stop emitting once the subscriber cancels")
        void shouldStopOnCancel() throws InterruptedException {
            var service = new TarpitService(Duration.ofSeconds(10), Duration.ofMillis(20));

            var subscriber = service.drip().subscribe().withSubscriber(AssertSubscriber.<String>create(Long.MAX_VALUE));
            subscriber.awaitItems(2, Duration.ofSeconds(1));
            subscriber.cancel();
            Thread.sleep(50);
            var seen = subscriber.getItems().size();

            Thread.sleep(150);

            assertEquals(seen, subscriber.getItems().size());
            subscriber.assertNotTerminated();
        }

        @Test
        @DisplayName("should complete without items for a zero duration")
        void shouldCompleteEmpty() {
            var service = new TarpitService(Duration.ZERO, Duration.ofMillis(20));

            service.drip()
                    .subscribe()
                    .withSubscriber(AssertSubscriber.<String>create(10))
                    .assertCompleted()
                    .assertHasNotReceivedAnyItem();
        }
    }
}
