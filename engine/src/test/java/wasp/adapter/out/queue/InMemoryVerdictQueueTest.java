package wasp.adapter.out.queue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import wasp.core.model.admission.Verdict;
import wasp.core.model.ingestion.VerdictEvent;
import wasp.mock.MutableClock;

@DisplayName("InMemoryVerdictQueue")
class InMemoryVerdictQueueTest {

    private final VerdictEventCodec codec = new VerdictEventCodec();
    private InMemoryVerdictQueue queue;

    @BeforeEach
    void setUp() {
        queue = new InMemoryVerdictQueue(3, codec, new MutableClock(1_000));
    }

    @Nested
    @DisplayName("publishing")
    class Publishing {

        @Test
        @DisplayName("should encode published events")
        void shouldEncodeEvents() {
            var event = new VerdictEvent(
                    5L, "203.0.113.1", 1L, "CA", "", "/", "GET", Verdict.CHALLENGE, 12.0, 9, "z", "c");

            queue.publish(event).await().atMost(Duration.ofSeconds(1));

            var message = queue.poll(10).get(0);
            assertEquals(event, codec.decode(message.payload()));
            assertEquals(1, message.attempt());
            assertEquals(1_000, message.enqueuedAt().toEpochMilli());
        }

        @Test
        @DisplayName("should fail when the queue is full")
        void shouldRejectWhenFull() {
            queue.offer("a");
            queue.offer("b");
            queue.offer("c");

            assertThrows(VerdictQueueFullException.class, () -> queue.offer("d"));
            assertEquals(3, queue.depth());
        }
    }

    @Nested
    @DisplayName("delivery")
    class Delivery {

        @Test
        @DisplayName("should deliver in publish order up to the batch size")
        void shouldDeliverInOrder() {
            queue.offer("a");
            queue.offer("b");
            queue.offer("c");

            var batch = queue.poll(2);

            assertEquals(2, batch.size());
            assertEquals("a", batch.get(0).payload());
            assertEquals("b", batch.get(1).payload());
            assertEquals(2, queue.inFlight());
            assertEquals(1, queue.depth());
        }

        @Test
        @DisplayName("should drop acked messages")
        void shouldAck() {
            queue.offer("a");
            var message = queue.poll(1).get(0);

            queue.ack(message.id());

            assertEquals(0, queue.inFlight());
            assertTrue(queue.poll(1).isEmpty());
        }

        @Test
        @DisplayName("should redeliver nacked messages first with the next attempt")
        void shouldRedeliverNacked() {
            queue.offer("a");
            queue.offer("b");
            var first = queue.poll(1).get(0);

            queue.nack(first);
            var next = queue.poll(1).get(0);

            assertEquals(first.id(), next.id());
            assertEquals(2, next.attempt());
            assertEquals(first.enqueuedAt(), next.enqueuedAt());
        }

        @Test
        @DisplayName("should accept redeliveries beyond capacity")
        void shouldNotLoseRedeliveries() {
            queue.offer("a");
            var message = queue.poll(1).get(0);
            queue.offer("b");
            queue.offer("c");
            queue.offer("d");

            queue.nack(message);

            assertEquals(4, queue.depth());
        }

        @Test
        @DisplayName("should ignore a second settlement of one delivery")
        void shouldIgnoreDuplicateNack() {
            queue.offer("a");
            var message = queue.poll(1).get(0);

            queue.nack(message);
            queue.nack(message);

            assertEquals(1, queue.depth());
        }

        @Test
        @DisplayName("should drop rejected messages without redelivery")
        void shouldReject() {
            queue.offer("a");
            var message = queue.poll(1).get(0);

            queue.reject(message.id());

            assertEquals(0, queue.inFlight());
            assertEquals(0, queue.depth());
        }
    }
}
