package wasp.core.service.common;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;

/**
 * Runs asynchronous tasks one at a time per key.
 *
 * <p>A task submitted for a key starts only after every earlier task for the
 * same key has completed, successfully or not. Tasks for different keys run
 * concurrently. Idle keys hold no memory.
 */
public final class KeyedSerialExecutor {

    private final ConcurrentMap<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    /**
     * Queue a task behind the pending tasks of {@code key}.
     *
     * @param key  serialization key
     * @param task supplier of the task, invoked when the task's turn comes
     * @return the task's result
     */
    public <T> Uni<T> submit(String key, Supplier<Uni<T>> task) {
        return Uni.createFrom().completionStage(() -> enqueue(key, task));
    }

    /**
     * Number of keys with pending or running tasks.
     */
    public int activeKeys() {
        return tails.size();
    }

    private <T> CompletableFuture<T> enqueue(String key, Supplier<Uni<T>> task) {
        final var result = new CompletableFuture<T>();
        final var done = new CompletableFuture<Void>();
        final var released = new CompletableFuture<Void>();

        // Link into the chain inside compute, start outside it
        tails.compute(key, (k, previous) -> {
            final var predecessor = previous != null ? previous : CompletableFuture.<Void>completedFuture(null);
            released.thenCompose(ignored -> predecessor.handle((v, e) -> (Void) null))
                    .thenRun(() -> run(task, result, done));
            return done;
        });
        done.whenComplete((v, e) -> tails.remove(key, done));
        released.complete(null);
        return result;
    }

    private static <T> void run(Supplier<Uni<T>> task, CompletableFuture<T> result, CompletableFuture<Void> done) {
        final Uni<T> uni;
        try {
            uni = task.get();
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            done.complete(null);
            return;
        }
        uni.subscribe().with(item -> {
            done.complete(null);
            result.complete(item);
        }, error -> {
            done.complete(null);
            result.completeExceptionally(error);
        });
    }
}
