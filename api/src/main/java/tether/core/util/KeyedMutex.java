package tether.core.util;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;

/**
 * Serializes asynchronous actions that share a key.
 *
 * <p>Actions on the same key run one after another in subscription order; actions on
 * different keys run independently. Nothing blocks: a waiting action is chained onto
 * the completion of its predecessor. Only callers in the same JVM are serialized.
 *
 * <p>An action must not acquire the same key again, or it waits on itself.
 */
public final class KeyedMutex {

    private final ConcurrentHashMap<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    /**
     * Run {@code action} once every earlier action on {@code key} has terminated.
     *
     * @param key    serialization key
     * @param action action to run while holding the key
     * @param <T>    result type
     * @return a Uni that runs the action on subscription
     */
    public <T> Uni<T> withLock(String key, Supplier<Uni<T>> action) {
        return Uni.createFrom().deferred(() -> {
            final var released = new CompletableFuture<Void>();
            final var previous = tails.put(key, released);
            final Uni<Void> acquired = previous == null
                    ? Uni.createFrom().voidItem()
                    : Uni.createFrom().completionStage(previous);
            return acquired.chain(ignored -> action.get()).onTermination().invoke(() -> {
                released.complete(null);
                tails.remove(key, released);
            });
        });
    }

    /**
     * Number of keys with an action in flight or queued.
     */
    public int activeKeys() {
        return tails.size();
    }
}
