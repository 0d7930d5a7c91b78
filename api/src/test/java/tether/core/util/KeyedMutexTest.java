package tether.core.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("KeyedMutex")
class KeyedMutexTest {

    private KeyedMutex mutex;

    @BeforeEach
    void setUp() {
        mutex = new KeyedMutex();
    }

    @Test
    @DisplayName("actions on the same key should run one after another")
    void sameKeySerialized() {
        var gate = new CompletableFuture<String>();
        var secondStarted = new AtomicBoolean();
        var results = new ArrayList<String>();

        mutex.withLock("session-1", () -> Uni.createFrom().completionStage(gate))
                .subscribe()
                .with(results::add);
        mutex.withLock("session-1", () -> {
                    secondStarted.set(true);
                    return Uni.createFrom().item("second");
                })
                .subscribe()
                .with(results::add);

        assertFalse(secondStarted.get());
        assertEquals(1, mutex.activeKeys());

        gate.complete("first");

        assertTrue(secondStarted.get());
        assertEquals(2, results.size());
        assertTrue(results.containsAll(List.of("first", "second")));
        assertEquals(0, mutex.activeKeys());
    }

    @Test
    @DisplayName("actions on different keys should not wait for each other")
    void differentKeysIndependent() {
        var gate = new CompletableFuture<String>();
        var otherStarted = new AtomicBoolean();

        mutex.withLock("session-1", () -> Uni.createFrom().completionStage(gate))
                .subscribe()
                .with(ignored -> {});
        mutex.withLock("session-2", () -> {
                    otherStarted.set(true);
                    return Uni.createFrom().item("other");
                })
                .subscribe()
                .with(ignored -> {});

        assertTrue(otherStarted.get());
        gate.complete("done");
    }

    @Test
    @DisplayName("a failed action should release the key")
    void failureReleases() {
        var failed = mutex.withLock("session-1", () -> Uni.createFrom().<String>failure(new IllegalStateException("boom")))
                .onFailure()
                .recoverWithItem("recovered")
                .await()
                .indefinitely();

        var next = mutex.withLock("session-1", () -> Uni.createFrom().item("next"))
                .await()
                .indefinitely();

        assertEquals("recovered", failed);
        assertEquals("next", next);
        assertEquals(0, mutex.activeKeys());
    }

    @Test
    @DisplayName("the action should only run on subscription")
    void lazy() {
        var started = new AtomicBoolean();

        var uni = mutex.withLock("session-1", () -> {
            started.set(true);
            return Uni.createFrom().voidItem();
        });

        assertFalse(started.get());
        uni.await().indefinitely();
        assertTrue(started.get());
    }
}
