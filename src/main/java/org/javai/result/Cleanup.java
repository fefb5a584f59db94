package org.javai.result;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * A cleanup clause run once an asynchronous operation has settled, whether it
 * succeeded or failed. The clause receives no argument; it works on whatever it
 * captured from the enclosing scope.
 *
 * <pre>{@code
 * Cleanup.of(() -> lock.unlock());      // synchronous clause
 * () -> connection.closeAsync();        // asynchronous clause
 * }</pre>
 */
@FunctionalInterface
public interface Cleanup {

    /**
     * Starts the cleanup.
     *
     * @return a stage completing when the cleanup has finished
     */
    CompletionStage<?> run();

    /**
     * Adapts a synchronous action. The action runs when {@link #run()} is called.
     */
    static Cleanup of(Runnable action) {
        Objects.requireNonNull(action, "action must not be null");
        return () -> {
            action.run();
            return CompletableFuture.completedFuture(null);
        };
    }
}
