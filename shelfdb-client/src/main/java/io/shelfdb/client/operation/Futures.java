package io.shelfdb.client.operation;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

public final class Futures {

    private Futures() {
    }

    /**
     * Strips the wrappers {@link java.util.concurrent.CompletableFuture} adds around a failure.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Mirrors {@code source} into a future completed on {@code executor}, so that continuations a caller chains on
     * the result never run on the event loop. Falls back to completing in place once the executor is shut down.
     */
    public static <T> CompletableFuture<T> relay(CompletableFuture<T> source, Executor executor) {
        CompletableFuture<T> relayed = new CompletableFuture<>();
        source.whenComplete((value, error) -> {
            Runnable settle = () -> {
                if (error != null) {
                    relayed.completeExceptionally(unwrap(error));
                } else {
                    relayed.complete(value);
                }
            };
            try {
                executor.execute(settle);
            } catch (RejectedExecutionException e) {
                settle.run();
            }
        });
        return relayed;
    }
}
