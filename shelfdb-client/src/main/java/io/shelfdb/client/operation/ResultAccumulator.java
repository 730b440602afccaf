package io.shelfdb.client.operation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Collects the results of a cursor walk and settles once, when the walk is exhausted and every tracked
 * sub-request has settled. The first failure wins and discards what was collected so far.
 * <p>
 * Not thread-safe: all calls happen on the engine's event loop.
 */
public final class ResultAccumulator<T> {

    private final int limit;
    private final List<T> results;
    private final CompletableFuture<List<T>> result;
    private int pending;
    private boolean exhausted;

    public ResultAccumulator() {
        this(0);
    }

    public ResultAccumulator(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        this.limit = limit;
        this.results = new ArrayList<>();
        this.result = new CompletableFuture<>();
    }

    public void append(T value) {
        if (!result.isDone() && !isFull()) {
            results.add(value);
        }
    }

    /**
     * Counts a sub-request as pending until it settles. On success the mapped value is appended unless the
     * mapper is {@code null}; on failure the whole accumulation fails.
     */
    public <R> void track(CompletableFuture<R> subRequest, Function<? super R, ? extends T> confirmation) {
        pending++;
        subRequest.whenComplete((value, error) -> {
            pending--;
            if (error != null) {
                fail(error);
                return;
            }
            if (confirmation != null) {
                append(confirmation.apply(value));
            }
            maybeComplete();
        });
    }

    public void exhausted() {
        exhausted = true;
        maybeComplete();
    }

    public void fail(Throwable error) {
        if (result.completeExceptionally(Futures.unwrap(error))) {
            results.clear();
        }
    }

    public boolean isFull() {
        return limit > 0 && results.size() >= limit;
    }

    public boolean isSettled() {
        return result.isDone();
    }

    public int pending() {
        return pending;
    }

    public CompletableFuture<List<T>> result() {
        return result;
    }

    private void maybeComplete() {
        if (exhausted && pending == 0 && !result.isDone()) {
            result.complete(Collections.unmodifiableList(new ArrayList<>(results)));
        }
    }
}
