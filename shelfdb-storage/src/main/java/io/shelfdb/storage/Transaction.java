package io.shelfdb.storage;

import io.shelfdb.common.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * An atomic unit of work over a fixed set of object stores.
 * <p>
 * Requests run on the engine's event loop in the order they are issued. The first failing request aborts the
 * transaction and rolls back every write made through it. {@link #commit()} stops accepting new requests and
 * completes {@link #completion()} once the requests already issued have settled.
 */
public final class Transaction implements ScopedTask {
    private static final Logger log = LoggerFactory.getLogger(Transaction.class);

    public enum State {
        ACTIVE,
        COMMITTING,
        COMMITTED,
        ABORTED
    }

    private final long id;
    private final DatabaseState database;
    private final List<String> storeNames;
    private final EventLoop loop;
    private final UndoLog undoLog;
    private final Deque<Runnable> deferred;
    private final Map<String, ObjectStoreHandle> handles;
    private final CompletableFuture<Void> completion;

    private volatile State state;
    private boolean started;
    private int pending;

    Transaction(long id, DatabaseState database, List<String> storeNames, EventLoop loop) {
        this.id = id;
        this.database = database;
        this.storeNames = List.copyOf(storeNames);
        this.loop = loop;
        this.undoLog = new UndoLog();
        this.deferred = new ArrayDeque<>();
        this.handles = new HashMap<>();
        this.completion = new CompletableFuture<>();
        this.state = State.ACTIVE;
    }

    public long id() {
        return id;
    }

    public List<String> storeNames() {
        return storeNames;
    }

    public State state() {
        return state;
    }

    public boolean isActive() {
        return state == State.ACTIVE;
    }

    /**
     * Completes when the transaction commits; fails with {@link StorageException.TransactionAborted} when it aborts.
     */
    public CompletableFuture<Void> completion() {
        return completion;
    }

    public EventLoop eventLoop() {
        return loop;
    }

    public synchronized ObjectStoreHandle objectStore(String name) {
        if (!storeNames.contains(name)) {
            throw new StorageException.NotFound("Store '" + name + "' is not in the scope of transaction " + id);
        }
        return handles.computeIfAbsent(name, n -> new ObjectStoreHandle(this, n));
    }

    public void commit() {
        loop.runInLoop(() -> {
            if (state != State.ACTIVE) {
                return;
            }
            state = State.COMMITTING;
            log.debug("Transaction {} commit requested with {} pending requests", id, pending);
            maybeFinishCommit();
        });
    }

    public void abort() {
        loop.runInLoop(() -> abort(null));
    }

    @Override
    public Set<String> scope() {
        return new LinkedHashSet<>(storeNames);
    }

    @Override
    public boolean exclusive() {
        return false;
    }

    @Override
    public void start() {
        if (state == State.ABORTED) {
            return;
        }
        started = true;
        log.debug("Transaction {} started over {}", id, storeNames);
        while (!deferred.isEmpty()) {
            loop.execute(deferred.pollFirst());
        }
        maybeFinishCommit();
    }

    ObjectStoreData store(String name) {
        ObjectStoreData store = database.store(name);
        if (store == null) {
            throw new StorageException.NotFound("Store '" + name + "' no longer exists");
        }
        return store;
    }

    UndoLog undoLog() {
        return undoLog;
    }

    <T> CompletableFuture<T> request(Supplier<T> work) {
        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            loop.runInLoop(() -> enqueue(work, future));
        } catch (StorageException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    private <T> void enqueue(Supplier<T> work, CompletableFuture<T> future) {
        if (state != State.ACTIVE) {
            future.completeExceptionally(new StorageException.TransactionInactive(
                "Transaction " + id + " is " + state.name().toLowerCase(Locale.ROOT)));
            return;
        }
        pending++;
        Runnable task = () -> execute(work, future);
        if (started) {
            loop.execute(task);
        } else {
            deferred.addLast(task);
        }
    }

    private <T> void execute(Supplier<T> work, CompletableFuture<T> future) {
        if (state == State.ABORTED) {
            pending--;
            future.completeExceptionally(new StorageException.TransactionAborted(
                "Transaction " + id + " was aborted before the request ran"));
            return;
        }

        T result;
        try {
            result = work.get();
        } catch (RuntimeException e) {
            future.completeExceptionally(e);
            pending--;
            abort(e);
            return;
        }

        future.complete(result);
        pending--;
        maybeFinishCommit();
    }

    private void maybeFinishCommit() {
        if (state != State.COMMITTING || !started || pending > 0) {
            return;
        }
        state = State.COMMITTED;
        log.debug("Transaction {} committed ({} undo entries dropped)", id, undoLog.size());
        undoLog.clear();
        database.scheduler().release(this);
        completion.complete(null);
    }

    private void abort(Throwable cause) {
        if (state == State.COMMITTED || state == State.ABORTED) {
            return;
        }
        state = State.ABORTED;
        undoLog.rollback();

        StorageException.TransactionAborted failure;
        if (cause == null) {
            log.debug("Transaction {} aborted", id);
            failure = new StorageException.TransactionAborted("Transaction " + id + " was aborted");
        } else {
            log.warn("Transaction {} aborted by failed request: {}", id, cause.getMessage());
            failure = new StorageException.TransactionAborted(
                "Transaction " + id + " aborted: " + cause.getMessage(), cause);
        }

        while (!deferred.isEmpty()) {
            loop.execute(deferred.pollFirst());
        }
        database.scheduler().release(this);
        completion.completeExceptionally(failure);
    }
}
