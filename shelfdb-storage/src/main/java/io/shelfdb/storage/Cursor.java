package io.shelfdb.storage;

import io.shelfdb.common.Direction;
import io.shelfdb.common.Values;
import io.shelfdb.common.exception.StorageException;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * A positional walk over a store or index. Each {@link #next()} is a separate request that moves to the entry
 * following the current one, so writes made during the walk are observed.
 */
public final class Cursor {

    private final Transaction transaction;
    private final Supplier<? extends CursorSource> source;
    private final Supplier<ObjectStoreData> store;
    private final KeyRange range;
    private final Direction direction;

    private volatile CursorEntry current;
    private boolean started;
    private boolean exhausted;

    Cursor(
        Transaction transaction,
        Supplier<? extends CursorSource> source,
        Supplier<ObjectStoreData> store,
        KeyRange range,
        Direction direction
    ) {
        this.transaction = transaction;
        this.source = source;
        this.store = store;
        this.range = Objects.requireNonNull(range, "range must not be null");
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
    }

    public Direction direction() {
        return direction;
    }

    public KeyRange range() {
        return range;
    }

    public Optional<CursorEntry> current() {
        return Optional.ofNullable(current);
    }

    /**
     * Moves to the next entry; an empty result means the walk is exhausted.
     */
    public CompletableFuture<Optional<CursorEntry>> next() {
        return transaction.request(() -> {
            if (exhausted) {
                return Optional.empty();
            }
            CursorEntry entry = started
                ? source.get().after(current, range, direction)
                : source.get().first(range, direction);
            started = true;
            current = entry;
            exhausted = entry == null;
            return Optional.ofNullable(entry);
        });
    }

    /**
     * Replaces the record at the current position and returns its primary key.
     */
    public CompletableFuture<Object> update(Object value) {
        CursorEntry target = current;
        if (target == null) {
            return CompletableFuture.failedFuture(notPositioned());
        }
        Object record = Values.copy(value);
        return transaction.request(() -> store.get().update(target.primaryKey(), record, transaction.undoLog()));
    }

    public CompletableFuture<Void> delete() {
        CursorEntry target = current;
        if (target == null) {
            return CompletableFuture.failedFuture(notPositioned());
        }
        return transaction.request(() -> {
            store.get().delete(KeyRange.only(target.primaryKey()), transaction.undoLog());
            return null;
        });
    }

    private static StorageException notPositioned() {
        return new StorageException.NotFound("Cursor is not positioned on an entry");
    }
}
