package io.shelfdb.storage;

import io.shelfdb.common.Direction;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Read access shared by object stores and their indexes. Keys passed to {@link #get(Object)} are matched against
 * the store key for a store and against the indexed value for an index.
 */
public interface RecordSource {

    String name();

    CompletableFuture<Optional<Object>> get(Object keyOrRange);

    CompletableFuture<List<Object>> getAll(KeyRange range, int count);

    CompletableFuture<List<Object>> getAllKeys(KeyRange range, int count);

    CompletableFuture<Long> count(KeyRange range);

    Cursor openCursor(KeyRange range, Direction direction);

    default CompletableFuture<List<Object>> getAll() {
        return getAll(KeyRange.unbounded(), 0);
    }

    default Cursor openCursor() {
        return openCursor(KeyRange.unbounded(), Direction.FORWARD);
    }
}
