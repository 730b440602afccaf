package io.shelfdb.storage;

import io.shelfdb.common.Direction;
import io.shelfdb.common.exception.StorageException;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

public final class IndexHandle implements RecordSource {

    private final ObjectStoreHandle store;
    private final String name;

    IndexHandle(ObjectStoreHandle store, String name) {
        this.store = store;
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    public ObjectStoreHandle objectStore() {
        return store;
    }

    public IndexDefinition definition() {
        return data().definition();
    }

    /**
     * Returns the first record, in primary key order, whose indexed value matches.
     */
    @Override
    public CompletableFuture<Optional<Object>> get(Object keyOrRange) {
        KeyRange range = KeyRange.of(keyOrRange);
        return store.transaction().request(() -> data().get(range));
    }

    @Override
    public CompletableFuture<List<Object>> getAll(KeyRange range, int count) {
        return store.transaction().request(() -> data().getAll(range, count));
    }

    @Override
    public CompletableFuture<List<Object>> getAllKeys(KeyRange range, int count) {
        return store.transaction().request(() -> data().getAllKeys(range, count));
    }

    @Override
    public CompletableFuture<Long> count(KeyRange range) {
        return store.transaction().request(() -> data().count(range));
    }

    @Override
    public Cursor openCursor(KeyRange range, Direction direction) {
        return new Cursor(store.transaction(), this::data, store::data, range, direction);
    }

    private IndexData data() {
        return store.data().index(name)
            .orElseThrow(() -> new StorageException.NotFound("No index '" + name + "' in store '" + store.name() + "'"));
    }
}
