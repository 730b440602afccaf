package io.shelfdb.storage;

import io.shelfdb.common.Direction;
import io.shelfdb.common.Keys;
import io.shelfdb.common.Values;
import io.shelfdb.common.exception.StorageException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A store as seen from one transaction. Records are copied when a write is issued. Malformed keys and ranges are
 * rejected before a request is queued and leave the transaction active; failures while a request runs abort it.
 */
public final class ObjectStoreHandle implements RecordSource {

    private final Transaction transaction;
    private final String name;

    ObjectStoreHandle(Transaction transaction, String name) {
        this.transaction = transaction;
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    public Optional<String> keyPath() {
        return data().keyPath().map(KeyPath::path);
    }

    public boolean autoIncrement() {
        return data().autoIncrement();
    }

    public List<String> indexNames() {
        return data().indexNames();
    }

    public Transaction transaction() {
        return transaction;
    }

    public IndexHandle index(String indexName) {
        Objects.requireNonNull(indexName, "indexName must not be null");
        if (data().index(indexName).isEmpty()) {
            throw new StorageException.NotFound("No index '" + indexName + "' in store '" + name + "'");
        }
        return new IndexHandle(this, indexName);
    }

    /**
     * Inserts a record, failing with {@link StorageException.ConstraintError} when its key is already taken.
     */
    public CompletableFuture<Object> add(Object value) {
        return add(value, null);
    }

    public CompletableFuture<Object> add(Object value, Object key) {
        Object explicitKey = key == null ? null : Keys.validate(key);
        Object record = Values.copy(value);
        return transaction.request(() -> data().write(record, explicitKey, true, transaction.undoLog()));
    }

    public CompletableFuture<Object> put(Object value) {
        return put(value, null);
    }

    public CompletableFuture<Object> put(Object value, Object key) {
        Object explicitKey = key == null ? null : Keys.validate(key);
        Object record = Values.copy(value);
        return transaction.request(() -> data().write(record, explicitKey, false, transaction.undoLog()));
    }

    @Override
    public CompletableFuture<Optional<Object>> get(Object keyOrRange) {
        KeyRange range = KeyRange.of(keyOrRange);
        return transaction.request(() -> data().first(range));
    }

    @Override
    public CompletableFuture<List<Object>> getAll(KeyRange range, int count) {
        return transaction.request(() -> data().getAll(range, count));
    }

    @Override
    public CompletableFuture<List<Object>> getAllKeys(KeyRange range, int count) {
        return transaction.request(() -> data().getAllKeys(range, count));
    }

    @Override
    public CompletableFuture<Long> count(KeyRange range) {
        return transaction.request(() -> data().count(range));
    }

    public CompletableFuture<Void> delete(Object keyOrRange) {
        KeyRange range = KeyRange.of(keyOrRange);
        return transaction.request(() -> {
            data().delete(range, transaction.undoLog());
            return null;
        });
    }

    public CompletableFuture<Void> clear() {
        return transaction.request(() -> {
            data().clear(transaction.undoLog());
            return null;
        });
    }

    @Override
    public Cursor openCursor(KeyRange range, Direction direction) {
        return new Cursor(transaction, this::data, this::data, range, direction);
    }

    ObjectStoreData data() {
        return transaction.store(name);
    }
}
