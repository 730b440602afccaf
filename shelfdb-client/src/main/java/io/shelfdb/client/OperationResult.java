package io.shelfdb.client;

import java.util.List;
import java.util.Optional;

/**
 * Normalized outcome of one collection call. Which variant comes back is fixed by the resolved operation.
 */
public sealed interface OperationResult
    permits OperationResult.Single, OperationResult.Many, OperationResult.Key, OperationResult.Keys,
            OperationResult.Done {

    record Single(Optional<Object> record) implements OperationResult {
        public Single {
            record = record == null ? Optional.empty() : record;
        }
    }

    record Many(List<Object> records) implements OperationResult {
        public Many {
            records = List.copyOf(records);
        }
    }

    record Key(Object key) implements OperationResult {
    }

    record Keys(List<Object> keys) implements OperationResult {
        public Keys {
            keys = List.copyOf(keys);
        }
    }

    enum Done implements OperationResult {
        INSTANCE
    }

    default Optional<Object> single() {
        if (this instanceof Single single) {
            return single.record();
        }
        throw new IllegalStateException("Not a single-record result: " + this);
    }

    /**
     * Records of a {@link Many} result or keys of a {@link Keys} result.
     */
    default List<Object> list() {
        if (this instanceof Many many) {
            return many.records();
        }
        if (this instanceof Keys keys) {
            return keys.keys();
        }
        throw new IllegalStateException("Not a list result: " + this);
    }

    default Object key() {
        if (this instanceof Key key) {
            return key.key();
        }
        throw new IllegalStateException("Not a key result: " + this);
    }
}
