package io.shelfdb.storage;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Writes and key generator moves made by one transaction, replayed newest first on abort.
 */
final class UndoLog {

    private final Deque<Undo> entries = new ArrayDeque<>();

    void record(ObjectStoreData store, Object key, Object previous) {
        entries.push(new RecordUndo(store, key, previous));
    }

    void recordGenerator(ObjectStoreData store, long previous) {
        entries.push(new GeneratorUndo(store, previous));
    }

    void rollback() {
        while (!entries.isEmpty()) {
            entries.pop().revert();
        }
    }

    void clear() {
        entries.clear();
    }

    int size() {
        return entries.size();
    }

    private sealed interface Undo permits RecordUndo, GeneratorUndo {
        void revert();
    }

    private record RecordUndo(ObjectStoreData store, Object key, Object previous) implements Undo {
        @Override
        public void revert() {
            store.restore(key, previous);
        }
    }

    private record GeneratorUndo(ObjectStoreData store, long previous) implements Undo {
        @Override
        public void revert() {
            store.restoreGenerator(previous);
        }
    }
}
