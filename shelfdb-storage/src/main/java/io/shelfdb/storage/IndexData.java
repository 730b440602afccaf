package io.shelfdb.storage;

import io.shelfdb.common.Direction;
import io.shelfdb.common.Keys;
import io.shelfdb.common.Values;
import io.shelfdb.common.exception.StorageException;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

final class IndexData implements CursorSource {

    private final IndexDefinition definition;
    private final KeyPath keyPath;
    private final ObjectStoreData owner;
    private final NavigableSet<IndexEntry> entries;

    IndexData(IndexDefinition definition, ObjectStoreData owner) {
        this.definition = definition;
        this.keyPath = KeyPath.of(definition.keyPath());
        this.owner = owner;
        this.entries = new TreeSet<>();
    }

    IndexDefinition definition() {
        return definition;
    }

    String name() {
        return definition.name();
    }

    Set<Object> keysOf(Object record) {
        Set<Object> keys = new TreeSet<>(Keys.COMPARATOR);
        Optional<Object> value = keyPath.extract(record);
        if (value.isEmpty()) {
            return keys;
        }
        Object raw = value.get();
        if (definition.multiEntry() && raw instanceof List<?> list) {
            for (Object element : list) {
                if (Keys.isValid(element)) {
                    keys.add(Keys.validate(element));
                }
            }
        } else if (Keys.isValid(raw)) {
            keys.add(Keys.validate(raw));
        }
        return keys;
    }

    void checkUnique(Object primaryKey, Object record) {
        if (!definition.unique()) {
            return;
        }
        for (Object key : keysOf(record)) {
            for (IndexEntry existing : view(KeyRange.only(key))) {
                if (!Keys.equal(existing.primaryKey(), primaryKey)) {
                    throw new StorageException.ConstraintError(
                        "Unique index '" + name() + "' already contains key " + key);
                }
            }
        }
    }

    void add(Object primaryKey, Object record) {
        for (Object key : keysOf(record)) {
            entries.add(new IndexEntry(key, primaryKey));
        }
    }

    void remove(Object primaryKey, Object record) {
        for (Object key : keysOf(record)) {
            entries.remove(new IndexEntry(key, primaryKey));
        }
    }

    Optional<Object> get(KeyRange range) {
        NavigableSet<IndexEntry> view = view(range);
        if (view.isEmpty()) {
            return Optional.empty();
        }
        return owner.get(view.first().primaryKey());
    }

    List<Object> getAll(KeyRange range, int count) {
        List<Object> result = new ArrayList<>();
        for (IndexEntry entry : view(range)) {
            if (count > 0 && result.size() >= count) {
                break;
            }
            owner.get(entry.primaryKey()).ifPresent(result::add);
        }
        return result;
    }

    List<Object> getAllKeys(KeyRange range, int count) {
        List<Object> result = new ArrayList<>();
        for (IndexEntry entry : view(range)) {
            if (count > 0 && result.size() >= count) {
                break;
            }
            result.add(entry.primaryKey());
        }
        return result;
    }

    long count(KeyRange range) {
        return view(range).size();
    }

    int size() {
        return entries.size();
    }

    @Override
    public CursorEntry first(KeyRange range, Direction direction) {
        NavigableSet<IndexEntry> view = view(range);
        if (view.isEmpty()) {
            return null;
        }
        if (!direction.isReverse()) {
            return toCursorEntry(view.first());
        }
        IndexEntry last = view.last();
        if (direction.isUnique()) {
            last = view.ceiling(IndexEntry.lowest(last.indexKey()));
        }
        return toCursorEntry(last);
    }

    @Override
    public CursorEntry after(CursorEntry previous, KeyRange range, Direction direction) {
        NavigableSet<IndexEntry> view = view(range);
        IndexEntry position = new IndexEntry(previous.key(), previous.primaryKey());
        IndexEntry next;
        if (!direction.isReverse()) {
            next = direction.isUnique()
                ? view.higher(IndexEntry.highest(position.indexKey()))
                : view.higher(position);
        } else if (direction.isUnique()) {
            next = view.lower(IndexEntry.lowest(position.indexKey()));
            if (next != null) {
                next = view.ceiling(IndexEntry.lowest(next.indexKey()));
            }
        } else {
            next = view.lower(position);
        }
        return next == null ? null : toCursorEntry(next);
    }

    private CursorEntry toCursorEntry(IndexEntry entry) {
        Object record = owner.raw(entry.primaryKey())
            .orElseThrow(() -> new IllegalStateException(
                "Index '" + name() + "' references missing record " + entry.primaryKey()));
        return new CursorEntry(entry.indexKey(), entry.primaryKey(), Values.copy(record));
    }

    NavigableSet<IndexEntry> view(KeyRange range) {
        if (range.isUnbounded()) {
            return entries;
        }
        if (range.upper() == null) {
            return entries.tailSet(lowerBoundary(range), true);
        }
        if (range.lower() == null) {
            return entries.headSet(upperBoundary(range), true);
        }
        return entries.subSet(lowerBoundary(range), true, upperBoundary(range), true);
    }

    private static IndexEntry lowerBoundary(KeyRange range) {
        return range.lowerOpen() ? IndexEntry.highest(range.lower()) : IndexEntry.lowest(range.lower());
    }

    private static IndexEntry upperBoundary(KeyRange range) {
        return range.upperOpen() ? IndexEntry.lowest(range.upper()) : IndexEntry.highest(range.upper());
    }
}
