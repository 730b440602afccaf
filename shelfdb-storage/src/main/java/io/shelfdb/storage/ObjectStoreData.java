package io.shelfdb.storage;

import io.shelfdb.common.Direction;
import io.shelfdb.common.Keys;
import io.shelfdb.common.Values;
import io.shelfdb.common.exception.StorageException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

final class ObjectStoreData implements CursorSource {

    private final String name;
    private final KeyPath keyPath;
    private final boolean autoIncrement;
    private final NavigableMap<Object, Object> records;
    private final Map<String, IndexData> indexes;
    private long keyGenerator;

    ObjectStoreData(StoreDefinition definition) {
        this.name = definition.name();
        this.keyPath = definition.parsedKeyPath().orElse(null);
        this.autoIncrement = definition.autoIncrement();
        this.records = new TreeMap<>(Keys.COMPARATOR);
        this.indexes = new LinkedHashMap<>();
        this.keyGenerator = 1;
    }

    String name() {
        return name;
    }

    Optional<KeyPath> keyPath() {
        return Optional.ofNullable(keyPath);
    }

    boolean autoIncrement() {
        return autoIncrement;
    }

    StoreDefinition definition() {
        List<IndexDefinition> indexDefinitions = indexes.values().stream()
            .map(IndexData::definition)
            .toList();
        String path = keyPath == null ? null : keyPath.path();
        return new StoreDefinition(name, path, autoIncrement, indexDefinitions);
    }

    List<String> indexNames() {
        return indexes.keySet().stream().sorted().toList();
    }

    Optional<IndexData> index(String indexName) {
        return Optional.ofNullable(indexes.get(indexName));
    }

    /**
     * Copies records and key generator state; indexes are not carried over.
     */
    ObjectStoreData copyWithoutIndexes() {
        ObjectStoreData copy = new ObjectStoreData(new StoreDefinition(
            name,
            keyPath == null ? null : keyPath.path(),
            autoIncrement,
            List.of()
        ));
        copy.records.putAll(records);
        copy.keyGenerator = keyGenerator;
        return copy;
    }

    void createIndex(IndexDefinition definition) {
        if (indexes.containsKey(definition.name())) {
            throw new StorageException.ConstraintError(
                "Index '" + definition.name() + "' already exists in store '" + name + "'");
        }
        IndexData index = new IndexData(definition, this);
        for (Map.Entry<Object, Object> entry : records.entrySet()) {
            index.checkUnique(entry.getKey(), entry.getValue());
            index.add(entry.getKey(), entry.getValue());
        }
        indexes.put(definition.name(), index);
    }

    void deleteIndex(String indexName) {
        if (indexes.remove(indexName) == null) {
            throw new StorageException.NotFound("No index '" + indexName + "' in store '" + name + "'");
        }
    }

    Object write(Object value, Object explicitKey, boolean noOverwrite, UndoLog undo) {
        if (value == null) {
            throw new StorageException.DataError("Records must not be null");
        }
        Object record = Values.copy(value);
        Object key = resolveKey(record, explicitKey, undo);
        Object previous = records.get(key);
        if (noOverwrite && previous != null) {
            throw new StorageException.ConstraintError("Key " + key + " already exists in store '" + name + "'");
        }
        for (IndexData index : indexes.values()) {
            index.checkUnique(key, record);
        }
        replace(key, previous, record);
        undo.record(this, key, previous);
        return key;
    }

    Object update(Object primaryKey, Object value, UndoLog undo) {
        if (value == null) {
            throw new StorageException.DataError("Records must not be null");
        }
        if (keyPath != null) {
            Optional<Object> inline = keyPath.extract(value);
            if (inline.isEmpty() || !Keys.isValid(inline.get()) || !Keys.equal(inline.get(), primaryKey)) {
                throw new StorageException.DataError(
                    "Updated record must keep key " + primaryKey + " at '" + keyPath + "'");
            }
            return write(value, null, false, undo);
        }
        return write(value, primaryKey, false, undo);
    }

    void delete(KeyRange range, UndoLog undo) {
        List<Object> keys = new ArrayList<>(view(range).keySet());
        for (Object key : keys) {
            Object previous = records.get(key);
            replace(key, previous, null);
            undo.record(this, key, previous);
        }
    }

    void clear(UndoLog undo) {
        delete(KeyRange.unbounded(), undo);
    }

    void restore(Object key, Object previous) {
        replace(key, records.get(key), previous);
    }

    void restoreGenerator(long previous) {
        keyGenerator = previous;
    }

    Optional<Object> get(Object key) {
        return raw(key).map(Values::copy);
    }

    Optional<Object> raw(Object key) {
        return Optional.ofNullable(records.get(key));
    }

    Optional<Object> first(KeyRange range) {
        NavigableMap<Object, Object> view = view(range);
        if (view.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Values.copy(view.firstEntry().getValue()));
    }

    List<Object> getAll(KeyRange range, int count) {
        List<Object> result = new ArrayList<>();
        for (Object record : view(range).values()) {
            if (count > 0 && result.size() >= count) {
                break;
            }
            result.add(Values.copy(record));
        }
        return result;
    }

    List<Object> getAllKeys(KeyRange range, int count) {
        List<Object> result = new ArrayList<>();
        for (Object key : view(range).keySet()) {
            if (count > 0 && result.size() >= count) {
                break;
            }
            result.add(key);
        }
        return result;
    }

    long count(KeyRange range) {
        return view(range).size();
    }

    int size() {
        return records.size();
    }

    @Override
    public CursorEntry first(KeyRange range, Direction direction) {
        NavigableMap<Object, Object> view = view(range);
        Map.Entry<Object, Object> entry = direction.isReverse() ? view.lastEntry() : view.firstEntry();
        return toCursorEntry(entry);
    }

    @Override
    public CursorEntry after(CursorEntry previous, KeyRange range, Direction direction) {
        NavigableMap<Object, Object> view = view(range);
        Map.Entry<Object, Object> entry = direction.isReverse()
            ? view.lowerEntry(previous.primaryKey())
            : view.higherEntry(previous.primaryKey());
        return toCursorEntry(entry);
    }

    private static CursorEntry toCursorEntry(Map.Entry<Object, Object> entry) {
        if (entry == null) {
            return null;
        }
        return new CursorEntry(entry.getKey(), entry.getKey(), Values.copy(entry.getValue()));
    }

    private NavigableMap<Object, Object> view(KeyRange range) {
        if (range.isUnbounded()) {
            return records;
        }
        if (range.upper() == null) {
            return records.tailMap(range.lower(), !range.lowerOpen());
        }
        if (range.lower() == null) {
            return records.headMap(range.upper(), !range.upperOpen());
        }
        return records.subMap(range.lower(), !range.lowerOpen(), range.upper(), !range.upperOpen());
    }

    private void replace(Object key, Object current, Object replacement) {
        if (current != null) {
            for (IndexData index : indexes.values()) {
                index.remove(key, current);
            }
            records.remove(key);
        }
        if (replacement != null) {
            records.put(key, replacement);
            for (IndexData index : indexes.values()) {
                index.add(key, replacement);
            }
        }
    }

    private Object resolveKey(Object record, Object explicitKey, UndoLog undo) {
        if (keyPath == null) {
            if (explicitKey != null) {
                return advanceGenerator(Keys.validate(explicitKey), undo);
            }
            if (!autoIncrement) {
                throw new StorageException.DataError("Store '" + name + "' uses out-of-line keys and no key was given");
            }
            return nextKey(undo);
        }

        Optional<Object> inline = keyPath.extract(record);
        if (explicitKey != null) {
            Object key = Keys.validate(explicitKey);
            if (inline.isEmpty()) {
                keyPath.inject(record, key);
            } else if (!Keys.isValid(inline.get()) || !Keys.equal(inline.get(), key)) {
                throw new StorageException.DataError(
                    "Record key at '" + keyPath + "' differs from the given key " + key);
            }
            return advanceGenerator(key, undo);
        }
        if (inline.isPresent()) {
            return advanceGenerator(Keys.validate(inline.get()), undo);
        }
        if (!autoIncrement) {
            throw new StorageException.DataError(
                "Record has no key at '" + keyPath + "' and store '" + name + "' does not generate keys");
        }
        Object key = nextKey(undo);
        keyPath.inject(record, key);
        return key;
    }

    private Object nextKey(UndoLog undo) {
        undo.recordGenerator(this, keyGenerator);
        return keyGenerator++;
    }

    private Object advanceGenerator(Object key, UndoLog undo) {
        if (autoIncrement && key instanceof Number number) {
            double floor = Math.floor(number.doubleValue());
            if (floor >= keyGenerator) {
                undo.recordGenerator(this, keyGenerator);
                keyGenerator = (long) floor + 1;
            }
        }
        return key;
    }
}
