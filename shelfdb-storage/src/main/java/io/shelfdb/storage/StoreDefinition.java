package io.shelfdb.storage;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

public record StoreDefinition(
    String name,
    String keyPath,
    boolean autoIncrement,
    List<IndexDefinition> indexes
) {
    public static final String DEFAULT_KEY_PATH = "id";

    public StoreDefinition {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("store name must not be blank");
        }
        if (keyPath != null) {
            KeyPath.of(keyPath);
        }
        Objects.requireNonNull(indexes, "indexes must not be null");
        indexes = List.copyOf(indexes);

        Set<String> indexNames = new HashSet<>();
        for (IndexDefinition index : indexes) {
            if (!indexNames.add(index.name())) {
                throw new IllegalArgumentException("Duplicate index '" + index.name() + "' in store '" + name + "'");
            }
        }
    }

    /**
     * A store keyed by {@code id} with generated keys.
     */
    public static StoreDefinition of(String name) {
        return new StoreDefinition(name, DEFAULT_KEY_PATH, true, List.of());
    }

    /**
     * A store keyed by the given key path; keys are generated only for the default {@code id} path.
     */
    public static StoreDefinition of(String name, String keyPath) {
        return new StoreDefinition(name, keyPath, DEFAULT_KEY_PATH.equals(keyPath), List.of());
    }

    public static StoreDefinition outOfLine(String name) {
        return new StoreDefinition(name, null, false, List.of());
    }

    public Optional<KeyPath> parsedKeyPath() {
        return Optional.ofNullable(keyPath).map(KeyPath::of);
    }

    public StoreDefinition withIndex(IndexDefinition index) {
        List<IndexDefinition> updated = new ArrayList<>(indexes);
        updated.add(index);
        return new StoreDefinition(name, keyPath, autoIncrement, updated);
    }

    public boolean sameKeyOptions(StoreDefinition other) {
        return Objects.equals(keyPath, other.keyPath) && autoIncrement == other.autoIncrement;
    }
}
