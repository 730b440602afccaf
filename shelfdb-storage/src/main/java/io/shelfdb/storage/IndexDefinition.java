package io.shelfdb.storage;

import java.util.Objects;

public record IndexDefinition(
    String name,
    String keyPath,
    boolean unique,
    boolean multiEntry
) {
    public IndexDefinition {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("index name must not be blank");
        }
        Objects.requireNonNull(keyPath, "keyPath must not be null");
        KeyPath.of(keyPath);
    }

    public static IndexDefinition of(String name) {
        return new IndexDefinition(name, name, false, false);
    }

    public static IndexDefinition of(String name, String keyPath) {
        return new IndexDefinition(name, keyPath, false, false);
    }

    public IndexDefinition asUnique() {
        return new IndexDefinition(name, keyPath, true, multiEntry);
    }

    public IndexDefinition asMultiEntry() {
        return new IndexDefinition(name, keyPath, unique, true);
    }
}
