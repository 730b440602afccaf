package io.shelfdb.storage;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public record DatabaseConfig(
    String name,
    long version,
    List<StoreDefinition> stores
) {
    public static final String DEFAULT_NAME = "shelf";

    public DatabaseConfig {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (version < 1) {
            throw new IllegalArgumentException("version must be positive");
        }
        Objects.requireNonNull(stores, "stores must not be null");
        stores = List.copyOf(stores);

        Set<String> storeNames = new HashSet<>();
        for (StoreDefinition store : stores) {
            if (!storeNames.add(store.name())) {
                throw new IllegalArgumentException("Duplicate store: " + store.name());
            }
        }
    }

    public static DatabaseConfig create(String name) {
        return new DatabaseConfig(name, 1, List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private String name = DEFAULT_NAME;
        private long version = 1;
        private final List<StoreDefinition> stores = new ArrayList<>();

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder store(StoreDefinition store) {
            stores.add(store);
            return this;
        }

        public Builder stores(List<StoreDefinition> stores) {
            this.stores.addAll(stores);
            return this;
        }

        public DatabaseConfig build() {
            return new DatabaseConfig(name, version, stores);
        }
    }
}
