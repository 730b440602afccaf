package io.shelfdb.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reconciles the stores of a database with the stores a configuration asks for.
 * <p>
 * Stores missing from the configuration are dropped and missing ones created. Stores present on both sides keep
 * their records and key options; all of their indexes are dropped and the configured ones rebuilt from the
 * existing records. The migration works on copies, so a failure leaves the current stores untouched.
 */
final class SchemaMigrator {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

    static final String DEFAULT_STORE = "app";

    private SchemaMigrator() {}

    static Map<String, ObjectStoreData> migrate(
        String database,
        Map<String, ObjectStoreData> existing,
        List<StoreDefinition> configured
    ) {
        List<StoreDefinition> desired = configured.isEmpty()
            ? List.of(StoreDefinition.of(DEFAULT_STORE))
            : configured;
        Set<String> desiredNames = desired.stream()
            .map(StoreDefinition::name)
            .collect(Collectors.toSet());

        for (String name : existing.keySet()) {
            if (!desiredNames.contains(name)) {
                log.info("Dropping store '{}' from database '{}'", name, database);
            }
        }

        Map<String, ObjectStoreData> migrated = new LinkedHashMap<>();
        for (StoreDefinition definition : desired) {
            ObjectStoreData current = existing.get(definition.name());
            ObjectStoreData store;
            if (current == null) {
                log.info("Creating store '{}' in database '{}' (keyPath={}, autoIncrement={})",
                    definition.name(), database, definition.keyPath(), definition.autoIncrement());
                store = new ObjectStoreData(definition);
            } else {
                if (!current.definition().sameKeyOptions(definition)) {
                    log.warn("Store '{}' in database '{}' keeps its existing key options (keyPath={}, autoIncrement={})",
                        definition.name(), database, current.keyPath().map(KeyPath::path).orElse(null),
                        current.autoIncrement());
                }
                store = current.copyWithoutIndexes();
            }

            for (IndexDefinition index : definition.indexes()) {
                log.debug("Building index '{}' on store '{}'", index.name(), definition.name());
                store.createIndex(index);
            }
            migrated.put(definition.name(), store);
        }
        return migrated;
    }
}
