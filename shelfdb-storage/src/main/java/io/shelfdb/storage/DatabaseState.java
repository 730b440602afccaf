package io.shelfdb.storage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

final class DatabaseState {

    private final String name;
    private final TransactionScheduler scheduler;
    private final Set<Database> connections;
    private volatile long version;
    private volatile Map<String, ObjectStoreData> stores;

    DatabaseState(String name, EventLoop loop) {
        this.name = name;
        this.scheduler = new TransactionScheduler(loop);
        this.connections = ConcurrentHashMap.newKeySet();
        this.version = 0;
        this.stores = new LinkedHashMap<>();
    }

    String name() {
        return name;
    }

    long version() {
        return version;
    }

    TransactionScheduler scheduler() {
        return scheduler;
    }

    ObjectStoreData store(String storeName) {
        return stores.get(storeName);
    }

    Map<String, ObjectStoreData> stores() {
        return stores;
    }

    List<String> storeNames() {
        return stores.keySet().stream().sorted().toList();
    }

    List<StoreDefinition> definitions() {
        List<StoreDefinition> definitions = new ArrayList<>();
        for (ObjectStoreData store : stores.values()) {
            definitions.add(store.definition());
        }
        return definitions;
    }

    void install(long newVersion, Map<String, ObjectStoreData> newStores) {
        this.stores = newStores;
        this.version = newVersion;
    }

    void register(Database connection) {
        connections.add(connection);
    }

    void unregister(Database connection) {
        connections.remove(connection);
    }

    List<Database> connections() {
        return List.copyOf(connections);
    }
}
