package io.shelfdb.client;

import io.shelfdb.common.exception.StorageException;
import io.shelfdb.storage.Database;
import io.shelfdb.storage.DatabaseConfig;
import io.shelfdb.storage.StorageEngine;
import io.shelfdb.storage.StoreDefinition;
import io.shelfdb.storage.UpgradeListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for applications: one open database with transactional access to its collections.
 *
 * <pre>{@code
 * ShelfDb db = ShelfDb.open(engine, config).join();
 * db.transaction(List.of("todos"), scope -> scope.collection("todos")
 *         .fetch(OperationRequest.builder().index("userId").query(RangeQuery.between(7, 10)).build()))
 *     .join();
 * }</pre>
 */
public final class ShelfDb implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ShelfDb.class);

    private final StorageEngine engine;
    private final DatabaseConfig config;
    private final Database database;
    private final TransactionCoordinator coordinator;

    private ShelfDb(StorageEngine engine, DatabaseConfig config, Database database) {
        this.engine = engine;
        this.config = config;
        this.database = database;
        this.coordinator = new TransactionCoordinator(database);
    }

    public static CompletableFuture<ShelfDb> open(StorageEngine engine, DatabaseConfig config) {
        return open(engine, config, UpgradeListener.NONE);
    }

    public static CompletableFuture<ShelfDb> open(
        StorageEngine engine,
        DatabaseConfig config,
        UpgradeListener listener
    ) {
        Objects.requireNonNull(engine, "engine must not be null");
        Objects.requireNonNull(config, "config must not be null");
        return engine.open(config, listener).thenApply(database -> {
            log.info("Opened database '{}' at version {} with stores {}",
                database.name(), database.version(), database.storeNames());
            return new ShelfDb(engine, config, database);
        });
    }

    /**
     * The configuration this database was opened with.
     */
    public DatabaseConfig info() {
        return config;
    }

    public String name() {
        return database.name();
    }

    public long version() {
        return database.version();
    }

    public List<String> collectionNames() {
        return database.storeNames();
    }

    public List<StoreDefinition> stores() {
        return database.stores();
    }

    public boolean isOpen() {
        return !database.isClosed();
    }

    public <T> CompletableFuture<T> transaction(TransactionLogic<T> logic) {
        return coordinator.withTransaction(logic);
    }

    public <T> CompletableFuture<T> transaction(Collection<String> names, TransactionLogic<T> logic) {
        return coordinator.withTransaction(names, logic);
    }

    public CompletableFuture<List<String>> transaction(Collection<String> names) {
        return coordinator.withTransaction(names);
    }

    public CompletableFuture<List<String>> transaction() {
        return coordinator.withTransaction((Collection<String>) null);
    }

    @Override
    public void close() {
        if (!database.isClosed()) {
            database.close();
            log.info("Closed database '{}'", database.name());
        }
    }

    /**
     * Closes this connection and removes the database with all its data.
     */
    public CompletableFuture<Void> delete() {
        if (database.isClosed()) {
            return CompletableFuture.failedFuture(
                new StorageException.Closed("Database '" + database.name() + "' is not open"));
        }
        close();
        return engine.deleteDatabase(database.name());
    }
}
