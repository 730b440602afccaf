package io.shelfdb.storage;

import io.shelfdb.common.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Holds every database of one process-local engine instance and the event loop their requests run on.
 * Callers create and pass an engine explicitly; there is no shared default instance.
 */
public final class StorageEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StorageEngine.class);

    private final StorageEngineConfig config;
    private final EventLoop loop;
    private final Map<String, DatabaseState> databases;
    private final AtomicBoolean closed;

    private StorageEngine(StorageEngineConfig config) {
        this.config = config;
        this.loop = new EventLoop(config.threadName(), config.shutdownTimeout());
        this.databases = new HashMap<>();
        this.closed = new AtomicBoolean(false);
    }

    public static StorageEngine create() {
        return create(StorageEngineConfig.defaults());
    }

    public static StorageEngine create(StorageEngineConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        StorageEngine engine = new StorageEngine(config);
        log.info("Storage engine started (event loop: {})", config.threadName());
        return engine;
    }

    public StorageEngineConfig config() {
        return config;
    }

    public EventLoop eventLoop() {
        return loop;
    }

    public CompletableFuture<Database> open(DatabaseConfig config) {
        return open(config, UpgradeListener.NONE);
    }

    /**
     * Opens a connection, upgrading the schema first when the configured version is above the stored one.
     */
    public CompletableFuture<Database> open(DatabaseConfig config, UpgradeListener listener) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        CompletableFuture<Database> result = new CompletableFuture<>();
        submit(result, () -> {
            DatabaseState state = databases.computeIfAbsent(config.name(), name -> new DatabaseState(name, loop));
            long storedVersion = state.version();
            if (config.version() < storedVersion) {
                throw new StorageException.VersionError(storedVersion, config.version());
            }
            if (config.version() == storedVersion) {
                result.complete(connect(state));
                return;
            }
            state.scheduler().submit(new Upgrade(state, config, listener, result));
        });
        return result;
    }

    public CompletableFuture<Void> deleteDatabase(String name) {
        Objects.requireNonNull(name, "name must not be null");
        CompletableFuture<Void> result = new CompletableFuture<>();
        submit(result, () -> {
            DatabaseState state = databases.get(name);
            if (state == null) {
                result.complete(null);
                return;
            }
            state.scheduler().submit(new Deletion(state, result));
        });
        return result;
    }

    public CompletableFuture<List<String>> databaseNames() {
        CompletableFuture<List<String>> result = new CompletableFuture<>();
        submit(result, () -> result.complete(databases.keySet().stream().sorted().toList()));
        return result;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("Shutting down storage engine");
            loop.close();
            log.info("Storage engine shut down");
        }
    }

    private Database connect(DatabaseState state) {
        Database connection = new Database(state, loop);
        state.register(connection);
        return connection;
    }

    private void submit(CompletableFuture<?> result, Runnable action) {
        if (closed.get()) {
            result.completeExceptionally(new StorageException.Closed("Storage engine is closed"));
            return;
        }
        try {
            loop.execute(() -> {
                try {
                    action.run();
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (StorageException e) {
            result.completeExceptionally(e);
        }
    }

    private static void closeConnections(DatabaseState state, String reason) {
        for (Database connection : state.connections()) {
            log.warn("Closing connection to database '{}' (version {}): {}", state.name(), connection.version(), reason);
            connection.close();
        }
    }

    private final class Upgrade implements ScopedTask {
        private final DatabaseState state;
        private final DatabaseConfig config;
        private final UpgradeListener listener;
        private final CompletableFuture<Database> result;

        Upgrade(DatabaseState state, DatabaseConfig config, UpgradeListener listener, CompletableFuture<Database> result) {
            this.state = state;
            this.config = config;
            this.listener = listener;
            this.result = result;
        }

        @Override
        public Set<String> scope() {
            return Set.copyOf(state.stores().keySet());
        }

        @Override
        public boolean exclusive() {
            return true;
        }

        @Override
        public void start() {
            long oldVersion = state.version();
            try {
                if (config.version() <= oldVersion) {
                    if (config.version() < oldVersion) {
                        throw new StorageException.VersionError(oldVersion, config.version());
                    }
                    result.complete(connect(state));
                    return;
                }
                log.info("Upgrading database '{}' from version {} to {}", state.name(), oldVersion, config.version());
                Map<String, ObjectStoreData> migrated = SchemaMigrator.migrate(state.name(), state.stores(), config.stores());
                listener.onUpgrade(oldVersion, config.version());
                closeConnections(state, "database upgraded to version " + config.version());
                state.install(config.version(), migrated);
                result.complete(connect(state));
            } catch (RuntimeException e) {
                log.warn("Upgrade of database '{}' to version {} failed: {}", state.name(), config.version(), e.getMessage());
                if (state.version() == 0) {
                    databases.remove(state.name(), state);
                }
                result.completeExceptionally(e);
            } finally {
                state.scheduler().release(this);
            }
        }
    }

    private final class Deletion implements ScopedTask {
        private final DatabaseState state;
        private final CompletableFuture<Void> result;

        Deletion(DatabaseState state, CompletableFuture<Void> result) {
            this.state = state;
            this.result = result;
        }

        @Override
        public Set<String> scope() {
            return Set.copyOf(state.stores().keySet());
        }

        @Override
        public boolean exclusive() {
            return true;
        }

        @Override
        public void start() {
            try {
                closeConnections(state, "database deleted");
                databases.remove(state.name(), state);
                log.info("Deleted database '{}'", state.name());
                result.complete(null);
            } finally {
                state.scheduler().release(this);
            }
        }
    }
}
