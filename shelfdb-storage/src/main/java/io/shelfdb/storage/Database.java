package io.shelfdb.storage;

import io.shelfdb.common.exception.StorageException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * An open connection to a named, versioned database.
 */
public final class Database implements AutoCloseable {

    private static final AtomicLong TRANSACTION_IDS = new AtomicLong(1);

    private final DatabaseState state;
    private final EventLoop loop;
    private final long version;
    private volatile boolean closed;

    Database(DatabaseState state, EventLoop loop) {
        this.state = state;
        this.loop = loop;
        this.version = state.version();
    }

    public String name() {
        return state.name();
    }

    public long version() {
        return version;
    }

    public List<String> storeNames() {
        return state.storeNames();
    }

    public List<StoreDefinition> stores() {
        return state.definitions();
    }

    public EventLoop eventLoop() {
        return loop;
    }

    public boolean isClosed() {
        return closed;
    }

    public Transaction transaction() {
        return transaction(storeNames());
    }

    public Transaction transaction(Collection<String> storeNames) {
        Objects.requireNonNull(storeNames, "storeNames must not be null");
        if (closed) {
            throw new StorageException.Closed("Connection to database '" + name() + "' is closed");
        }
        if (storeNames.isEmpty()) {
            throw new StorageException.NotFound("A transaction must name at least one store");
        }
        List<String> scope = new ArrayList<>(new LinkedHashSet<>(storeNames));
        for (String storeName : scope) {
            if (state.store(storeName) == null) {
                throw new StorageException.NotFound("No store '" + storeName + "' in database '" + name() + "'");
            }
        }

        Transaction transaction = new Transaction(TRANSACTION_IDS.getAndIncrement(), state, scope, loop);
        state.scheduler().submit(transaction);
        return transaction;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            state.unregister(this);
        }
    }
}
