package io.shelfdb.client;

import io.shelfdb.client.operation.OperationResolver;
import io.shelfdb.storage.Transaction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Collections of one transaction, handed to the caller's logic. Closed once the transaction commits or aborts.
 */
public final class TransactionScope {

    private final Transaction transaction;
    private final Map<String, CollectionOperations> collections;
    private volatile boolean closed;

    TransactionScope(Transaction transaction, OperationResolver resolver) {
        this.transaction = transaction;
        Map<String, CollectionOperations> byName = new LinkedHashMap<>();
        for (String name : transaction.storeNames()) {
            byName.put(name, new CollectionOperations(this, transaction.objectStore(name), resolver));
        }
        this.collections = Collections.unmodifiableMap(byName);
    }

    public CollectionOperations collection(String name) {
        CollectionOperations collection = collections.get(name);
        if (collection == null) {
            throw new ContractViolationException.InvalidIdentifier(
                "Collection '" + name + "' is not part of transaction " + transaction.id() + " " + names());
        }
        return collection;
    }

    public Map<String, CollectionOperations> collections() {
        return collections;
    }

    public List<String> names() {
        return transaction.storeNames();
    }

    public long transactionId() {
        return transaction.id();
    }

    public Transaction transaction() {
        return transaction;
    }

    public boolean isClosed() {
        return closed;
    }

    Executor callbackExecutor() {
        return transaction.eventLoop().callbackExecutor();
    }

    void close() {
        closed = true;
    }
}
