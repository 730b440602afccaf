package io.shelfdb.client;

import io.shelfdb.client.operation.Futures;
import io.shelfdb.client.operation.OperationKind;
import io.shelfdb.client.operation.OperationResolver;
import io.shelfdb.storage.ObjectStoreHandle;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * The four calls a transaction offers on one collection. None of them throws: every failure, including a
 * malformed request, comes back through the returned future. Returned futures complete off the event loop, so
 * transaction logic may block on them.
 */
public final class CollectionOperations {

    private final TransactionScope scope;
    private final ObjectStoreHandle store;
    private final OperationResolver resolver;

    CollectionOperations(TransactionScope scope, ObjectStoreHandle store, OperationResolver resolver) {
        this.scope = scope;
        this.store = store;
        this.resolver = resolver;
    }

    public String name() {
        return store.name();
    }

    public ObjectStoreHandle store() {
        return store;
    }

    /**
     * Inserts {@code value}; fails with a constraint error when the key is taken.
     */
    public CompletableFuture<OperationResult> add(OperationRequest request) {
        return execute(OperationKind.ADD, request);
    }

    public CompletableFuture<OperationResult> add(Object value) {
        return add(OperationRequest.ofValue(value));
    }

    public CompletableFuture<OperationResult> fetch(OperationRequest request) {
        return execute(OperationKind.FETCH, request);
    }

    public CompletableFuture<OperationResult> fetch(Map<String, ?> options) {
        return execute(OperationKind.FETCH, options);
    }

    public CompletableFuture<OperationResult> upsert(OperationRequest request) {
        return execute(OperationKind.UPSERT, request);
    }

    public CompletableFuture<OperationResult> upsert(Map<String, ?> options) {
        return execute(OperationKind.UPSERT, options);
    }

    public CompletableFuture<OperationResult> remove(OperationRequest request) {
        return execute(OperationKind.REMOVE, request);
    }

    public CompletableFuture<OperationResult> remove(Map<String, ?> options) {
        return execute(OperationKind.REMOVE, options);
    }

    private CompletableFuture<OperationResult> execute(OperationKind kind, Map<String, ?> options) {
        OperationRequest request;
        try {
            request = OperationRequest.fromOptions(options);
        } catch (ContractViolationException e) {
            return CompletableFuture.failedFuture(e);
        }
        return execute(kind, request);
    }

    private CompletableFuture<OperationResult> execute(OperationKind kind, OperationRequest request) {
        if (scope.isClosed()) {
            return CompletableFuture.failedFuture(new ContractViolationException.ScopeClosed(scope.transactionId()));
        }
        if (request == null) {
            return CompletableFuture.failedFuture(
                new ContractViolationException.InvalidOption("request", "must not be null"));
        }
        return Futures.relay(resolver.execute(store, kind, request), scope.callbackExecutor());
    }
}
