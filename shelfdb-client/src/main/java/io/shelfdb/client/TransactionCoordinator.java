package io.shelfdb.client;

import io.shelfdb.client.operation.Futures;
import io.shelfdb.client.operation.OperationResolver;
import io.shelfdb.common.exception.StorageException;
import io.shelfdb.storage.Database;
import io.shelfdb.storage.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs caller logic inside one transaction and reconciles the logic's outcome with the transaction's.
 * <p>
 * The logic runs on the engine's callback executor, never on the event loop, so it may block on the futures its
 * collection calls return. Commit is requested once the logic's future settles, whether it succeeded or failed.
 * The returned future fails with {@link StorageException.TransactionAborted} as soon as the transaction aborts,
 * even when the logic already produced a value. Otherwise it carries the logic's value or failure once the
 * transaction commits.
 */
public final class TransactionCoordinator {
    private static final Logger log = LoggerFactory.getLogger(TransactionCoordinator.class);

    private final Database database;
    private final OperationResolver resolver;

    public TransactionCoordinator(Database database) {
        this(database, new OperationResolver());
    }

    public TransactionCoordinator(Database database, OperationResolver resolver) {
        this.database = Objects.requireNonNull(database, "database must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    public <T> CompletableFuture<T> withTransaction(TransactionLogic<T> logic) {
        return withTransaction(null, logic);
    }

    /**
     * @param names collections to include; {@code null} means every collection of the database
     * @param logic required; a scope without logic is opened through {@link #withTransaction(Collection)}, and a
     *              {@code null} logic here fails with {@link ContractViolationException.InvalidOption}
     */
    public <T> CompletableFuture<T> withTransaction(Collection<String> names, TransactionLogic<T> logic) {
        if (logic == null) {
            return CompletableFuture.failedFuture(
                new ContractViolationException.InvalidOption("logic",
                    "must not be null; use withTransaction(names) to open a scope without logic"));
        }
        Transaction transaction;
        try {
            transaction = begin(names);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        TransactionScope scope = new TransactionScope(transaction, resolver);
        Executor callbacks = transaction.eventLoop().callbackExecutor();
        CompletableFuture<T> logicResult = new CompletableFuture<>();
        CompletableFuture<T> result = new CompletableFuture<>();

        transaction.completion().whenComplete((ignored, failure) -> {
            scope.close();
            if (failure != null) {
                log.debug("Transaction {} failed: {}", transaction.id(), failure.getMessage());
                result.completeExceptionally(Futures.unwrap(failure));
                return;
            }
            logicResult.whenComplete((value, error) -> {
                if (error != null) {
                    result.completeExceptionally(Futures.unwrap(error));
                } else {
                    result.complete(value);
                }
            });
        });
        logicResult.whenComplete((value, error) -> transaction.commit());

        try {
            callbacks.execute(() -> runLogic(logic, scope, logicResult));
        } catch (RejectedExecutionException e) {
            // the callback pool only shuts down after the loop, so the transaction can no longer run
            result.completeExceptionally(new StorageException.Closed("Storage engine is closed"));
        }
        return Futures.relay(result, callbacks);
    }

    /**
     * Opens a scope and commits it straight away.
     *
     * @return the names of the collections in the scope
     */
    public CompletableFuture<List<String>> withTransaction(Collection<String> names) {
        Transaction transaction;
        try {
            transaction = begin(names);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        transaction.commit();
        return Futures.relay(
            transaction.completion().thenApply(ignored -> transaction.storeNames()),
            transaction.eventLoop().callbackExecutor());
    }

    private Transaction begin(Collection<String> names) {
        if (names == null) {
            return database.transaction();
        }
        for (String name : names) {
            if (name == null || name.isBlank()) {
                throw new ContractViolationException.InvalidIdentifier(
                    "Collection names must not be blank: " + names);
            }
        }
        return database.transaction(names);
    }

    private static <T> void runLogic(
        TransactionLogic<T> logic,
        TransactionScope scope,
        CompletableFuture<T> logicResult
    ) {
        CompletableFuture<T> future;
        try {
            future = logic.run(scope);
        } catch (RuntimeException e) {
            logicResult.completeExceptionally(e);
            return;
        }
        if (future == null) {
            logicResult.completeExceptionally(
                new ContractViolationException.InvalidOption("logic", "returned no future"));
            return;
        }
        future.whenComplete((value, error) -> {
            if (error != null) {
                logicResult.completeExceptionally(Futures.unwrap(error));
            } else {
                logicResult.complete(value);
            }
        });
    }
}
