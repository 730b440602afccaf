package io.shelfdb.client;

import java.util.concurrent.CompletableFuture;

/**
 * Caller work run inside one transaction. The transaction commits once the returned future settles.
 */
@FunctionalInterface
public interface TransactionLogic<T> {

    CompletableFuture<T> run(TransactionScope scope);
}
