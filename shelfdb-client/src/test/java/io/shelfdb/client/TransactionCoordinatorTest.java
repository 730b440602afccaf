package io.shelfdb.client;

import io.shelfdb.common.exception.StorageException;
import io.shelfdb.storage.Database;
import io.shelfdb.storage.DatabaseConfig;
import io.shelfdb.storage.StorageEngine;
import io.shelfdb.storage.StoreDefinition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class TransactionCoordinatorTest {

    private StorageEngine engine;
    private TransactionCoordinator coordinator;

    @BeforeEach
    void setUp() throws Exception {
        engine = StorageEngine.create();
        Database db = await(engine.open(DatabaseConfig.builder()
            .name("coordinated")
            .store(StoreDefinition.of("todos"))
            .store(StoreDefinition.of("users"))
            .build()));
        coordinator = new TransactionCoordinator(db);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    private long count(String collection) throws Exception {
        return await(coordinator.withTransaction(List.of(collection), scope ->
            scope.collection(collection).fetch(OperationRequest.empty())
                .thenApply(result -> (long) result.list().size())));
    }

    @Nested
    class Outcome {

        @Test
        void resolvesWithLogicValueAfterCommit() throws Exception {
            Object key = await(coordinator.withTransaction(List.of("todos"), scope ->
                scope.collection("todos").upsert(OperationRequest.ofValue(Map.of("title", "a")))
                    .thenApply(OperationResult::key)));

            assertThat(key).isEqualTo(1L);
            assertThat(count("todos")).isEqualTo(1);
        }

        @Test
        void logicFailureIsReportedAndWritesCommit() throws Exception {
            CompletableFuture<Object> result = coordinator.withTransaction(List.of("todos"), scope ->
                scope.collection("todos").upsert(OperationRequest.ofValue(Map.of("title", "kept")))
                    .thenCompose(key -> CompletableFuture.failedFuture(new IllegalStateException("logic failed"))));

            assertThatThrownBy(() -> await(result))
                .isInstanceOf(ExecutionException.class)
                .cause()
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("logic failed");
            assertThat(count("todos")).isEqualTo(1);
        }

        @Test
        void throwingLogicIsReported() {
            CompletableFuture<Object> result = coordinator.withTransaction(List.of("todos"), scope -> {
                throw new IllegalArgumentException("before any request");
            });

            assertThatThrownBy(() -> await(result))
                .cause()
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void abortOverridesResolvedLogic() throws Exception {
            CompletableFuture<String> result = coordinator.withTransaction(List.of("todos"), scope -> {
                CollectionOperations todos = scope.collection("todos");
                todos.add(OperationRequest.ofValue(Map.of("id", 1, "title", "first")));
                todos.add(OperationRequest.ofValue(Map.of("id", 1, "title", "duplicate")));
                return CompletableFuture.completedFuture("logic done");
            });

            assertThatThrownBy(() -> await(result))
                .cause()
                .isInstanceOf(StorageException.TransactionAborted.class)
                .cause()
                .isInstanceOf(StorageException.ConstraintError.class);
            assertThat(count("todos")).isZero();
        }

        @Test
        void recoveredRequestFailureStillAborts() throws Exception {
            CompletableFuture<String> result = coordinator.withTransaction(List.of("todos"), scope -> {
                CollectionOperations todos = scope.collection("todos");
                return todos.upsert(OperationRequest.ofValue(Map.of("id", 1)))
                    .thenCompose(key -> todos.add(OperationRequest.ofValue(Map.of("id", 1))))
                    .handle((added, error) -> "swallowed " + error);
            });

            assertThatThrownBy(() -> await(result))
                .cause()
                .isInstanceOf(StorageException.TransactionAborted.class);
            assertThat(count("todos")).isZero();
        }

        @Test
        void logicMayBlockOnCollectionCalls() throws Exception {
            String title = await(coordinator.withTransaction(List.of("todos"), scope -> {
                CollectionOperations todos = scope.collection("todos");
                Object key = todos.upsert(OperationRequest.ofValue(Map.of("title", "blocking"))).join().key();
                Object stored = todos.fetch(OperationRequest.ofKey(key)).join().single().orElseThrow();
                return CompletableFuture.completedFuture(((Map<?, ?>) stored).get("title").toString());
            }));

            assertThat(title).isEqualTo("blocking");
            assertThat(count("todos")).isEqualTo(1);
        }

        @Test
        void continuationsMayBlockOnCollectionCalls() throws Exception {
            long size = await(coordinator.withTransaction(List.of("todos"), scope -> {
                CollectionOperations todos = scope.collection("todos");
                return todos.upsert(OperationRequest.ofValue(Map.of("title", "a")))
                    .thenApply(key -> todos.upsert(OperationRequest.ofValue(Map.of("title", "b"))).join())
                    .thenApply(key -> (long) todos.fetch(OperationRequest.empty()).join().list().size());
            }));

            assertThat(size).isEqualTo(2);
            assertThat(count("todos")).isEqualTo(2);
        }

        @Test
        void logicRunsOffTheEventLoop() throws Exception {
            String thread = await(coordinator.withTransaction(List.of("todos"), scope ->
                CompletableFuture.completedFuture(Thread.currentThread().getName())));

            assertThat(thread).isNotEqualTo(engine.config().threadName());
        }

        @Test
        void contractViolationsDoNotAbort() throws Exception {
            String outcome = await(coordinator.withTransaction(List.of("todos"), scope ->
                scope.collection("todos").upsert(OperationRequest.ofKey(1))
                    .handle((result, error) -> error.getClass().getSimpleName())));

            assertThat(outcome).isEqualTo("UnsupportedCombination");
        }
    }

    @Nested
    class Scope {

        @Test
        void nullNamesSelectEveryCollection() throws Exception {
            List<String> names = await(coordinator.withTransaction(scope -> CompletableFuture.completedFuture(scope.names())));

            assertThat(names).containsExactly("todos", "users");
        }

        @Test
        void blankNamesAreRejected() {
            CompletableFuture<List<String>> result = coordinator.withTransaction(Arrays.asList("todos", " "));

            assertThatThrownBy(() -> await(result))
                .cause()
                .isInstanceOf(ContractViolationException.InvalidIdentifier.class);
        }

        @Test
        void unknownCollectionIsNotFound() {
            CompletableFuture<List<String>> result = coordinator.withTransaction(List.of("missing"));

            assertThatThrownBy(() -> await(result))
                .cause()
                .isInstanceOf(StorageException.NotFound.class);
        }

        @Test
        void collectionOutsideScopeIsRejected() {
            CompletableFuture<Object> result = coordinator.withTransaction(List.of("todos"), scope ->
                CompletableFuture.completedFuture(scope.collection("users")));

            assertThatThrownBy(() -> await(result))
                .cause()
                .isInstanceOf(ContractViolationException.InvalidIdentifier.class);
        }

        @Test
        void withoutLogicCommitsAndReturnsNames() throws Exception {
            assertThat(await(coordinator.withTransaction(List.of("users", "todos")))).containsExactly("users", "todos");
        }

        @Test
        void scopeIsClosedAfterCompletion() throws Exception {
            AtomicReference<CollectionOperations> leaked = new AtomicReference<>();
            await(coordinator.withTransaction(List.of("todos"), scope -> {
                leaked.set(scope.collection("todos"));
                return CompletableFuture.completedFuture(null);
            }));

            CompletableFuture<OperationResult> late = leaked.get().fetch(OperationRequest.empty());

            assertThatThrownBy(() -> await(late))
                .cause()
                .isInstanceOf(ContractViolationException.ScopeClosed.class);
        }

        @Test
        void nullLogicIsRejected() {
            CompletableFuture<Object> result = coordinator.withTransaction(List.of("todos"), null);

            assertThatThrownBy(() -> await(result))
                .cause()
                .isInstanceOf(ContractViolationException.InvalidOption.class)
                .hasMessageContaining("withTransaction(names)");
        }
    }
}
