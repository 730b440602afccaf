package io.shelfdb.client.operation;

import io.shelfdb.client.ContractViolationException;
import io.shelfdb.client.RecordFunction;
import io.shelfdb.common.Direction;
import io.shelfdb.common.exception.StorageException;
import io.shelfdb.storage.Database;
import io.shelfdb.storage.DatabaseConfig;
import io.shelfdb.storage.IndexDefinition;
import io.shelfdb.storage.KeyRange;
import io.shelfdb.storage.ObjectStoreHandle;
import io.shelfdb.storage.StorageEngine;
import io.shelfdb.storage.StoreDefinition;
import io.shelfdb.storage.Transaction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class CursorEngineTest {

    private final CursorEngine cursorEngine = new CursorEngine();
    private StorageEngine engine;
    private Transaction tx;
    private ObjectStoreHandle todos;

    @BeforeEach
    void setUp() throws Exception {
        engine = StorageEngine.create();
        Database db = await(engine.open(DatabaseConfig.builder()
            .name("walks")
            .store(StoreDefinition.of("todos").withIndex(IndexDefinition.of("userId")))
            .build()));
        tx = db.transaction(List.of("todos"));
        todos = tx.objectStore("todos");
        for (int id = 1; id <= 10; id++) {
            todos.put(Map.of("id", id, "userId", id % 3));
        }
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    private static Object field(Object record, String name) {
        return ((Map<?, ?>) record).get(name);
    }

    private CompletableFuture<List<Object>> walk(Direction direction, RecordFunction function, CursorPolicy policy) {
        return cursorEngine.walk(todos, KeyRange.unbounded(), direction, function, policy, 0);
    }

    @Nested
    class Fetch {

        @Test
        void collectsTruthyResultsInTraversalOrder() throws Exception {
            List<Object> ids = await(walk(Direction.FORWARD, record -> field(record, "id"), CursorPolicy.FETCH));

            assertThat(ids).containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
        }

        @Test
        void reverseWalkIsStrictlyDescending() throws Exception {
            List<Object> ids = await(walk(Direction.REVERSE, record -> field(record, "id"), CursorPolicy.FETCH));

            assertThat(ids).containsExactly(10, 9, 8, 7, 6, 5, 4, 3, 2, 1);
        }

        @Test
        void falsyResultsAreSkipped() throws Exception {
            List<Object> userIds = await(walk(Direction.FORWARD, record -> field(record, "userId"), CursorPolicy.FETCH));

            assertThat(userIds).containsExactly(1, 2, 1, 2, 1, 2, 1);
        }

        @Test
        void selectCollectsMatchingRecords() throws Exception {
            List<Object> records = await(walk(Direction.FORWARD,
                RecordFunction.select(record -> field(record, "userId").equals(0)), CursorPolicy.FETCH));

            assertThat(records).extracting(record -> field(record, "id")).containsExactly(3, 6, 9);
        }

        @Test
        void limitStopsTheWalk() throws Exception {
            List<Object> ids = await(cursorEngine.walk(todos, KeyRange.lowerBound(4), Direction.FORWARD,
                record -> field(record, "id"), CursorPolicy.FETCH, 3));

            assertThat(ids).containsExactly(4, 5, 6);
        }

        @Test
        void uniqueIndexWalkVisitsOneRecordPerValue() throws Exception {
            List<Object> ids = await(cursorEngine.walk(todos.index("userId"), KeyRange.unbounded(),
                Direction.FORWARD_UNIQUE, record -> field(record, "id"), CursorPolicy.FETCH, 0));

            assertThat(ids).containsExactly(3, 1, 2);
        }
    }

    @Nested
    class Update {

        @Test
        void writesBackMapsAndReportsConfirmedKeys() throws Exception {
            List<Object> keys = await(walk(Direction.FORWARD, record -> {
                if (!field(record, "userId").equals(2)) {
                    return null;
                }
                Map<String, Object> updated = new LinkedHashMap<>(castMap(record));
                updated.put("done", true);
                return updated;
            }, CursorPolicy.UPDATE));

            assertThat(keys).containsExactly(2, 5, 8);
            assertThat(await(todos.get(5))).contains(Map.of("id", 5, "userId", 2, "done", true));
        }

        @Test
        void emptyMapsAndOtherValuesAreIgnored() throws Exception {
            List<Object> keys = await(walk(Direction.FORWARD, record -> field(record, "id").equals(1) ? Map.of() : true,
                CursorPolicy.UPDATE));

            assertThat(keys).isEmpty();
        }

        @Test
        void failedUpdateFailsTheWalk() throws Exception {
            CompletableFuture<List<Object>> result = walk(Direction.FORWARD, record -> Map.of("id", 999),
                CursorPolicy.UPDATE);

            assertThatThrownBy(() -> await(result))
                .cause()
                .isInstanceOf(StorageException.DataError.class);
            assertThatThrownBy(() -> await(tx.completion()))
                .cause()
                .isInstanceOf(StorageException.TransactionAborted.class);
        }
    }

    @Nested
    class Delete {

        @Test
        void deletesOnlyOnTrue() throws Exception {
            List<Object> reported = await(walk(Direction.FORWARD,
                record -> field(record, "userId").equals(1) ? Boolean.TRUE : "yes", CursorPolicy.DELETE));

            assertThat(reported).isEmpty();
            assertThat(await(todos.getAllKeys(KeyRange.unbounded(), 0))).containsExactly(2, 3, 5, 6, 8, 9);
        }

        @Test
        void deleteThroughIndex() throws Exception {
            await(cursorEngine.walk(todos.index("userId"), KeyRange.only(0), Direction.REVERSE,
                record -> true, CursorPolicy.DELETE, 0));

            assertThat(await(todos.count(KeyRange.unbounded()))).isEqualTo(7L);
        }
    }

    @Test
    void nullFunctionFailsFast() {
        CompletableFuture<List<Object>> result = walk(Direction.FORWARD, null, CursorPolicy.FETCH);

        assertThat(result).isCompletedExceptionally();
        assertThatThrownBy(result::join)
            .cause()
            .isInstanceOf(ContractViolationException.PredicateNotCallable.class);
    }

    @Test
    void throwingFunctionFailsTheWalk() {
        CompletableFuture<List<Object>> result = walk(Direction.FORWARD, record -> {
            throw new IllegalStateException("boom");
        }, CursorPolicy.FETCH);

        assertThatThrownBy(() -> await(result))
            .cause()
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("boom");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Object record) {
        return (Map<String, Object>) record;
    }
}
