package io.shelfdb.storage;

import io.shelfdb.common.exception.StorageException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class IndexTest {

    private StorageEngine engine;
    private Database db;

    @BeforeEach
    void setUp() throws Exception {
        engine = StorageEngine.create();
        db = await(engine.open(DatabaseConfig.builder()
            .name("indexes")
            .store(StoreDefinition.of("todos")
                .withIndex(IndexDefinition.of("userId"))
                .withIndex(IndexDefinition.of("tags").asMultiEntry())
                .withIndex(IndexDefinition.of("slug").asUnique())
                .withIndex(IndexDefinition.of("owner", "meta.owner")))
            .build()));
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    private Transaction seed(Object... records) throws Exception {
        Transaction tx = db.transaction(List.of("todos"));
        for (Object record : records) {
            tx.objectStore("todos").put(record);
        }
        return tx;
    }

    private static <T> T finish(Transaction tx, CompletableFuture<T> result) throws Exception {
        tx.commit();
        await(tx.completion());
        return await(result);
    }

    @Test
    void getReturnsFirstMatchInPrimaryKeyOrder() throws Exception {
        Transaction tx = seed(
            Map.of("id", 3, "userId", 7),
            Map.of("id", 1, "userId", 7),
            Map.of("id", 2, "userId", 8));

        Optional<Object> match = finish(tx, tx.objectStore("todos").index("userId").get(7));

        assertThat(match).contains(Map.of("id", 1, "userId", 7));
    }

    @Test
    void rangeReadsOrderByIndexKeyThenPrimaryKey() throws Exception {
        Transaction tx = seed(
            Map.of("id", 1, "userId", 9),
            Map.of("id", 2, "userId", 8),
            Map.of("id", 3, "userId", 9),
            Map.of("id", 4, "userId", 11),
            Map.of("id", 5, "userId", 6));

        List<Object> keys = finish(tx, tx.objectStore("todos").index("userId").getAllKeys(KeyRange.bound(7, 10), 0));

        assertThat(keys).containsExactly(2, 1, 3);
    }

    @Test
    void uniqueIndexRejectsDuplicates() throws Exception {
        Transaction tx = seed(Map.of("id", 1, "slug", "a"));
        CompletableFuture<Object> clash = tx.objectStore("todos").put(Map.of("id", 2, "slug", "a"));

        assertThatThrownBy(() -> await(clash))
            .cause()
            .isInstanceOf(StorageException.ConstraintError.class)
            .hasMessageContaining("slug");
    }

    @Test
    void uniqueIndexAllowsRewritingSameRecord() throws Exception {
        Transaction tx = seed(Map.of("id", 1, "slug", "a"));
        tx.objectStore("todos").put(Map.of("id", 1, "slug", "a", "done", true));

        Long count = finish(tx, tx.objectStore("todos").index("slug").count(KeyRange.unbounded()));

        assertThat(count).isEqualTo(1L);
    }

    @Test
    void multiEntryIndexesEachDistinctElement() throws Exception {
        Transaction tx = seed(
            Map.of("id", 1, "tags", List.of("home", "urgent", "home")),
            Map.of("id", 2, "tags", List.of("work")),
            Map.of("id", 3, "tags", "home"));
        IndexHandle tags = tx.objectStore("todos").index("tags");
        CompletableFuture<List<Object>> home = tags.getAllKeys(KeyRange.only("home"), 0);

        Long total = finish(tx, tags.count(KeyRange.unbounded()));

        assertThat(await(home)).containsExactly(1, 3);
        assertThat(total).isEqualTo(4L);
    }

    @Test
    void recordsWithoutIndexedValueAreSkipped() throws Exception {
        Transaction tx = seed(
            Map.of("id", 1, "userId", 7),
            Map.of("id", 2),
            Map.of("id", 3, "userId", true));

        Long count = finish(tx, tx.objectStore("todos").index("userId").count(KeyRange.unbounded()));

        assertThat(count).isEqualTo(1L);
    }

    @Test
    void nestedKeyPathsAreIndexed() throws Exception {
        Transaction tx = seed(Map.of("id", 1, "meta", Map.of("owner", "ada")));

        Optional<Object> found = finish(tx, tx.objectStore("todos").index("owner").get("ada"));

        assertThat(found).isPresent();
    }

    @Test
    void indexFollowsOverwritesAndDeletes() throws Exception {
        Transaction tx = seed(Map.of("id", 1, "userId", 7), Map.of("id", 2, "userId", 7));
        ObjectStoreHandle todos = tx.objectStore("todos");
        todos.put(Map.of("id", 1, "userId", 9));
        todos.delete(2);

        List<Object> keys = finish(tx, todos.index("userId").getAllKeys(KeyRange.unbounded(), 0));

        assertThat(keys).containsExactly(1);
    }

    @Test
    void unknownIndexIsNotFound() {
        Transaction tx = db.transaction(List.of("todos"));

        assertThatThrownBy(() -> tx.objectStore("todos").index("missing"))
            .isInstanceOf(StorageException.NotFound.class);
        tx.abort();
    }
}
