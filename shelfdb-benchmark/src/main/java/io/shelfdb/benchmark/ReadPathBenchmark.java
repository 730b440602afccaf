package io.shelfdb.benchmark;

import io.shelfdb.client.OperationRequest;
import io.shelfdb.client.OperationResult;
import io.shelfdb.client.ShelfDb;
import io.shelfdb.storage.DatabaseConfig;
import io.shelfdb.storage.IndexDefinition;
import io.shelfdb.storage.StorageEngine;
import io.shelfdb.storage.StoreDefinition;
import org.openjdk.jmh.annotations.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

@BenchmarkMode({Mode.Throughput, Mode.SampleTime})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(1)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
public class ReadPathBenchmark {

    private static final int USER_COUNT = 100;

    @Param({"10000", "100000"})
    private int recordCount;

    private StorageEngine engine;
    private ShelfDb db;

    @Setup(Level.Trial)
    public void setup() {
        engine = StorageEngine.create();
        db = ShelfDb.open(engine, DatabaseConfig.builder()
            .name("read-bench")
            .store(StoreDefinition.of("todos").withIndex(IndexDefinition.of("userId")))
            .build()).join();

        db.transaction(List.of("todos"), scope -> {
            List<CompletableFuture<OperationResult>> writes = new ArrayList<>(recordCount);
            for (int i = 1; i <= recordCount; i++) {
                writes.add(scope.collection("todos").upsert(OperationRequest.ofValue(
                    Map.of("id", i, "userId", i % USER_COUNT, "title", "todo " + i))));
            }
            return CompletableFuture.allOf(writes.toArray(new CompletableFuture<?>[0]));
        }).join();
    }

    @TearDown(Level.Trial)
    public void tearDown() {
        db.close();
        engine.close();
    }

    @Benchmark
    public OperationResult keyLookup() {
        int key = 1 + ThreadLocalRandom.current().nextInt(recordCount);
        return fetch(OperationRequest.ofKey(key));
    }

    @Benchmark
    public OperationResult keyLookupMissing() {
        return fetch(OperationRequest.ofKey(recordCount + 1 + ThreadLocalRandom.current().nextInt(recordCount)));
    }

    @Benchmark
    public OperationResult indexKeyLookup() {
        int userId = ThreadLocalRandom.current().nextInt(USER_COUNT);
        return fetch(OperationRequest.builder().key(userId).index("userId").build());
    }

    private OperationResult fetch(OperationRequest request) {
        return db.transaction(List.of("todos"), scope -> scope.collection("todos").fetch(request)).join();
    }
}
