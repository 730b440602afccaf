package io.shelfdb.benchmark;

import io.shelfdb.client.OperationRequest;
import io.shelfdb.client.OperationResult;
import io.shelfdb.client.ShelfDb;
import io.shelfdb.storage.DatabaseConfig;
import io.shelfdb.storage.IndexDefinition;
import io.shelfdb.storage.StorageEngine;
import io.shelfdb.storage.StoreDefinition;
import org.openjdk.jmh.annotations.*;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

@BenchmarkMode({Mode.Throughput, Mode.SampleTime})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(1)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
public class WritePathBenchmark {

    @Param({"0", "1"})
    private int indexCount;

    private StorageEngine engine;
    private ShelfDb db;
    private AtomicLong keyCounter;

    @Setup(Level.Trial)
    public void setup() {
        StoreDefinition todos = StoreDefinition.of("todos");
        if (indexCount > 0) {
            todos = todos.withIndex(IndexDefinition.of("userId"));
        }
        engine = StorageEngine.create();
        db = ShelfDb.open(engine, DatabaseConfig.builder().name("write-bench").store(todos).build()).join();
        keyCounter = new AtomicLong(0);
    }

    @TearDown(Level.Trial)
    public void tearDown() {
        db.close();
        engine.close();
    }

    @Benchmark
    public OperationResult upsertGeneratedKey() {
        return upsert(OperationRequest.ofValue(Map.of("userId", ThreadLocalRandom.current().nextInt(1_000))));
    }

    @Benchmark
    public OperationResult upsertSequentialKey() {
        long key = keyCounter.incrementAndGet();
        return upsert(OperationRequest.builder()
            .key(key)
            .value(Map.of("userId", key % 1_000))
            .build());
    }

    private OperationResult upsert(OperationRequest request) {
        return db.transaction(List.of("todos"), scope -> scope.collection("todos").upsert(request)).join();
    }
}
