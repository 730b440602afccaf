package io.shelfdb.benchmark;

import io.shelfdb.client.OperationRequest;
import io.shelfdb.client.OperationResult;
import io.shelfdb.client.RangeQuery;
import io.shelfdb.client.RecordFunction;
import io.shelfdb.client.ShelfDb;
import io.shelfdb.common.Direction;
import io.shelfdb.storage.DatabaseConfig;
import io.shelfdb.storage.IndexDefinition;
import io.shelfdb.storage.StorageEngine;
import io.shelfdb.storage.StoreDefinition;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

@State(Scope.Benchmark)
@Fork(1)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
public class ScanPathBenchmark {

    private static final int RECORD_COUNT = 100_000;
    private static final int USER_COUNT = 1_000;

    private StorageEngine engine;
    private ShelfDb db;

    @Setup(Level.Trial)
    public void setup() {
        engine = StorageEngine.create();
        db = ShelfDb.open(engine, DatabaseConfig.builder()
            .name("scan-bench")
            .store(StoreDefinition.of("todos").withIndex(IndexDefinition.of("userId")))
            .build()).join();

        db.transaction(List.of("todos"), scope -> {
            List<CompletableFuture<OperationResult>> writes = new ArrayList<>(RECORD_COUNT);
            for (int i = 1; i <= RECORD_COUNT; i++) {
                writes.add(scope.collection("todos").upsert(OperationRequest.ofValue(
                    Map.of("id", i, "userId", i % USER_COUNT, "done", i % 2 == 0))));
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
    @BenchmarkMode({Mode.Throughput, Mode.SampleTime})
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    @OperationsPerInvocation(100)
    public void rangeScan100(Blackhole bh) {
        int start = 1 + ThreadLocalRandom.current().nextInt(RECORD_COUNT - 100);
        consume(bh, fetch(OperationRequest.builder().query(RangeQuery.between(start, start + 99)).build()));
    }

    @Benchmark
    @BenchmarkMode({Mode.Throughput, Mode.SampleTime})
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public void indexRangeScan(Blackhole bh) {
        int userId = ThreadLocalRandom.current().nextInt(USER_COUNT - 10);
        consume(bh, fetch(OperationRequest.builder()
            .index("userId")
            .query(RangeQuery.between(userId, userId + 9))
            .build()));
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public void cursorFetchFiltered(Blackhole bh) {
        int start = 1 + ThreadLocalRandom.current().nextInt(RECORD_COUNT - 1_000);
        consume(bh, fetch(OperationRequest.builder()
            .query(RangeQuery.between(start, start + 999))
            .where(RecordFunction.select(record -> Boolean.TRUE.equals(((Map<?, ?>) record).get("done"))))
            .direction(Direction.REVERSE)
            .build()));
    }

    private OperationResult fetch(OperationRequest request) {
        return db.transaction(List.of("todos"), scope -> scope.collection("todos").fetch(request)).join();
    }

    private static void consume(Blackhole bh, OperationResult result) {
        for (Object record : result.list()) {
            bh.consume(record);
        }
    }
}
