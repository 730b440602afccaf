package io.shelfdb.client.operation;

import io.shelfdb.client.ContractViolationException;
import io.shelfdb.client.RecordFunction;
import io.shelfdb.common.Direction;
import io.shelfdb.storage.Cursor;
import io.shelfdb.storage.CursorEntry;
import io.shelfdb.storage.KeyRange;
import io.shelfdb.storage.RecordSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Walks a store or index with a cursor and applies a per-record function to each entry.
 * <p>
 * The walk advances as soon as the current entry has been handled; it does not wait for the update or delete
 * issued for that entry. Requests run in the order they are issued, so every sub-request settles before the walk
 * sees the end of the range.
 */
public final class CursorEngine {
    private static final Logger log = LoggerFactory.getLogger(CursorEngine.class);

    public CompletableFuture<List<Object>> walk(
        RecordSource source,
        KeyRange range,
        Direction direction,
        RecordFunction function,
        CursorPolicy policy,
        int limit
    ) {
        if (function == null) {
            return CompletableFuture.failedFuture(
                new ContractViolationException.PredicateNotCallable("A cursor walk needs a where function"));
        }
        ResultAccumulator<Object> accumulator = new ResultAccumulator<>(limit);
        Cursor cursor;
        try {
            cursor = source.openCursor(range, direction);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        log.debug("Walking '{}' {} over {} ({})", source.name(), direction.label(), range, policy);
        new Walk(cursor, function, policy, accumulator).advance();
        return accumulator.result();
    }

    private static final class Walk {
        private final Cursor cursor;
        private final RecordFunction function;
        private final CursorPolicy policy;
        private final ResultAccumulator<Object> accumulator;

        Walk(Cursor cursor, RecordFunction function, CursorPolicy policy, ResultAccumulator<Object> accumulator) {
            this.cursor = cursor;
            this.function = function;
            this.policy = policy;
            this.accumulator = accumulator;
        }

        void advance() {
            cursor.next().whenComplete(this::onEntry);
        }

        private void onEntry(Optional<CursorEntry> entry, Throwable error) {
            if (error != null) {
                accumulator.fail(error);
                return;
            }
            if (accumulator.isSettled()) {
                return;
            }
            if (entry.isEmpty()) {
                accumulator.exhausted();
                return;
            }
            try {
                visit(entry.get());
            } catch (RuntimeException e) {
                accumulator.fail(e);
                return;
            }
            if (accumulator.isSettled()) {
                return;
            }
            if (accumulator.isFull()) {
                accumulator.exhausted();
                return;
            }
            advance();
        }

        private void visit(CursorEntry entry) {
            Object outcome = function.apply(entry.value());
            switch (policy) {
                case FETCH -> {
                    if (Truthiness.isTruthy(outcome)) {
                        accumulator.append(outcome);
                    }
                }
                case UPDATE -> {
                    if (Truthiness.isReplacement(outcome)) {
                        accumulator.track(cursor.update(outcome), key -> key);
                    }
                }
                case DELETE -> {
                    if (Truthiness.isDeletion(outcome)) {
                        accumulator.track(cursor.delete(), null);
                    }
                }
            }
        }
    }
}
