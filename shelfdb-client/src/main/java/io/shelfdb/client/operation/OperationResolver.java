package io.shelfdb.client.operation;

import io.shelfdb.client.ContractViolationException;
import io.shelfdb.client.OperationRequest;
import io.shelfdb.client.OperationResult;
import io.shelfdb.common.Direction;
import io.shelfdb.storage.KeyRange;
import io.shelfdb.storage.ObjectStoreHandle;
import io.shelfdb.storage.RecordSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Turns a collection call into exactly one access path and runs it.
 * <p>
 * Resolution checks ordered guards over the {@link RequestShape}; the first guard that matches decides. When a
 * {@code where} function is present the walk is bounded by {@code query} alone and {@code key} and {@code value}
 * are not consulted.
 */
public final class OperationResolver {
    private static final Logger log = LoggerFactory.getLogger(OperationResolver.class);

    private final CursorEngine cursorEngine;

    public OperationResolver() {
        this(new CursorEngine());
    }

    public OperationResolver(CursorEngine cursorEngine) {
        this.cursorEngine = Objects.requireNonNull(cursorEngine, "cursorEngine must not be null");
    }

    public static ResolvedOperation resolve(OperationKind kind, OperationRequest request) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(request, "request must not be null");
        RequestShape shape = RequestShape.of(request);
        return switch (kind) {
            case ADD -> resolveAdd(shape);
            case FETCH -> resolveFetch(shape);
            case UPSERT -> resolveUpsert(shape);
            case REMOVE -> resolveRemove(shape);
        };
    }

    private static ResolvedOperation resolveAdd(RequestShape shape) {
        if (shape.value() && !shape.where() && !shape.index()) {
            return ResolvedOperation.INSERT;
        }
        throw new ContractViolationException.UnsupportedCombination(OperationKind.ADD, shape);
    }

    private static ResolvedOperation resolveFetch(RequestShape shape) {
        if (shape.key() && !shape.index() && !shape.where()) {
            return ResolvedOperation.KEY_LOOKUP;
        }
        if (!shape.key() && !shape.index() && !shape.where()) {
            return ResolvedOperation.RANGE_SCAN;
        }
        if (shape.key() && shape.index() && !shape.where()) {
            return ResolvedOperation.INDEX_KEY_LOOKUP;
        }
        if (!shape.key() && shape.index() && !shape.where()) {
            return ResolvedOperation.INDEX_RANGE_SCAN;
        }
        if (shape.where()) {
            return ResolvedOperation.CURSOR_FETCH;
        }
        throw new ContractViolationException.UnsupportedCombination(OperationKind.FETCH, shape);
    }

    private static ResolvedOperation resolveUpsert(RequestShape shape) {
        if (shape.value() && !shape.where() && !shape.index()) {
            return ResolvedOperation.DIRECT_WRITE;
        }
        if (shape.where()) {
            return ResolvedOperation.CURSOR_UPDATE;
        }
        throw new ContractViolationException.UnsupportedCombination(OperationKind.UPSERT, shape);
    }

    private static ResolvedOperation resolveRemove(RequestShape shape) {
        if (shape.key() && !shape.where() && !shape.index()) {
            return ResolvedOperation.DIRECT_DELETE;
        }
        if (shape.where()) {
            return ResolvedOperation.CURSOR_DELETE;
        }
        if (!shape.key() && !shape.index()) {
            return ResolvedOperation.CLEAR;
        }
        throw new ContractViolationException.UnsupportedCombination(OperationKind.REMOVE, shape);
    }

    /**
     * Resolves and runs the call. Contract violations and malformed keys come back as an already failed future
     * without touching the transaction.
     */
    public CompletableFuture<OperationResult> execute(
        ObjectStoreHandle store,
        OperationKind kind,
        OperationRequest request
    ) {
        Objects.requireNonNull(store, "store must not be null");
        try {
            ResolvedOperation operation = resolve(kind, request);
            log.debug("{} on '{}' resolved to {}", operation.kind().label(), store.name(), operation);
            return operation.usesCursor() ? runCursor(store, operation, request) : run(store, operation, request);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletableFuture<OperationResult> run(
        ObjectStoreHandle store,
        ResolvedOperation operation,
        OperationRequest request
    ) {
        return switch (operation) {
            case INSERT -> store.add(request.value(), request.key())
                .thenApply(OperationResult.Key::new);
            case KEY_LOOKUP -> store.get(request.key())
                .thenApply(OperationResult.Single::new);
            case RANGE_SCAN -> store.getAll(range(request), request.limit())
                .thenApply(OperationResult.Many::new);
            case INDEX_KEY_LOOKUP -> store.index(request.index()).get(request.key())
                .thenApply(OperationResult.Single::new);
            case INDEX_RANGE_SCAN -> store.index(request.index()).getAll(range(request), request.limit())
                .thenApply(OperationResult.Many::new);
            case DIRECT_WRITE -> store.put(request.value(), request.key())
                .thenApply(OperationResult.Key::new);
            case DIRECT_DELETE -> store.delete(request.key())
                .thenApply(ignored -> OperationResult.Done.INSTANCE);
            case CLEAR -> store.clear()
                .thenApply(ignored -> OperationResult.Done.INSTANCE);
            case CURSOR_FETCH, CURSOR_UPDATE, CURSOR_DELETE ->
                throw new IllegalStateException(operation + " is a cursor walk");
        };
    }

    private CompletableFuture<OperationResult> runCursor(
        ObjectStoreHandle store,
        ResolvedOperation operation,
        OperationRequest request
    ) {
        return switch (operation) {
            case CURSOR_FETCH -> walk(store, request, CursorPolicy.FETCH, request.limit())
                .thenApply(OperationResult.Many::new);
            case CURSOR_UPDATE -> walk(store, request, CursorPolicy.UPDATE, 0)
                .thenApply(OperationResult.Keys::new);
            case CURSOR_DELETE -> walk(store, request, CursorPolicy.DELETE, 0)
                .thenApply(ignored -> OperationResult.Done.INSTANCE);
            default -> throw new IllegalStateException(operation + " does not walk a cursor");
        };
    }

    private CompletableFuture<List<Object>> walk(
        ObjectStoreHandle store,
        OperationRequest request,
        CursorPolicy policy,
        int limit
    ) {
        RecordSource source = request.hasIndex() ? store.index(request.index()) : store;
        Direction direction = request.directionOrDefault();
        return cursorEngine.walk(source, range(request), direction, request.where(), policy, limit);
    }

    private static KeyRange range(OperationRequest request) {
        return RangeBuilder.build(request.query());
    }
}
