package io.shelfdb.client.operation;

/**
 * The single access path a collection call resolves to.
 */
public enum ResolvedOperation {
    INSERT(OperationKind.ADD, false),
    KEY_LOOKUP(OperationKind.FETCH, false),
    RANGE_SCAN(OperationKind.FETCH, false),
    INDEX_KEY_LOOKUP(OperationKind.FETCH, false),
    INDEX_RANGE_SCAN(OperationKind.FETCH, false),
    CURSOR_FETCH(OperationKind.FETCH, true),
    DIRECT_WRITE(OperationKind.UPSERT, false),
    CURSOR_UPDATE(OperationKind.UPSERT, true),
    DIRECT_DELETE(OperationKind.REMOVE, false),
    CURSOR_DELETE(OperationKind.REMOVE, true),
    CLEAR(OperationKind.REMOVE, false);

    private final OperationKind kind;
    private final boolean cursor;

    ResolvedOperation(OperationKind kind, boolean cursor) {
        this.kind = kind;
        this.cursor = cursor;
    }

    public OperationKind kind() {
        return kind;
    }

    public boolean usesCursor() {
        return cursor;
    }
}
