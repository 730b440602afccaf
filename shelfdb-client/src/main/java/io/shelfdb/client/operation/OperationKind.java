package io.shelfdb.client.operation;

public enum OperationKind {
    ADD("add"),
    FETCH("fetch"),
    UPSERT("upsert"),
    REMOVE("remove");

    private final String label;

    OperationKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
