package io.shelfdb.client.operation;

import io.shelfdb.client.OperationRequest;

import java.util.ArrayList;
import java.util.List;

/**
 * Which fields of a request are present. Resolution looks only at this.
 */
public record RequestShape(boolean key, boolean value, boolean index, boolean where, boolean query) {

    public static RequestShape of(OperationRequest request) {
        return new RequestShape(
            request.hasKey(),
            request.hasValue(),
            request.hasIndex(),
            request.hasWhere(),
            request.hasQuery()
        );
    }

    @Override
    public String toString() {
        List<String> present = new ArrayList<>();
        if (key) {
            present.add("key");
        }
        if (value) {
            present.add("value");
        }
        if (index) {
            present.add("index");
        }
        if (where) {
            present.add("where");
        }
        if (query) {
            present.add("query");
        }
        return "{" + String.join(", ", present) + "}";
    }
}
