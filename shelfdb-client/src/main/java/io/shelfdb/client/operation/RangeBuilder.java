package io.shelfdb.client.operation;

import io.shelfdb.client.RangeQuery;
import io.shelfdb.storage.KeyRange;

public final class RangeBuilder {

    private RangeBuilder() {
    }

    /**
     * {@code only} wins over {@code start}/{@code end}; both ends are inclusive. A missing query is unbounded.
     */
    public static KeyRange build(RangeQuery query) {
        if (query == null) {
            return KeyRange.unbounded();
        }
        if (query.hasOnly()) {
            return KeyRange.only(query.only());
        }
        if (query.hasStart() && query.hasEnd()) {
            return KeyRange.bound(query.start(), query.end());
        }
        if (query.hasStart()) {
            return KeyRange.lowerBound(query.start());
        }
        if (query.hasEnd()) {
            return KeyRange.upperBound(query.end());
        }
        return KeyRange.unbounded();
    }
}
