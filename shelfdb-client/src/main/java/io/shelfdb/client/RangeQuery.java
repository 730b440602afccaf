package io.shelfdb.client;

import java.util.Map;
import java.util.Set;

/**
 * Caller-facing bound descriptor: inclusive {@code start} and {@code end}, or an exact {@code only} key.
 * When {@code only} is present the other bounds are ignored.
 */
public record RangeQuery(Object start, Object end, Object only) {

    private static final RangeQuery ALL = new RangeQuery(null, null, null);
    private static final Set<String> FIELDS = Set.of("start", "end", "only");

    public static RangeQuery all() {
        return ALL;
    }

    public static RangeQuery only(Object key) {
        return new RangeQuery(null, null, key);
    }

    public static RangeQuery between(Object start, Object end) {
        return new RangeQuery(start, end, null);
    }

    public static RangeQuery from(Object start) {
        return new RangeQuery(start, null, null);
    }

    public static RangeQuery to(Object end) {
        return new RangeQuery(null, end, null);
    }

    public static RangeQuery fromMap(Map<String, ?> bounds) {
        for (String field : bounds.keySet()) {
            if (!FIELDS.contains(field)) {
                throw new ContractViolationException.InvalidOption("query", "unknown bound '" + field + "'");
            }
        }
        return new RangeQuery(bounds.get("start"), bounds.get("end"), bounds.get("only"));
    }

    public boolean hasStart() {
        return start != null;
    }

    public boolean hasEnd() {
        return end != null;
    }

    public boolean hasOnly() {
        return only != null;
    }
}
