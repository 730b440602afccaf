package io.shelfdb.client;

import io.shelfdb.common.Direction;

import java.util.Map;
import java.util.Set;

/**
 * What a caller asks of a collection. Every field is optional; which fields are present decides the operation
 * that runs.
 *
 * @param key       primary key, or the indexed value when {@code index} is set
 * @param value     record to write
 * @param index     name of the index to read through
 * @param where     per-record function; selects a cursor walk
 * @param query     bounds of scans and cursor walks
 * @param count     maximum number of results; {@code null} or 0 means unlimited
 * @param direction cursor traversal order; scans are always ascending
 */
public record OperationRequest(
    Object key,
    Object value,
    String index,
    RecordFunction where,
    RangeQuery query,
    Integer count,
    Direction direction
) {

    private static final OperationRequest EMPTY = builder().build();

    public OperationRequest {
        if (index != null && index.isBlank()) {
            throw new ContractViolationException.InvalidIdentifier("Index name must not be blank");
        }
        if (count != null && count < 0) {
            throw new ContractViolationException.InvalidOption("count", "must not be negative, got " + count);
        }
    }

    public static OperationRequest empty() {
        return EMPTY;
    }

    public static OperationRequest ofKey(Object key) {
        return builder().key(key).build();
    }

    public static OperationRequest ofValue(Object value) {
        return builder().value(value).build();
    }

    public static OperationRequest matching(RecordFunction where) {
        return builder().where(where).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parses a loose option map ({@code key}, {@code value}, {@code index}, {@code where}, {@code query},
     * {@code count}, {@code direction}). Null values count as absent.
     */
    @SuppressWarnings("unchecked")
    public static OperationRequest fromOptions(Map<String, ?> options) {
        Builder builder = builder();
        if (options == null) {
            return builder.build();
        }
        for (Map.Entry<String, ?> option : options.entrySet()) {
            String name = option.getKey();
            Object value = option.getValue();
            if (value == null) {
                if (name == null || !Builder.OPTIONS.contains(name)) {
                    throw new ContractViolationException.InvalidOption(String.valueOf(name), "unknown option");
                }
                continue;
            }
            switch (String.valueOf(name)) {
                case "key" -> builder.key(value);
                case "value" -> builder.value(value);
                case "index" -> {
                    if (!(value instanceof String indexName)) {
                        throw new ContractViolationException.InvalidOption("index", "must be a string");
                    }
                    builder.index(indexName);
                }
                case "where" -> builder.where(RecordFunction.from(value));
                case "query" -> {
                    if (value instanceof RangeQuery query) {
                        builder.query(query);
                    } else if (value instanceof Map<?, ?> bounds) {
                        builder.query(RangeQuery.fromMap((Map<String, ?>) bounds));
                    } else {
                        throw new ContractViolationException.InvalidOption("query", "must be a range query or a map");
                    }
                }
                case "count" -> builder.count(parseCount(value));
                case "direction" -> builder.direction(parseDirection(value));
                default -> throw new ContractViolationException.InvalidOption(String.valueOf(name), "unknown option");
            }
        }
        return builder.build();
    }

    public boolean hasKey() {
        return key != null;
    }

    public boolean hasValue() {
        return value != null;
    }

    public boolean hasIndex() {
        return index != null;
    }

    public boolean hasWhere() {
        return where != null;
    }

    public boolean hasQuery() {
        return query != null;
    }

    public int limit() {
        return count == null ? 0 : count;
    }

    public Direction directionOrDefault() {
        return direction == null ? Direction.FORWARD : direction;
    }

    public Builder toBuilder() {
        return new Builder()
            .key(key)
            .value(value)
            .index(index)
            .where(where)
            .query(query)
            .count(count)
            .direction(direction);
    }

    private static int parseCount(Object value) {
        if (!(value instanceof Number number)) {
            throw new ContractViolationException.InvalidOption("count", "must be a number");
        }
        double raw = number.doubleValue();
        if (raw != Math.rint(raw) || raw > Integer.MAX_VALUE) {
            throw new ContractViolationException.InvalidOption("count", "must be a whole number, got " + number);
        }
        return (int) raw;
    }

    private static Direction parseDirection(Object value) {
        if (value instanceof Direction direction) {
            return direction;
        }
        if (!(value instanceof String label)) {
            throw new ContractViolationException.InvalidOption("direction", "must be a string");
        }
        try {
            return Direction.parse(label);
        } catch (IllegalArgumentException e) {
            throw new ContractViolationException.InvalidOption("direction", e.getMessage(), e);
        }
    }

    public static final class Builder {
        static final Set<String> OPTIONS = Set.of("key", "value", "index", "where", "query", "count", "direction");

        private Object key;
        private Object value;
        private String index;
        private RecordFunction where;
        private RangeQuery query;
        private Integer count;
        private Direction direction;

        private Builder() {
        }

        public Builder key(Object key) {
            this.key = key;
            return this;
        }

        public Builder value(Object value) {
            this.value = value;
            return this;
        }

        public Builder index(String index) {
            this.index = index;
            return this;
        }

        public Builder where(RecordFunction where) {
            this.where = where;
            return this;
        }

        public Builder query(RangeQuery query) {
            this.query = query;
            return this;
        }

        public Builder count(Integer count) {
            this.count = count;
            return this;
        }

        public Builder direction(Direction direction) {
            this.direction = direction;
            return this;
        }

        public OperationRequest build() {
            return new OperationRequest(key, value, index, where, query, count, direction);
        }
    }
}
