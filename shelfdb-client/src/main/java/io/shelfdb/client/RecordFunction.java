package io.shelfdb.client;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Caller code applied to each record of a cursor walk. What the return value means depends on the call:
 * a fetch collects truthy results, an upsert writes back non-empty map results, a remove deletes the record when
 * the result is {@code Boolean.TRUE}.
 */
@FunctionalInterface
public interface RecordFunction {

    Object apply(Object record);

    /**
     * For fetches: collects the record itself when the predicate holds.
     */
    static RecordFunction select(Predicate<Object> predicate) {
        return record -> predicate.test(record) ? record : null;
    }

    @SuppressWarnings("unchecked")
    static RecordFunction from(Object candidate) {
        if (candidate instanceof RecordFunction function) {
            return function;
        }
        if (candidate instanceof Function<?, ?> function) {
            return ((Function<Object, Object>) function)::apply;
        }
        if (candidate instanceof Predicate<?> predicate) {
            return ((Predicate<Object>) predicate)::test;
        }
        String type = candidate == null ? "null" : candidate.getClass().getName();
        throw new ContractViolationException.PredicateNotCallable("where must be a function, got " + type);
    }
}
