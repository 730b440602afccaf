package io.shelfdb.client.operation;

/**
 * What a cursor walk does with each predicate result.
 */
public enum CursorPolicy {
    /** Collect truthy results. */
    FETCH,
    /** Write non-empty map results back in place and collect the confirmed keys. */
    UPDATE,
    /** Delete the entry when the result is exactly {@code true}. */
    DELETE
}
