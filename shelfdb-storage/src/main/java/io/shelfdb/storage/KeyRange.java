package io.shelfdb.storage;

import io.shelfdb.common.Keys;
import io.shelfdb.common.exception.StorageException;

public record KeyRange(Object lower, Object upper, boolean lowerOpen, boolean upperOpen) {

    private static final KeyRange UNBOUNDED = new KeyRange(null, null, false, false);

    public KeyRange {
        if (lower != null) {
            lower = Keys.validate(lower);
        }
        if (upper != null) {
            upper = Keys.validate(upper);
        }
        if (lower != null && upper != null) {
            int cmp = Keys.compare(lower, upper);
            if (cmp > 0) {
                throw new StorageException.DataError("Lower bound " + lower + " is above upper bound " + upper);
            }
            if (cmp == 0 && (lowerOpen || upperOpen)) {
                throw new StorageException.DataError("Equal bounds cannot be open: " + lower);
            }
        }
    }

    public static KeyRange only(Object key) {
        return new KeyRange(requireKey(key), key, false, false);
    }

    public static KeyRange bound(Object lower, Object upper) {
        return bound(lower, upper, false, false);
    }

    public static KeyRange bound(Object lower, Object upper, boolean lowerOpen, boolean upperOpen) {
        return new KeyRange(requireKey(lower), requireKey(upper), lowerOpen, upperOpen);
    }

    public static KeyRange lowerBound(Object lower) {
        return lowerBound(lower, false);
    }

    public static KeyRange lowerBound(Object lower, boolean open) {
        return new KeyRange(requireKey(lower), null, open, false);
    }

    public static KeyRange upperBound(Object upper) {
        return upperBound(upper, false);
    }

    public static KeyRange upperBound(Object upper, boolean open) {
        return new KeyRange(null, requireKey(upper), false, open);
    }

    public static KeyRange unbounded() {
        return UNBOUNDED;
    }

    /**
     * Normalizes a request argument that may be either a single key or a range.
     */
    public static KeyRange of(Object keyOrRange) {
        if (keyOrRange instanceof KeyRange range) {
            return range;
        }
        return only(keyOrRange);
    }

    public boolean isUnbounded() {
        return lower == null && upper == null;
    }

    public boolean isSingleKey() {
        return lower != null && upper != null && Keys.equal(lower, upper);
    }

    public boolean includes(Object key) {
        return !isAbove(key) && !isBelow(key);
    }

    /**
     * True when every key of the range sorts after {@code key}.
     */
    private boolean isAbove(Object key) {
        if (lower == null) {
            return false;
        }
        int cmp = Keys.compare(key, lower);
        return cmp < 0 || (cmp == 0 && lowerOpen);
    }

    /**
     * True when every key of the range sorts before {@code key}.
     */
    private boolean isBelow(Object key) {
        if (upper == null) {
            return false;
        }
        int cmp = Keys.compare(key, upper);
        return cmp > 0 || (cmp == 0 && upperOpen);
    }

    private static Object requireKey(Object key) {
        if (key == null) {
            throw new StorageException.DataError("Range bound must not be null");
        }
        return key;
    }
}
