package io.shelfdb.common;

import io.shelfdb.common.exception.StorageException;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Validation and total ordering of record keys.
 * <p>
 * Valid keys are finite numbers, instants, strings and lists of valid keys.
 * Keys of different types order as numbers, then instants, then strings, then lists.
 * Numbers compare by value, so {@code 5}, {@code 5L} and {@code 5.0} denote the same key.
 */
public final class Keys {

    public static final Comparator<Object> COMPARATOR = Keys::compare;

    private static final int NUMBER = 1;
    private static final int INSTANT = 2;
    private static final int STRING = 3;
    private static final int LIST = 4;

    private Keys() {}

    public static boolean isValid(Object key) {
        return rank(key) != 0;
    }

    public static Object validate(Object key) {
        if (!isValid(key)) {
            throw new StorageException.DataError("Not a valid key: " + describe(key));
        }
        if (key instanceof List<?> list) {
            return List.copyOf(list);
        }
        return key;
    }

    public static int compare(Object a, Object b) {
        int rankA = rank(a);
        int rankB = rank(b);
        if (rankA == 0 || rankB == 0) {
            throw new StorageException.DataError("Cannot compare invalid keys: " + describe(a) + ", " + describe(b));
        }
        if (rankA != rankB) {
            return Integer.compare(rankA, rankB);
        }
        return switch (rankA) {
            case NUMBER -> compareNumbers((Number) a, (Number) b);
            case INSTANT -> ((Instant) a).compareTo((Instant) b);
            case STRING -> ((String) a).compareTo((String) b);
            default -> compareLists((List<?>) a, (List<?>) b);
        };
    }

    public static boolean equal(Object a, Object b) {
        return compare(a, b) == 0;
    }

    private static int rank(Object key) {
        if (key instanceof Number number) {
            return isFinite(number) ? NUMBER : 0;
        }
        if (key instanceof Instant) {
            return INSTANT;
        }
        if (key instanceof String) {
            return STRING;
        }
        if (key instanceof List<?> list) {
            for (Object element : list) {
                if (rank(element) == 0) {
                    return 0;
                }
            }
            return LIST;
        }
        return 0;
    }

    private static boolean isFinite(Number number) {
        if (number instanceof Double || number instanceof Float) {
            return Double.isFinite(number.doubleValue());
        }
        return true;
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Integer
            || number instanceof Long
            || number instanceof Short
            || number instanceof Byte;
    }

    private static int compareNumbers(Number a, Number b) {
        if (isIntegral(a) && isIntegral(b)) {
            return Long.compare(a.longValue(), b.longValue());
        }
        return Double.compare(a.doubleValue() + 0.0, b.doubleValue() + 0.0);
    }

    private static int compareLists(List<?> a, List<?> b) {
        int length = Math.min(a.size(), b.size());
        for (int i = 0; i < length; i++) {
            int cmp = compare(a.get(i), b.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    private static String describe(Object key) {
        if (key == null) {
            return "null";
        }
        return key + " (" + key.getClass().getSimpleName() + ")";
    }
}
