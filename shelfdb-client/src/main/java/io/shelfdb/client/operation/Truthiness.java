package io.shelfdb.client.operation;

import java.util.Map;

final class Truthiness {

    private Truthiness() {
    }

    static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (value instanceof CharSequence text) {
            return text.length() > 0;
        }
        return true;
    }

    static boolean isReplacement(Object value) {
        return value instanceof Map<?, ?> map && !map.isEmpty();
    }

    static boolean isDeletion(Object value) {
        return Boolean.TRUE.equals(value);
    }
}
