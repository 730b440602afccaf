package io.shelfdb.common;

import java.util.Locale;

public enum Direction {
    FORWARD("forward", false, false),
    REVERSE("reverse", true, false),
    FORWARD_UNIQUE("forward-unique", false, true),
    REVERSE_UNIQUE("reverse-unique", true, true);

    private final String label;
    private final boolean reverse;
    private final boolean unique;

    Direction(String label, boolean reverse, boolean unique) {
        this.label = label;
        this.reverse = reverse;
        this.unique = unique;
    }

    public String label() {
        return label;
    }

    public boolean isReverse() {
        return reverse;
    }

    public boolean isUnique() {
        return unique;
    }

    public static Direction parse(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "forward", "next" -> FORWARD;
            case "reverse", "prev" -> REVERSE;
            case "forward-unique", "nextunique" -> FORWARD_UNIQUE;
            case "reverse-unique", "prevunique" -> REVERSE_UNIQUE;
            default -> throw new IllegalArgumentException("Unknown direction: " + value);
        };
    }
}
