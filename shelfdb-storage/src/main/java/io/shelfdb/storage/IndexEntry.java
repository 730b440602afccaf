package io.shelfdb.storage;

import io.shelfdb.common.Keys;

record IndexEntry(Object indexKey, Object primaryKey) implements Comparable<IndexEntry> {

    private static final Object LOWEST = new Object();
    private static final Object HIGHEST = new Object();

    static IndexEntry lowest(Object indexKey) {
        return new IndexEntry(indexKey, LOWEST);
    }

    static IndexEntry highest(Object indexKey) {
        return new IndexEntry(indexKey, HIGHEST);
    }

    @Override
    public int compareTo(IndexEntry other) {
        int cmp = Keys.compare(indexKey, other.indexKey);
        if (cmp != 0) {
            return cmp;
        }
        return comparePrimary(primaryKey, other.primaryKey);
    }

    private static int comparePrimary(Object a, Object b) {
        if (a == b) {
            return 0;
        }
        if (a == LOWEST || b == HIGHEST) {
            return -1;
        }
        if (a == HIGHEST || b == LOWEST) {
            return 1;
        }
        return Keys.compare(a, b);
    }
}
