package io.shelfdb.storage;

import java.util.Set;

interface ScopedTask {

    Set<String> scope();

    /**
     * Whether the task conflicts with every other task regardless of scope, as schema changes do.
     */
    boolean exclusive();

    void start();
}
