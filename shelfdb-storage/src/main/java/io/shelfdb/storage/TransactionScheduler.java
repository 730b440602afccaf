package io.shelfdb.storage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Starts tasks in submission order as soon as no running or earlier queued task shares a store with them.
 * Confined to the event loop.
 */
final class TransactionScheduler {

    private final EventLoop loop;
    private final List<ScopedTask> running = new ArrayList<>();
    private final Deque<ScopedTask> queued = new ArrayDeque<>();

    TransactionScheduler(EventLoop loop) {
        this.loop = loop;
    }

    void submit(ScopedTask task) {
        loop.runInLoop(() -> {
            queued.addLast(task);
            dispatch();
        });
    }

    void release(ScopedTask task) {
        loop.runInLoop(() -> {
            if (running.remove(task) || queued.remove(task)) {
                dispatch();
            }
        });
    }

    private void dispatch() {
        Set<String> blocked = new HashSet<>();
        boolean blockAll = false;
        for (ScopedTask task : running) {
            blocked.addAll(task.scope());
            blockAll |= task.exclusive();
        }

        Iterator<ScopedTask> it = queued.iterator();
        while (it.hasNext()) {
            ScopedTask task = it.next();
            boolean conflicts = blockAll
                || (task.exclusive() && (!running.isEmpty() || !blocked.isEmpty()))
                || !Collections.disjoint(blocked, task.scope());
            if (!conflicts) {
                it.remove();
                running.add(task);
                loop.execute(task::start);
            }
            blocked.addAll(task.scope());
            blockAll |= task.exclusive();
        }
    }
}
