package io.shelfdb.storage;

import io.shelfdb.common.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single-threaded task queue on which every storage request, cursor step and completion callback runs.
 * <p>
 * Code that may block, such as caller transaction logic or continuations chained on a result handed to a caller,
 * belongs on {@link #callbackExecutor()} instead. A task that blocks the loop thread stalls every database of the
 * engine.
 */
public final class EventLoop implements Executor, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EventLoop.class);

    private final String name;
    private final Duration shutdownTimeout;
    private final ExecutorService executor;
    private final ExecutorService callbacks;
    private volatile Thread thread;

    EventLoop(String name, Duration shutdownTimeout) {
        this.name = name;
        this.shutdownTimeout = shutdownTimeout;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread t = new Thread(runnable, name);
            t.setDaemon(true);
            thread = t;
            return t;
        });
        AtomicInteger callbackThreads = new AtomicInteger();
        this.callbacks = Executors.newCachedThreadPool(runnable -> {
            Thread t = new Thread(runnable, name + "-callback-" + callbackThreads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Pool on which caller-facing work runs, off the loop thread.
     */
    public Executor callbackExecutor() {
        return callbacks;
    }

    public boolean inEventLoop() {
        return Thread.currentThread() == thread;
    }

    @Override
    public void execute(Runnable task) {
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Unhandled exception in event loop task", e);
                }
            });
        } catch (RejectedExecutionException e) {
            throw new StorageException.Closed("Event loop " + name + " is shut down");
        }
    }

    public void runInLoop(Runnable task) {
        if (inEventLoop()) {
            task.run();
        } else {
            execute(task);
        }
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    @Override
    public void close() {
        drain(executor, name);
        drain(callbacks, name + "-callback");
    }

    private void drain(ExecutorService service, String label) {
        service.shutdown();
        try {
            if (!service.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Executor {} did not drain within {}, forcing shutdown", label, shutdownTimeout);
                service.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            service.shutdownNow();
        }
    }
}
