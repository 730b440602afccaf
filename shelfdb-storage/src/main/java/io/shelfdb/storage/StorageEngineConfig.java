package io.shelfdb.storage;

import java.time.Duration;
import java.util.Objects;

public record StorageEngineConfig(
    String threadName,
    Duration shutdownTimeout
) {
    public StorageEngineConfig {
        Objects.requireNonNull(threadName, "threadName must not be null");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout must not be null");
        if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must not be negative");
        }
    }

    public static StorageEngineConfig defaults() {
        return new StorageEngineConfig("shelfdb-event-loop", Duration.ofSeconds(30));
    }

    public StorageEngineConfig withThreadName(String threadName) {
        return new StorageEngineConfig(threadName, shutdownTimeout);
    }

    public StorageEngineConfig withShutdownTimeout(Duration shutdownTimeout) {
        return new StorageEngineConfig(threadName, shutdownTimeout);
    }
}
