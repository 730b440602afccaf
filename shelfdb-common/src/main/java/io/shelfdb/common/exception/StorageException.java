package io.shelfdb.common.exception;

public sealed class StorageException extends RuntimeException
    permits StorageException.ConstraintError,
            StorageException.DataError,
            StorageException.NotFound,
            StorageException.TransactionInactive,
            StorageException.TransactionAborted,
            StorageException.VersionError,
            StorageException.Closed {

    protected StorageException(String message) {
        super(message);
    }

    protected StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public static final class ConstraintError extends StorageException {
        public ConstraintError(String message) {
            super(message);
        }
    }

    public static final class DataError extends StorageException {
        public DataError(String message) {
            super(message);
        }
    }

    public static final class NotFound extends StorageException {
        public NotFound(String message) {
            super(message);
        }
    }

    public static final class TransactionInactive extends StorageException {
        public TransactionInactive(String message) {
            super(message);
        }
    }

    public static final class TransactionAborted extends StorageException {
        public TransactionAborted(String message) {
            super(message);
        }

        public TransactionAborted(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static final class VersionError extends StorageException {
        private final long storedVersion;
        private final long requestedVersion;

        public VersionError(long storedVersion, long requestedVersion) {
            super("Requested version " + requestedVersion + " is lower than stored version " + storedVersion);
            this.storedVersion = storedVersion;
            this.requestedVersion = requestedVersion;
        }

        public long storedVersion() {
            return storedVersion;
        }

        public long requestedVersion() {
            return requestedVersion;
        }
    }

    public static final class Closed extends StorageException {
        public Closed(String message) {
            super(message);
        }
    }
}
