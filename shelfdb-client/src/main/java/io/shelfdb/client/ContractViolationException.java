package io.shelfdb.client;

import io.shelfdb.client.operation.OperationKind;
import io.shelfdb.client.operation.RequestShape;

/**
 * A call the caller should not have made. Never retried; the same call fails the same way again.
 */
public sealed class ContractViolationException extends RuntimeException
    permits ContractViolationException.UnsupportedCombination,
            ContractViolationException.PredicateNotCallable,
            ContractViolationException.InvalidOption,
            ContractViolationException.InvalidIdentifier,
            ContractViolationException.ScopeClosed {

    protected ContractViolationException(String message) {
        super(message);
    }

    protected ContractViolationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static final class UnsupportedCombination extends ContractViolationException {
        private final OperationKind kind;
        private final RequestShape shape;

        public UnsupportedCombination(OperationKind kind, RequestShape shape) {
            super("Unsupported option combination for " + kind.label() + ": " + shape);
            this.kind = kind;
            this.shape = shape;
        }

        public OperationKind kind() {
            return kind;
        }

        public RequestShape shape() {
            return shape;
        }
    }

    public static final class PredicateNotCallable extends ContractViolationException {
        public PredicateNotCallable(String message) {
            super(message);
        }
    }

    public static final class InvalidOption extends ContractViolationException {
        private final String option;

        public InvalidOption(String option, String message) {
            super("Invalid option '" + option + "': " + message);
            this.option = option;
        }

        public InvalidOption(String option, String message, Throwable cause) {
            super("Invalid option '" + option + "': " + message, cause);
            this.option = option;
        }

        public String option() {
            return option;
        }
    }

    public static final class InvalidIdentifier extends ContractViolationException {
        public InvalidIdentifier(String message) {
            super(message);
        }
    }

    public static final class ScopeClosed extends ContractViolationException {
        private final long transactionId;

        public ScopeClosed(long transactionId) {
            super("Transaction scope " + transactionId + " is already finished");
            this.transactionId = transactionId;
        }

        public long transactionId() {
            return transactionId;
        }
    }
}
