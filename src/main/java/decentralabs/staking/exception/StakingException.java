package decentralabs.staking.exception;

/**
 * Exception thrown when a ledger operation is rejected. No state has been
 * changed when this is thrown, except for {@link StakingError#TRANSFER_PENDING}
 * where the ledger side stays applied until the transfer is resolved.
 */
public class StakingException extends RuntimeException {

    private final StakingError error;
    private final String operation;

    public StakingException(StakingError error, String operation) {
        this(error, operation, error.getDefaultMessage());
    }

    public StakingException(StakingError error, String operation, String message) {
        super(message);
        this.error = error;
        this.operation = operation;
    }

    public StakingException(StakingError error, String operation, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
        this.operation = operation;
    }

    public StakingError getError() {
        return error;
    }

    public String getOperation() {
        return operation;
    }
}
