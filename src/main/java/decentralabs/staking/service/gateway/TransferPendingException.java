package decentralabs.staking.service.gateway;

/**
 * A transfer reached the node but its outcome is not known yet. It may still be
 * mined, so callers must not undo the ledger side of the operation.
 */
public class TransferPendingException extends RuntimeException {

    private final String transactionHash;

    public TransferPendingException(String transactionHash, String message) {
        super(message);
        this.transactionHash = transactionHash;
    }

    public TransferPendingException(String transactionHash, String message, Throwable cause) {
        super(message, cause);
        this.transactionHash = transactionHash;
    }

    public String getTransactionHash() {
        return transactionHash;
    }
}
