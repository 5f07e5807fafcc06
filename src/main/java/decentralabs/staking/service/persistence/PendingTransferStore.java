package decentralabs.staking.service.persistence;

import decentralabs.staking.service.staking.PendingTransfer;
import java.util.List;
import java.util.Optional;

/**
 * Transfers awaiting reconciliation, keyed by transaction hash.
 */
public interface PendingTransferStore {

    void put(PendingTransfer transfer);

    Optional<PendingTransfer> remove(String transactionHash);

    boolean hasPending(String account, PendingTransfer.Kind kind);

    List<PendingTransfer> findAll();
}
