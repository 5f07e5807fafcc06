package decentralabs.staking.service.staking;

import decentralabs.staking.event.StakeEvent;
import decentralabs.staking.event.WithdrawEvent;
import decentralabs.staking.exception.StakingError;
import decentralabs.staking.exception.StakingException;
import decentralabs.staking.service.persistence.PendingTransferStore;
import decentralabs.staking.service.persistence.StakeStore;
import decentralabs.staking.util.AccountIds;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Reconciles token transfers whose outcome was unknown when the ledger
 * operation finished. The owner checks the transaction on chain and reports
 * whether it was mined successfully.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PendingTransferService {

    private final PendingTransferStore store;
    private final StakeStore stakeStore;
    private final WithdrawalPoolService withdrawalPool;
    private final StakingConfigurationService configurationService;
    private final LedgerGuard ledgerGuard;
    private final ApplicationEventPublisher eventPublisher;

    public List<PendingTransfer> getPendingTransfers() {
        return store.findAll();
    }

    /**
     * Closes a pending transfer.
     *
     * A confirmed payout or deposit publishes the event that was held back. A
     * payout that did not go through is credited back to the withdrawal pool; a
     * deposit that did not go through closes the stake it opened.
     */
    public PendingTransfer resolve(String caller, String transactionHash, boolean confirmed) {
        configurationService.requireOwner(caller, "resolveTransfer");
        return ledgerGuard.execute("resolveTransfer", () -> {
            PendingTransfer transfer = store.remove(transactionHash)
                .orElseThrow(() -> new StakingException(StakingError.UNKNOWN_TRANSFER, "resolveTransfer"));
            String account = transfer.getAccount();

            if (transfer.getKind() == PendingTransfer.Kind.PAYOUT) {
                if (confirmed) {
                    eventPublisher.publishEvent(new WithdrawEvent(this, account, transfer.getAmount(),
                        transfer.getBlockNumber()));
                } else {
                    withdrawalPool.credit(account, transfer.getAmount());
                }
            } else if (confirmed) {
                eventPublisher.publishEvent(new StakeEvent(this, account, transfer.getAmount(),
                    transfer.getBlockNumber()));
            } else {
                UserStake current = stakeStore.get(account);
                if (current.isActive()
                    && current.getStakeAmount().equals(transfer.getAmount())
                    && current.getStakeStartBlockNumber().equals(transfer.getBlockNumber())) {
                    stakeStore.put(account, UserStake.inactive());
                }
            }

            log.info("Resolved {} {} for {} as {}", transfer.getKind(), transfer.getTransactionHash(),
                AccountIds.mask(account), confirmed ? "confirmed" : "failed");
            return transfer;
        });
    }
}
