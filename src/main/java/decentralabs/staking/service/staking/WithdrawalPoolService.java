package decentralabs.staking.service.staking;

import decentralabs.staking.event.WithdrawEvent;
import decentralabs.staking.exception.StakingError;
import decentralabs.staking.exception.StakingException;
import decentralabs.staking.service.chain.BlockHeightProvider;
import decentralabs.staking.service.gateway.TokenGateway;
import decentralabs.staking.service.gateway.TransferPendingException;
import decentralabs.staking.service.persistence.PendingTransferStore;
import decentralabs.staking.service.persistence.PendingWithdrawalStore;
import decentralabs.staking.util.AccountIds;
import java.math.BigInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Amounts owed to accounts after claim or unstake, paid out on request.
 *
 * Withdraw zeroes the balance before calling the gateway, so a callback during
 * the transfer sees an empty pool. A failed transfer restores the balance; a
 * transfer that was broadcast but not confirmed leaves it at zero and is
 * recorded for reconciliation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WithdrawalPoolService {

    private final PendingWithdrawalStore store;
    private final PendingTransferStore pendingTransfers;
    private final TokenGateway tokenGateway;
    private final LedgerGuard ledgerGuard;
    private final BlockHeightProvider blockHeightProvider;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Adds {@code amount} to the pending balance of an already normalized account.
     * Must be called from inside a guarded ledger operation.
     *
     * @return the new pending balance
     */
    public BigInteger credit(String account, BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Credit amount must be positive");
        }
        BigInteger updated = store.get(account).add(amount);
        store.put(account, updated);
        log.debug("Credited {} to pool for {}, pending {}", amount, AccountIds.mask(account), updated);
        return updated;
    }

    /**
     * Pays the whole pending balance out to the account.
     *
     * @return the amount paid
     */
    public BigInteger withdraw(String account) {
        String key = AccountIds.normalize(account);
        return ledgerGuard.execute("withdraw", () -> {
            BigInteger pending = store.get(key);
            if (pending.signum() <= 0) {
                throw new StakingException(StakingError.EMPTY_WITHDRAW_POOL, "withdraw");
            }
            BigInteger block = blockHeightProvider.currentBlock();

            store.put(key, BigInteger.ZERO);

            boolean paid;
            try {
                paid = tokenGateway.payout(key, pending);
            } catch (TransferPendingException e) {
                pendingTransfers.put(new PendingTransfer(e.getTransactionHash(), PendingTransfer.Kind.PAYOUT,
                    key, pending, block, System.currentTimeMillis()));
                log.warn("Payout of {} to {} pending as {}", pending, AccountIds.mask(key), e.getTransactionHash());
                throw new StakingException(StakingError.TRANSFER_PENDING, "withdraw",
                    "Payout submitted as " + e.getTransactionHash() + " but not yet confirmed", e);
            } catch (RuntimeException e) {
                store.put(key, pending);
                log.error("Payout of {} to {} threw: {}", pending, AccountIds.mask(key), e.getMessage());
                throw new StakingException(StakingError.TRANSFER_FAILED, "withdraw",
                    "Payout failed: " + e.getMessage(), e);
            }
            if (!paid) {
                store.put(key, pending);
                log.error("Payout of {} to {} rejected by gateway", pending, AccountIds.mask(key));
                throw new StakingException(StakingError.TRANSFER_FAILED, "withdraw");
            }

            log.info("Withdrew {} for {}", pending, AccountIds.mask(key));
            eventPublisher.publishEvent(new WithdrawEvent(this, key, pending, block));
            return pending;
        });
    }

    public BigInteger getPendingBalance(String account) {
        return store.get(AccountIds.normalize(account));
    }

    public BigInteger getTotalPending() {
        return store.snapshot().values().stream().reduce(BigInteger.ZERO, BigInteger::add);
    }
}
