package decentralabs.staking.service.staking;

import decentralabs.staking.dto.staking.AccountSummary;
import decentralabs.staking.event.ClaimEvent;
import decentralabs.staking.event.StakeEvent;
import decentralabs.staking.event.UnstakeEvent;
import decentralabs.staking.exception.StakingError;
import decentralabs.staking.exception.StakingException;
import decentralabs.staking.service.chain.BlockHeightProvider;
import decentralabs.staking.service.gateway.TokenGateway;
import decentralabs.staking.service.gateway.TransferPendingException;
import decentralabs.staking.service.persistence.PendingTransferStore;
import decentralabs.staking.service.persistence.StakeStore;
import decentralabs.staking.util.AccountIds;
import java.math.BigInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Per-account stake state machine: Inactive -> stake -> Active -> unstake -> Inactive.
 *
 * Every operation runs under {@link LedgerGuard} and either commits fully or
 * leaves the stores untouched. Events are published only after commit.
 *
 * A deposit that was broadcast but not confirmed keeps the stake open and is
 * recorded in {@link PendingTransferStore}; claim and unstake wait until it is
 * resolved through {@link PendingTransferService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StakeLedgerService {

    private final StakeStore stakeStore;
    private final PendingTransferStore pendingTransfers;
    private final RewardAccrualCalculator calculator;
    private final WithdrawalPoolService withdrawalPool;
    private final StakingConfigurationService configurationService;
    private final TokenGateway tokenGateway;
    private final BlockHeightProvider blockHeightProvider;
    private final LedgerGuard ledgerGuard;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Opens a stake of {@code amount} for the account at the current block.
     */
    public UserStake stake(String account, BigInteger amount) {
        String key = AccountIds.normalize(account);
        return ledgerGuard.execute("stake", () -> {
            UserStake current = stakeStore.get(key);
            if (current.isActive()) {
                throw new StakingException(StakingError.ALREADY_STAKED, "stake");
            }
            BigInteger minimum = configurationService.getMinimumStake();
            if (amount == null || amount.signum() <= 0 || amount.compareTo(minimum) < 0) {
                throw new StakingException(StakingError.INVALID_AMOUNT, "stake",
                    "Stake amount must be positive and at least " + minimum);
            }

            BigInteger block = blockHeightProvider.currentBlock();
            UserStake opened = UserStake.opened(amount, block);
            stakeStore.put(key, opened);

            boolean deposited;
            try {
                deposited = tokenGateway.deposit(key, amount);
            } catch (TransferPendingException e) {
                pendingTransfers.put(new PendingTransfer(e.getTransactionHash(), PendingTransfer.Kind.DEPOSIT,
                    key, amount, block, System.currentTimeMillis()));
                log.warn("Deposit of {} from {} pending as {}", amount, AccountIds.mask(key), e.getTransactionHash());
                throw new StakingException(StakingError.TRANSFER_PENDING, "stake",
                    "Deposit submitted as " + e.getTransactionHash() + " but not yet confirmed", e);
            } catch (RuntimeException e) {
                stakeStore.put(key, current);
                log.error("Deposit of {} from {} threw: {}", amount, AccountIds.mask(key), e.getMessage());
                throw new StakingException(StakingError.TRANSFER_FAILED, "stake",
                    "Deposit failed: " + e.getMessage(), e);
            }
            if (!deposited) {
                stakeStore.put(key, current);
                log.error("Deposit of {} from {} rejected by gateway", amount, AccountIds.mask(key));
                throw new StakingException(StakingError.TRANSFER_FAILED, "stake");
            }

            log.info("Staked {} for {} at block {}", amount, AccountIds.mask(key), block);
            eventPublisher.publishEvent(new StakeEvent(this, key, amount, block));
            return opened;
        });
    }

    /**
     * Moves the claimable reward into the withdrawal pool. The stake stays open.
     */
    public SettlementResult claim(String account) {
        String key = AccountIds.normalize(account);
        return ledgerGuard.execute("claim", () -> {
            UserStake current = requireActive(key, "claim");
            BigInteger block = blockHeightProvider.currentBlock();
            BigInteger claimable = calculator.claimable(current, block);
            if (claimable.signum() == 0) {
                throw new StakingException(StakingError.NOTHING_TO_CLAIM, "claim");
            }

            BigInteger pending = settleReward(key, current, claimable, block);
            return new SettlementResult(key, claimable, BigInteger.ZERO, pending, block);
        });
    }

    /**
     * Settles any claimable reward, releases the principal into the withdrawal
     * pool and closes the stake. Asset transfer happens later on withdraw.
     */
    public SettlementResult unstake(String account) {
        String key = AccountIds.normalize(account);
        return ledgerGuard.execute("unstake", () -> {
            UserStake current = requireActive(key, "unstake");
            BigInteger block = blockHeightProvider.currentBlock();
            BigInteger claimable = calculator.claimable(current, block);

            if (claimable.signum() > 0) {
                settleReward(key, current, claimable, block);
            }

            BigInteger principal = current.getStakeAmount();
            BigInteger pending = withdrawalPool.credit(key, principal);
            stakeStore.put(key, UserStake.inactive());

            log.info("Unstaked {} for {} at block {} (reward {})", principal, AccountIds.mask(key), block, claimable);
            eventPublisher.publishEvent(new UnstakeEvent(this, key, principal, block));
            return new SettlementResult(key, claimable, principal, pending, block);
        });
    }

    public UserStake getStake(String account) {
        return stakeStore.get(AccountIds.normalize(account));
    }

    public BigInteger getEarned(String account) {
        return calculator.earned(getStake(account), blockHeightProvider.currentBlock());
    }

    public BigInteger getClaimable(String account) {
        return calculator.claimable(getStake(account), blockHeightProvider.currentBlock());
    }

    public AccountSummary getAccountSummary(String account) {
        String key = AccountIds.normalize(account);
        BigInteger block = blockHeightProvider.currentBlock();
        UserStake stake = stakeStore.get(key);
        return AccountSummary.builder()
            .account(key)
            .active(stake.isActive())
            .stakeAmount(stake.getStakeAmount().toString())
            .stakeStartBlockNumber(stake.getStakeStartBlockNumber().toString())
            .claimed(stake.getClaimed().toString())
            .earned(calculator.earned(stake, block).toString())
            .claimable(calculator.claimable(stake, block).toString())
            .pendingWithdrawal(withdrawalPool.getPendingBalance(key).toString())
            .currentBlock(block.toString())
            .build();
    }

    /**
     * Sum of principal across open stakes.
     */
    public BigInteger getTotalStaked() {
        return stakeStore.snapshot().values().stream()
            .filter(UserStake::isActive)
            .map(UserStake::getStakeAmount)
            .reduce(BigInteger.ZERO, BigInteger::add);
    }

    private UserStake requireActive(String key, String operation) {
        UserStake current = stakeStore.get(key);
        if (!current.isActive()) {
            throw new StakingException(StakingError.NO_ACTIVE_STAKE, operation);
        }
        if (pendingTransfers.hasPending(key, PendingTransfer.Kind.DEPOSIT)) {
            throw new StakingException(StakingError.SETTLEMENT_PENDING, operation);
        }
        return current;
    }

    private BigInteger settleReward(String key, UserStake current, BigInteger claimable, BigInteger block) {
        stakeStore.put(key, current.withClaimed(current.getClaimed().add(claimable)));
        BigInteger pending = withdrawalPool.credit(key, claimable);
        log.info("Claimed {} for {} at block {}", claimable, AccountIds.mask(key), block);
        eventPublisher.publishEvent(new ClaimEvent(this, key, claimable, block));
        return pending;
    }
}
