package decentralabs.staking.service.staking;

import decentralabs.staking.config.StakingProperties;
import decentralabs.staking.exception.StakingError;
import decentralabs.staking.exception.StakingException;
import decentralabs.staking.util.AccountIds;
import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Global ledger configuration. The owner and payout gap are fixed at startup;
 * only the minimum stake can change, and only by the owner.
 */
@Service
@Slf4j
public class StakingConfigurationService {

    private final String owner;
    private final BigInteger payoutGap;
    private final AtomicReference<BigInteger> minimumStake;

    public StakingConfigurationService(StakingProperties properties) {
        if (properties.getOwnerAddress() == null || properties.getOwnerAddress().isBlank()) {
            throw new IllegalStateException("staking.owner-address must be configured");
        }
        this.owner = AccountIds.normalize(properties.getOwnerAddress());

        BigInteger gap = properties.getPayoutGap();
        if (gap == null || gap.signum() <= 0) {
            throw new IllegalStateException("staking.payout-gap must be greater than zero");
        }
        this.payoutGap = gap;

        BigInteger minimum = properties.getMinimumStake() == null ? BigInteger.ZERO : properties.getMinimumStake();
        if (minimum.signum() < 0) {
            throw new IllegalStateException("staking.minimum-stake cannot be negative");
        }
        this.minimumStake = new AtomicReference<>(minimum);

        log.info("Staking configured: owner={}, payoutGap={}, minimumStake={}",
            AccountIds.mask(owner), payoutGap, minimum);
    }

    public String getOwner() {
        return owner;
    }

    public BigInteger getPayoutGap() {
        return payoutGap;
    }

    public BigInteger getMinimumStake() {
        return minimumStake.get();
    }

    public boolean isOwner(String account) {
        return account != null && AccountIds.isValid(account.trim())
            && owner.equals(AccountIds.normalize(account));
    }

    /**
     * @throws StakingException with {@link StakingError#UNAUTHORIZED} unless {@code caller} is the owner
     */
    public void requireOwner(String caller, String operation) {
        if (!isOwner(caller)) {
            log.warn("Rejected {} from non-owner {}", operation, AccountIds.mask(caller));
            throw new StakingException(StakingError.UNAUTHORIZED, operation,
                "Only the owner may perform " + operation);
        }
    }

    /**
     * Changes the minimum for future stakes. Open stakes below the new value stay open.
     */
    public BigInteger setMinimumStake(String caller, BigInteger amount) {
        requireOwner(caller, "setMinimumStake");
        if (amount == null || amount.signum() < 0) {
            throw new StakingException(StakingError.INVALID_AMOUNT, "setMinimumStake",
                "Minimum stake cannot be negative");
        }
        BigInteger previous = minimumStake.getAndSet(amount);
        log.info("Minimum stake changed from {} to {}", previous, amount);
        return previous;
    }
}
