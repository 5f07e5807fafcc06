package decentralabs.staking.service.staking;

import java.math.BigInteger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Reward formula. One whole token accrues per full payout gap elapsed, and
 * nothing accrues until strictly more than one gap has passed.
 */
@Component
public class RewardAccrualCalculator {

    private final BigInteger payoutGap;

    @Autowired
    public RewardAccrualCalculator(StakingConfigurationService configurationService) {
        this(configurationService.getPayoutGap());
    }

    public RewardAccrualCalculator(BigInteger payoutGap) {
        if (payoutGap == null || payoutGap.signum() <= 0) {
            throw new IllegalArgumentException("Payout gap must be greater than zero");
        }
        this.payoutGap = payoutGap;
    }

    public BigInteger earned(UserStake stake, BigInteger currentBlock) {
        if (!stake.isActive()) {
            return BigInteger.ZERO;
        }
        BigInteger blockDiff = currentBlock.subtract(stake.getStakeStartBlockNumber());
        if (blockDiff.signum() < 0) {
            throw new IllegalStateException("Current block " + currentBlock
                + " is before stake start " + stake.getStakeStartBlockNumber());
        }
        if (blockDiff.compareTo(payoutGap) <= 0) {
            return BigInteger.ZERO;
        }
        return blockDiff.divide(payoutGap);
    }

    /**
     * Earned minus already claimed, clamped at zero.
     */
    public BigInteger claimable(UserStake stake, BigInteger currentBlock) {
        BigInteger earned = earned(stake, currentBlock);
        if (earned.signum() == 0 || stake.getClaimed().compareTo(earned) >= 0) {
            return BigInteger.ZERO;
        }
        return earned.subtract(stake.getClaimed());
    }

    public BigInteger getPayoutGap() {
        return payoutGap;
    }
}
