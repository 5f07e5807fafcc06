package decentralabs.staking.service.staking;

import java.math.BigInteger;
import lombok.Builder;
import lombok.Value;

/**
 * Stake state of a single account. Instances are immutable; the ledger replaces
 * the stored entry on every transition.
 *
 * An inactive stake always has zero amount, start block and claimed reward.
 */
@Value
@Builder(toBuilder = true)
public class UserStake {

    private static final UserStake INACTIVE = new UserStake(BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO, false);

    /** Principal currently locked. */
    BigInteger stakeAmount;

    /** Block height at which the current stake period began. */
    BigInteger stakeStartBlockNumber;

    /** Reward already credited to the withdrawal pool during this stake period. */
    BigInteger claimed;

    boolean active;

    public static UserStake inactive() {
        return INACTIVE;
    }

    public static UserStake opened(BigInteger amount, BigInteger startBlock) {
        return new UserStake(amount, startBlock, BigInteger.ZERO, true);
    }

    public UserStake withClaimed(BigInteger newClaimed) {
        return toBuilder().claimed(newClaimed).build();
    }
}
