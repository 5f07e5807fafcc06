package decentralabs.staking.event;

import java.math.BigInteger;

/**
 * Reward credited to the withdrawal pool.
 */
public class ClaimEvent extends StakingEvent {

    public ClaimEvent(Object source, String account, BigInteger amount, BigInteger blockNumber) {
        super(source, account, amount, blockNumber);
    }

    @Override
    public String getType() {
        return "CLAIM";
    }
}
