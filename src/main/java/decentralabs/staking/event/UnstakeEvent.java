package decentralabs.staking.event;

import java.math.BigInteger;

/**
 * Principal released to the withdrawal pool.
 */
public class UnstakeEvent extends StakingEvent {

    public UnstakeEvent(Object source, String account, BigInteger amount, BigInteger blockNumber) {
        super(source, account, amount, blockNumber);
    }

    @Override
    public String getType() {
        return "UNSTAKE";
    }
}
