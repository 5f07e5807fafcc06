package decentralabs.staking.event;

import java.math.BigInteger;

/**
 * Principal locked by {@code stake}.
 */
public class StakeEvent extends StakingEvent {

    public StakeEvent(Object source, String account, BigInteger amount, BigInteger blockNumber) {
        super(source, account, amount, blockNumber);
    }

    @Override
    public String getType() {
        return "STAKE";
    }
}
