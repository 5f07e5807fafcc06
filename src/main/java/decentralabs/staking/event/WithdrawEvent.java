package decentralabs.staking.event;

import java.math.BigInteger;

/**
 * Pending balance paid out of custody.
 */
public class WithdrawEvent extends StakingEvent {

    public WithdrawEvent(Object source, String account, BigInteger amount, BigInteger blockNumber) {
        super(source, account, amount, blockNumber);
    }

    @Override
    public String getType() {
        return "WITHDRAW";
    }
}
