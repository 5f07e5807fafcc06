package decentralabs.staking.service.staking;

import java.math.BigInteger;
import lombok.Value;

/**
 * Amounts moved into the withdrawal pool by a claim or unstake.
 */
@Value
public class SettlementResult {
    String account;
    BigInteger rewardCredited;
    BigInteger principalCredited;
    BigInteger pendingBalance;
    BigInteger blockNumber;
}
