package decentralabs.staking.service.persistence;

import java.math.BigInteger;
import java.util.Map;

/**
 * Key-value mapping from normalized account to the amount awaiting withdrawal.
 * Missing entries read as zero.
 */
public interface PendingWithdrawalStore {

    BigInteger get(String account);

    void put(String account, BigInteger balance);

    Map<String, BigInteger> snapshot();
}
