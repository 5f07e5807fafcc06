package decentralabs.staking.service.persistence;

import decentralabs.staking.service.staking.UserStake;
import java.util.Map;

/**
 * Key-value mapping from normalized account to its stake.
 *
 * An account that was never written reads as {@link UserStake#inactive()}.
 */
public interface StakeStore {

    UserStake get(String account);

    void put(String account, UserStake stake);

    /**
     * Snapshot of every stored entry, active or not.
     */
    Map<String, UserStake> snapshot();
}
