package decentralabs.staking.dto.staking;

import lombok.Builder;
import lombok.Data;

/**
 * Read view of one account: stake state, accrued reward and pool balance at a given block.
 * Amounts are decimal strings in token base units.
 */
@Data
@Builder
public class AccountSummary {

    private String account;

    private boolean active;

    private String stakeAmount;

    private String stakeStartBlockNumber;

    private String claimed;

    /** Reward accrued so far in the current stake period, including claimed reward. */
    private String earned;

    private String claimable;

    /** Amount in the withdrawal pool awaiting {@code withdraw}. */
    private String pendingWithdrawal;

    private String currentBlock;
}
