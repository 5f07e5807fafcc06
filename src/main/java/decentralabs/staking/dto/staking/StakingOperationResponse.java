package decentralabs.staking.dto.staking;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

/**
 * Result of a successful stake, claim, unstake or withdraw.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StakingOperationResponse {
    private boolean success;
    private String message;
    private String operationType;
    private String account;

    // Principal locked by stake, or amount paid by withdraw
    private String amount;

    private String rewardCredited;
    private String principalCredited;
    private String pendingWithdrawal;
    private String blockNumber;
}
