package decentralabs.staking.dto.staking;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class StakingConfigResponse {
    private String owner;
    private String payoutGap;
    private String minimumStake;
    private String currentBlock;
    private String totalStaked;
    private String totalPendingWithdrawal;
    private String totalCredited;
    private String totalWithdrawn;
}
