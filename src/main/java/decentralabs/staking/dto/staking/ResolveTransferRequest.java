package decentralabs.staking.dto.staking;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Owner report on the chain outcome of a pending token transfer
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResolveTransferRequest {

    @NotBlank(message = "Admin wallet address is required")
    private String adminWalletAddress;

    @NotBlank(message = "Transaction hash is required")
    private String transactionHash;

    @NotNull(message = "Confirmed flag is required")
    private Boolean confirmed;
}
