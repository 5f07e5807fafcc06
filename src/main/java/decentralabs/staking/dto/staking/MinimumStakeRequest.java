package decentralabs.staking.dto.staking;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Owner request to change the minimum stake for future stakes
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MinimumStakeRequest {

    // Must match the configured owner address
    @NotBlank(message = "Admin wallet address is required")
    private String adminWalletAddress;

    @NotBlank(message = "Amount is required")
    @Pattern(regexp = "\\d+", message = "Amount must be a non-negative integer")
    private String amount;
}
