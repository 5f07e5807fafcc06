package decentralabs.staking.dto.staking;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Owner request to move the manual block counter forward
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BlockHeightRequest {

    @NotBlank(message = "Admin wallet address is required")
    private String adminWalletAddress;

    @NotBlank(message = "Block number is required")
    @Pattern(regexp = "\\d+", message = "Block number must be a non-negative integer")
    private String blockNumber;
}
