package decentralabs.staking.dto.staking;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StakeRequest {

    @NotBlank(message = "Account is required")
    private String account;

    // Decimal string in token base units
    @NotBlank(message = "Amount is required")
    @Pattern(regexp = "\\d+", message = "Amount must be a non-negative integer")
    private String amount;
}
