package decentralabs.staking.exception;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import decentralabs.staking.service.gateway.TransferPendingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void stakingErrorsUseTheirMappedStatus() {
        assertStatus(StakingError.UNAUTHORIZED, HttpStatus.FORBIDDEN);
        assertStatus(StakingError.INVALID_AMOUNT, HttpStatus.BAD_REQUEST);
        assertStatus(StakingError.ALREADY_STAKED, HttpStatus.CONFLICT);
        assertStatus(StakingError.NO_ACTIVE_STAKE, HttpStatus.CONFLICT);
        assertStatus(StakingError.NOTHING_TO_CLAIM, HttpStatus.CONFLICT);
        assertStatus(StakingError.EMPTY_WITHDRAW_POOL, HttpStatus.CONFLICT);
        assertStatus(StakingError.REENTRANT_CALL, HttpStatus.CONFLICT);
        assertStatus(StakingError.TRANSFER_FAILED, HttpStatus.BAD_GATEWAY);
        assertStatus(StakingError.TRANSFER_PENDING, HttpStatus.ACCEPTED);
        assertStatus(StakingError.SETTLEMENT_PENDING, HttpStatus.CONFLICT);
        assertStatus(StakingError.UNKNOWN_TRANSFER, HttpStatus.NOT_FOUND);
        assertStatus(StakingError.RATE_LIMITED, HttpStatus.TOO_MANY_REQUESTS);
    }

    @Test
    void stakingExceptionBodyCarriesErrorAndOperation() {
        ResponseEntity<Map<String, Object>> response = handler.handleStakingException(
            new StakingException(StakingError.EMPTY_WITHDRAW_POOL, "withdraw"));

        assertThat(response.getBody())
            .containsEntry("success", false)
            .containsEntry("error", "EMPTY_WITHDRAW_POOL")
            .containsEntry("operation", "withdraw")
            .containsEntry("message", StakingError.EMPTY_WITHDRAW_POOL.getDefaultMessage());
    }

    @Test
    void pendingTransferBodyCarriesTransactionHash() {
        ResponseEntity<Map<String, Object>> response = handler.handleStakingException(
            new StakingException(StakingError.TRANSFER_PENDING, "withdraw", "Payout submitted as 0xabc",
                new TransferPendingException("0xabc", "No receipt for 0xabc")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(response.getBody())
            .containsEntry("error", "TRANSFER_PENDING")
            .containsEntry("transactionHash", "0xabc");
    }

    @Test
    void illegalArgumentIsBadRequest() {
        ResponseEntity<Map<String, Object>> response = handler.handleIllegalArgumentException(
            new IllegalArgumentException("Invalid account address: 0x123"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).containsEntry("message", "Invalid account address: 0x123");
    }

    @Test
    void unexpectedErrorsHideDetails() {
        ResponseEntity<Map<String, Object>> response = handler.handleGenericException(
            new IllegalStateException("database password is hunter2"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).containsEntry("message", "An unexpected error occurred");
    }

    private void assertStatus(StakingError error, HttpStatus expected) {
        ResponseEntity<Map<String, Object>> response =
            handler.handleStakingException(new StakingException(error, "test"));
        assertThat(response.getStatusCode()).isEqualTo(expected);
    }
}
