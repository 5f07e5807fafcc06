package decentralabs.staking.exception;

import org.springframework.http.HttpStatus;

/**
 * Named failure outcomes of ledger operations.
 */
public enum StakingError {
    UNAUTHORIZED(HttpStatus.FORBIDDEN, "Caller is not allowed to perform this operation"),
    INVALID_AMOUNT(HttpStatus.BAD_REQUEST, "Amount is zero or below the minimum stake"),
    ALREADY_STAKED(HttpStatus.CONFLICT, "Account already has an active stake"),
    NO_ACTIVE_STAKE(HttpStatus.CONFLICT, "Account has no active stake"),
    NOTHING_TO_CLAIM(HttpStatus.CONFLICT, "No reward available to claim"),
    EMPTY_WITHDRAW_POOL(HttpStatus.CONFLICT, "Withdrawal pool is empty for this account"),
    TRANSFER_FAILED(HttpStatus.BAD_GATEWAY, "Token transfer was rejected by the gateway"),
    TRANSFER_PENDING(HttpStatus.ACCEPTED, "Token transfer submitted but not yet confirmed"),
    SETTLEMENT_PENDING(HttpStatus.CONFLICT, "A token transfer for this account is awaiting confirmation"),
    UNKNOWN_TRANSFER(HttpStatus.NOT_FOUND, "No pending transfer with this transaction hash"),
    REENTRANT_CALL(HttpStatus.CONFLICT, "Ledger operation already in progress on this call stack"),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "Too many operations for this account");

    private final HttpStatus status;
    private final String defaultMessage;

    StakingError(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
