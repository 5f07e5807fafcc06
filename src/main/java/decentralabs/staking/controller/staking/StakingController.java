package decentralabs.staking.controller.staking;

import decentralabs.staking.dto.staking.AccountRequest;
import decentralabs.staking.dto.staking.AccountSummary;
import decentralabs.staking.dto.staking.StakeRequest;
import decentralabs.staking.dto.staking.StakingConfigResponse;
import decentralabs.staking.dto.staking.StakingOperationResponse;
import decentralabs.staking.exception.StakingError;
import decentralabs.staking.exception.StakingException;
import decentralabs.staking.service.RateLimitService;
import decentralabs.staking.service.audit.StakingAuditService;
import decentralabs.staking.service.chain.BlockHeightProvider;
import decentralabs.staking.service.staking.SettlementResult;
import decentralabs.staking.service.staking.StakeLedgerService;
import decentralabs.staking.service.staking.StakingConfigurationService;
import decentralabs.staking.service.staking.UserStake;
import decentralabs.staking.service.staking.WithdrawalPoolService;
import decentralabs.staking.util.AccountIds;
import jakarta.validation.Valid;
import java.math.BigInteger;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Account-facing staking operations. Rejected operations surface as
 * {@link StakingException} and are rendered by the global exception handler.
 */
@RestController
@RequestMapping("/staking")
@RequiredArgsConstructor
@Slf4j
public class StakingController {

    private static final int MAX_EVENTS = 200;

    private final StakeLedgerService ledgerService;
    private final WithdrawalPoolService withdrawalPoolService;
    private final StakingConfigurationService configurationService;
    private final StakingAuditService auditService;
    private final BlockHeightProvider blockHeightProvider;
    private final RateLimitService rateLimitService;

    /**
     * POST /staking/stake
     * Locks principal for the account at the current block
     */
    @PostMapping("/stake")
    public ResponseEntity<StakingOperationResponse> stake(@Valid @RequestBody StakeRequest request) {
        String account = checkRateLimit(request.getAccount(), "stake");
        BigInteger amount = AccountIds.parseAmount(request.getAmount(), "amount");

        UserStake stake = ledgerService.stake(account, amount);
        return ResponseEntity.ok(StakingOperationResponse.builder()
            .success(true)
            .message("Stake opened")
            .operationType("STAKE")
            .account(account)
            .amount(stake.getStakeAmount().toString())
            .blockNumber(stake.getStakeStartBlockNumber().toString())
            .build());
    }

    /**
     * POST /staking/claim
     * Moves claimable reward into the withdrawal pool
     */
    @PostMapping("/claim")
    public ResponseEntity<StakingOperationResponse> claim(@Valid @RequestBody AccountRequest request) {
        String account = checkRateLimit(request.getAccount(), "claim");
        SettlementResult result = ledgerService.claim(account);
        return ResponseEntity.ok(settlementResponse("CLAIM", "Reward credited to withdrawal pool", result));
    }

    /**
     * POST /staking/unstake
     * Closes the stake, crediting reward and principal to the withdrawal pool
     */
    @PostMapping("/unstake")
    public ResponseEntity<StakingOperationResponse> unstake(@Valid @RequestBody AccountRequest request) {
        String account = checkRateLimit(request.getAccount(), "unstake");
        SettlementResult result = ledgerService.unstake(account);
        return ResponseEntity.ok(settlementResponse("UNSTAKE", "Stake closed, principal credited to withdrawal pool", result));
    }

    /**
     * POST /staking/withdraw
     * Pays the pending withdrawal balance out of custody
     */
    @PostMapping("/withdraw")
    public ResponseEntity<StakingOperationResponse> withdraw(@Valid @RequestBody AccountRequest request) {
        String account = checkRateLimit(request.getAccount(), "withdraw");
        BigInteger paid = withdrawalPoolService.withdraw(account);
        return ResponseEntity.ok(StakingOperationResponse.builder()
            .success(true)
            .message("Withdrawal paid")
            .operationType("WITHDRAW")
            .account(account)
            .amount(paid.toString())
            .pendingWithdrawal(BigInteger.ZERO.toString())
            .build());
    }

    /**
     * GET /staking/accounts/{account}
     */
    @GetMapping("/accounts/{account}")
    public ResponseEntity<AccountSummary> getAccount(@PathVariable String account) {
        return ResponseEntity.ok(ledgerService.getAccountSummary(account));
    }

    /**
     * GET /staking/accounts/{account}/events
     * Most recent ledger events for the account, newest first
     */
    @GetMapping("/accounts/{account}/events")
    public ResponseEntity<List<StakingAuditService.AuditRecord>> getAccountEvents(
        @PathVariable String account,
        @RequestParam(defaultValue = "50") int limit
    ) {
        int boundedLimit = Math.max(1, Math.min(limit, MAX_EVENTS));
        return ResponseEntity.ok(auditService.getRecentRecords(account, boundedLimit));
    }

    /**
     * GET /staking/config
     */
    @GetMapping("/config")
    public ResponseEntity<StakingConfigResponse> getConfig() {
        StakingAuditService.Totals totals = auditService.getTotals();
        return ResponseEntity.ok(StakingConfigResponse.builder()
            .owner(AccountIds.toChecksum(configurationService.getOwner()))
            .payoutGap(configurationService.getPayoutGap().toString())
            .minimumStake(configurationService.getMinimumStake().toString())
            .currentBlock(blockHeightProvider.currentBlock().toString())
            .totalStaked(ledgerService.getTotalStaked().toString())
            .totalPendingWithdrawal(withdrawalPoolService.getTotalPending().toString())
            .totalCredited(totals.getCredited().toString())
            .totalWithdrawn(totals.getWithdrawn().toString())
            .build());
    }

    private String checkRateLimit(String rawAccount, String operation) {
        String account = AccountIds.normalize(rawAccount);
        if (!rateLimitService.allowOperation(account)) {
            throw new StakingException(StakingError.RATE_LIMITED, operation);
        }
        log.debug("Received {} request for {}", operation, AccountIds.mask(account));
        return account;
    }

    private StakingOperationResponse settlementResponse(String type, String message, SettlementResult result) {
        return StakingOperationResponse.builder()
            .success(true)
            .message(message)
            .operationType(type)
            .account(result.getAccount())
            .rewardCredited(result.getRewardCredited().toString())
            .principalCredited(result.getPrincipalCredited().toString())
            .pendingWithdrawal(result.getPendingBalance().toString())
            .blockNumber(result.getBlockNumber().toString())
            .build();
    }
}
