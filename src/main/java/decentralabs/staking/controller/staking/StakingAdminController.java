package decentralabs.staking.controller.staking;

import decentralabs.staking.dto.staking.BlockHeightRequest;
import decentralabs.staking.dto.staking.MinimumStakeRequest;
import decentralabs.staking.dto.staking.ResolveTransferRequest;
import decentralabs.staking.service.chain.BlockHeightProvider;
import decentralabs.staking.service.chain.ManualBlockHeightProvider;
import decentralabs.staking.service.staking.PendingTransfer;
import decentralabs.staking.service.staking.PendingTransferService;
import decentralabs.staking.service.staking.StakingConfigurationService;
import decentralabs.staking.util.AccountIds;
import jakarta.validation.Valid;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Owner-only configuration endpoints (localhost access enforced by LocalhostOnlyFilter).
 */
@RestController
@RequestMapping("/staking/admin")
@RequiredArgsConstructor
@Slf4j
public class StakingAdminController {

    private final StakingConfigurationService configurationService;
    private final BlockHeightProvider blockHeightProvider;
    private final PendingTransferService pendingTransferService;

    /**
     * POST /staking/admin/minimum-stake
     * Applies to stakes opened after this call
     */
    @PostMapping("/minimum-stake")
    public ResponseEntity<Map<String, Object>> setMinimumStake(@Valid @RequestBody MinimumStakeRequest request) {
        BigInteger amount = AccountIds.parseAmount(request.getAmount(), "amount");
        BigInteger previous = configurationService.setMinimumStake(request.getAdminWalletAddress(), amount);
        return ResponseEntity.ok(Map.of(
            "success", true,
            "previousMinimumStake", previous.toString(),
            "minimumStake", amount.toString()
        ));
    }

    /**
     * POST /staking/admin/block-height
     * Moves the manual block counter; unavailable when heights come from a node
     */
    @PostMapping("/block-height")
    public ResponseEntity<Map<String, Object>> advanceBlockHeight(@Valid @RequestBody BlockHeightRequest request) {
        configurationService.requireOwner(request.getAdminWalletAddress(), "advanceBlockHeight");
        if (!(blockHeightProvider instanceof ManualBlockHeightProvider)) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Map.of("success", false, "message", "Block height is read from the chain node"));
        }
        BigInteger target = AccountIds.parseAmount(request.getBlockNumber(), "blockNumber");
        BigInteger current = ((ManualBlockHeightProvider) blockHeightProvider).advanceTo(target);
        log.info("Manual block height set to {}", current);
        return ResponseEntity.ok(Map.of("success", true, "currentBlock", current.toString()));
    }

    /**
     * GET /staking/admin/pending-transfers
     * Transfers broadcast to the chain whose outcome is not known yet
     */
    @GetMapping("/pending-transfers")
    public ResponseEntity<List<Map<String, Object>>> getPendingTransfers() {
        return ResponseEntity.ok(pendingTransferService.getPendingTransfers().stream()
            .map(StakingAdminController::toView)
            .collect(Collectors.toList()));
    }

    /**
     * POST /staking/admin/pending-transfers/resolve
     */
    @PostMapping("/pending-transfers/resolve")
    public ResponseEntity<Map<String, Object>> resolvePendingTransfer(
        @Valid @RequestBody ResolveTransferRequest request
    ) {
        PendingTransfer resolved = pendingTransferService.resolve(
            request.getAdminWalletAddress(), request.getTransactionHash(), request.getConfirmed());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("confirmed", request.getConfirmed());
        body.put("transfer", toView(resolved));
        return ResponseEntity.ok(body);
    }

    private static Map<String, Object> toView(PendingTransfer transfer) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("transactionHash", transfer.getTransactionHash());
        view.put("kind", transfer.getKind().name());
        view.put("account", transfer.getAccount());
        view.put("amount", transfer.getAmount().toString());
        view.put("blockNumber", transfer.getBlockNumber().toString());
        view.put("recordedAt", transfer.getRecordedAt());
        return view;
    }
}
