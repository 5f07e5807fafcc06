package decentralabs.staking.service.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import decentralabs.staking.config.StakingProperties;
import decentralabs.staking.event.StakingEvent;
import decentralabs.staking.util.AccountIds;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Records every ledger event for auditing and keeps running totals so pool
 * conservation can be checked: withdrawn never exceeds credited.
 *
 * Recent records are kept in memory per account. With
 * {@code staking.audit.persistence.enabled=true} each record is also appended
 * as one JSON line to the configured file.
 */
@Service
@Slf4j
public class StakingAuditService {

    private final StakingProperties.Audit settings;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private final ConcurrentMap<String, Deque<AuditRecord>> recordsByAccount = new ConcurrentHashMap<>();

    private BigInteger totalDeposited = BigInteger.ZERO;
    private BigInteger totalRewardsCredited = BigInteger.ZERO;
    private BigInteger totalPrincipalCredited = BigInteger.ZERO;
    private BigInteger totalWithdrawn = BigInteger.ZERO;

    public StakingAuditService(StakingProperties properties) {
        this.settings = properties.getAudit();
    }

    @EventListener
    public void onStakingEvent(StakingEvent event) {
        AuditRecord record = new AuditRecord(
            event.getType(),
            event.getAccount(),
            event.getAmount().toString(),
            event.getBlockNumber().toString(),
            event.getTimestamp()
        );

        updateTotals(event.getType(), event.getAmount());

        Deque<AuditRecord> deque = recordsByAccount.computeIfAbsent(event.getAccount(), k -> new ConcurrentLinkedDeque<>());
        deque.addFirst(record);
        while (deque.size() > Math.max(1, settings.getMaxRecordsPerAccount())) {
            deque.removeLast();
        }

        if (settings.getPersistence().isEnabled()) {
            append(record);
        }
        log.debug("Audit {} {} for {} at block {}", record.getType(), record.getAmount(),
            AccountIds.mask(record.getAccount()), record.getBlockNumber());
    }

    public List<AuditRecord> getRecentRecords(String account, int limit) {
        Deque<AuditRecord> deque = recordsByAccount.get(AccountIds.normalize(account));
        if (deque == null) {
            return List.of();
        }
        return deque.stream()
            .limit(Math.max(0, limit))
            .collect(Collectors.toList());
    }

    public synchronized Totals getTotals() {
        return new Totals(totalDeposited, totalRewardsCredited, totalPrincipalCredited, totalWithdrawn);
    }

    private synchronized void updateTotals(String type, BigInteger amount) {
        switch (type) {
            case "STAKE":
                totalDeposited = totalDeposited.add(amount);
                break;
            case "CLAIM":
                totalRewardsCredited = totalRewardsCredited.add(amount);
                break;
            case "UNSTAKE":
                totalPrincipalCredited = totalPrincipalCredited.add(amount);
                break;
            case "WITHDRAW":
                totalWithdrawn = totalWithdrawn.add(amount);
                break;
            default:
                log.warn("Unknown staking event type {}", type);
        }
    }

    private synchronized void append(AuditRecord record) {
        String location = settings.getPersistence().getFilePath();
        try {
            Path path = Path.of(location);
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            String line = objectMapper.writeValueAsString(record) + System.lineSeparator();
            Files.writeString(path, line, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException | RuntimeException ex) {
            log.warn("Failed to append audit record to {}: {}", location, ex.getMessage());
        }
    }

    @Value
    public static class AuditRecord {
        String type;
        String account;
        String amount;
        String blockNumber;
        long timestamp;
    }

    @Value
    public static class Totals {
        BigInteger deposited;
        BigInteger rewardsCredited;
        BigInteger principalCredited;
        BigInteger withdrawn;

        public BigInteger getCredited() {
            return rewardsCredited.add(principalCredited);
        }
    }
}
