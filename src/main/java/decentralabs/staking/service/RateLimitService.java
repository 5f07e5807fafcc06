package decentralabs.staking.service;

import decentralabs.staking.config.StakingProperties;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-account throttle for mutating staking requests, using Bucket4j token buckets
 */
@Service
@Slf4j
public class RateLimitService {

    private static final int MAX_TRACKED_ACCOUNTS = 10_000;

    private final int operationsPerMinute;
    private final Map<String, Bucket> operationBuckets = new ConcurrentHashMap<>();

    public RateLimitService(StakingProperties properties) {
        this.operationsPerMinute = Math.max(1, properties.getRateLimit().getOperationsPerMinute());
    }

    /**
     * Check if another operation is allowed for the given account
     * @param account Normalized account address
     * @return true if allowed, false if rate limit exceeded
     */
    public boolean allowOperation(String account) {
        if (operationBuckets.size() > MAX_TRACKED_ACCOUNTS) {
            log.info("Clearing operation buckets, current size: {}", operationBuckets.size());
            operationBuckets.clear();
        }
        Bucket bucket = operationBuckets.computeIfAbsent(account, k -> createOperationBucket());
        boolean allowed = bucket.tryConsume(1);

        if (!allowed) {
            log.warn("Operation rate limit exceeded for account");
        }

        return allowed;
    }

    public long getRemainingOperations(String account) {
        Bucket bucket = operationBuckets.get(account);
        return bucket != null ? bucket.getAvailableTokens() : operationsPerMinute;
    }

    private Bucket createOperationBucket() {
        return Bucket.builder()
            .addLimit(Bandwidth.builder()
                .capacity(operationsPerMinute)
                .refillIntervally(operationsPerMinute, Duration.ofMinutes(1))
                .build())
            .build();
    }
}
