package decentralabs.staking.service.chain;

import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Block counter advanced from outside, used when no chain endpoint is configured.
 */
@Slf4j
public class ManualBlockHeightProvider implements BlockHeightProvider {

    private final AtomicReference<BigInteger> height;

    public ManualBlockHeightProvider(BigInteger initialBlock) {
        if (initialBlock == null || initialBlock.signum() < 0) {
            throw new IllegalArgumentException("Initial block must be non-negative");
        }
        this.height = new AtomicReference<>(initialBlock);
    }

    @Override
    public BigInteger currentBlock() {
        return height.get();
    }

    /**
     * Moves the counter to {@code block}.
     *
     * @throws IllegalArgumentException if {@code block} is below the current height
     */
    public BigInteger advanceTo(BigInteger block) {
        BigInteger updated = height.accumulateAndGet(block, (current, requested) -> {
            if (requested.compareTo(current) < 0) {
                throw new IllegalArgumentException(
                    "Block height cannot move backwards from " + current + " to " + requested);
            }
            return requested;
        });
        log.debug("Block height advanced to {}", updated);
        return updated;
    }
}
