package decentralabs.staking.service.staking;

import decentralabs.staking.exception.StakingError;
import decentralabs.staking.exception.StakingException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Serializes mutating ledger operations and rejects calls that re-enter the
 * ledger from inside a running operation, such as a token gateway calling back.
 */
@Component
public class LedgerGuard {

    private final ReentrantLock lock = new ReentrantLock(true);

    public <T> T execute(String operation, Supplier<T> action) {
        if (lock.isHeldByCurrentThread()) {
            throw new StakingException(StakingError.REENTRANT_CALL, operation);
        }
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
