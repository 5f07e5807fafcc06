package decentralabs.staking.service.persistence;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

@Component
public class InMemoryPendingWithdrawalStore implements PendingWithdrawalStore {

    private final Map<String, BigInteger> balances = new ConcurrentHashMap<>();

    @Override
    public BigInteger get(String account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    @Override
    public void put(String account, BigInteger balance) {
        Objects.requireNonNull(balance, "balance");
        if (balance.signum() < 0) {
            throw new IllegalStateException("Pending balance cannot be negative");
        }
        balances.put(account, balance);
    }

    @Override
    public Map<String, BigInteger> snapshot() {
        return Map.copyOf(balances);
    }
}
