package decentralabs.staking.service.gateway;

import decentralabs.staking.util.AccountIds;
import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory token ledger used when no chain is configured. Each wallet starts
 * with a configurable opening balance the first time it is seen. Custody starts
 * with a reward reserve, since rewards are paid from tokens nobody deposited.
 */
@Slf4j
public class SimulatedTokenGateway implements TokenGateway {

    private final BigInteger openingBalance;
    private final Map<String, BigInteger> walletBalances = new ConcurrentHashMap<>();
    private BigInteger custodyBalance;

    public SimulatedTokenGateway(BigInteger openingBalance, BigInteger rewardReserve) {
        this.openingBalance = openingBalance == null ? BigInteger.ZERO : openingBalance;
        this.custodyBalance = rewardReserve == null ? BigInteger.ZERO : rewardReserve;
        if (custodyBalance.signum() < 0) {
            throw new IllegalArgumentException("Reward reserve cannot be negative");
        }
    }

    @Override
    public synchronized boolean deposit(String from, BigInteger amount) {
        BigInteger balance = balanceOf(from);
        if (amount.signum() <= 0 || balance.compareTo(amount) < 0) {
            log.warn("Simulated deposit of {} from {} rejected: balance {}", amount, AccountIds.mask(from), balance);
            return false;
        }
        walletBalances.put(from, balance.subtract(amount));
        custodyBalance = custodyBalance.add(amount);
        log.debug("Simulated deposit of {} from {}", amount, AccountIds.mask(from));
        return true;
    }

    @Override
    public synchronized boolean payout(String to, BigInteger amount) {
        if (amount.signum() <= 0 || custodyBalance.compareTo(amount) < 0) {
            log.warn("Simulated payout of {} to {} rejected: custody {}", amount, AccountIds.mask(to), custodyBalance);
            return false;
        }
        custodyBalance = custodyBalance.subtract(amount);
        walletBalances.put(to, balanceOf(to).add(amount));
        log.debug("Simulated payout of {} to {}", amount, AccountIds.mask(to));
        return true;
    }

    public synchronized BigInteger balanceOf(String wallet) {
        return walletBalances.computeIfAbsent(wallet, k -> openingBalance);
    }

    public synchronized BigInteger getCustodyBalance() {
        return custodyBalance;
    }
}
