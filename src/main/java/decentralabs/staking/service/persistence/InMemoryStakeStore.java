package decentralabs.staking.service.persistence;

import decentralabs.staking.service.staking.UserStake;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

@Component
public class InMemoryStakeStore implements StakeStore {

    private final Map<String, UserStake> stakes = new ConcurrentHashMap<>();

    @Override
    public UserStake get(String account) {
        return stakes.getOrDefault(account, UserStake.inactive());
    }

    @Override
    public void put(String account, UserStake stake) {
        stakes.put(account, Objects.requireNonNull(stake, "stake"));
    }

    @Override
    public Map<String, UserStake> snapshot() {
        return Map.copyOf(stakes);
    }
}
