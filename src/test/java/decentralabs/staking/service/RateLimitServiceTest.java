package decentralabs.staking.service;

import decentralabs.staking.config.StakingProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimitServiceTest {

    private static final String ALICE = "0x1111111111111111111111111111111111111111";
    private static final String BOB = "0x3333333333333333333333333333333333333333";

    private RateLimitService serviceWithLimit(int perMinute) {
        StakingProperties properties = new StakingProperties();
        properties.getRateLimit().setOperationsPerMinute(perMinute);
        return new RateLimitService(properties);
    }

    @Test
    void allowsUpToTheLimitThenRejects() {
        RateLimitService service = serviceWithLimit(3);

        assertThat(service.allowOperation(ALICE)).isTrue();
        assertThat(service.allowOperation(ALICE)).isTrue();
        assertThat(service.allowOperation(ALICE)).isTrue();
        assertThat(service.allowOperation(ALICE)).isFalse();
        assertThat(service.getRemainingOperations(ALICE)).isZero();
    }

    @Test
    void accountsHaveSeparateBuckets() {
        RateLimitService service = serviceWithLimit(1);

        assertThat(service.allowOperation(ALICE)).isTrue();
        assertThat(service.allowOperation(ALICE)).isFalse();
        assertThat(service.allowOperation(BOB)).isTrue();
    }

    @Test
    void unknownAccountReportsFullAllowance() {
        assertThat(serviceWithLimit(5).getRemainingOperations(ALICE)).isEqualTo(5);
    }
}
