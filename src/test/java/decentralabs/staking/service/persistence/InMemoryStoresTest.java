package decentralabs.staking.service.persistence;

import decentralabs.staking.service.staking.PendingTransfer;
import decentralabs.staking.service.staking.UserStake;
import java.math.BigInteger;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryStoresTest {

    private static final String ALICE = "0x1111111111111111111111111111111111111111";

    @Test
    void unknownAccountReadsAsInactiveStake() {
        InMemoryStakeStore store = new InMemoryStakeStore();

        UserStake stake = store.get(ALICE);

        assertThat(stake.isActive()).isFalse();
        assertThat(stake.getStakeAmount()).isEqualTo(BigInteger.ZERO);
        assertThat(store.snapshot()).isEmpty();
    }

    @Test
    void stakeSnapshotIsDetachedFromStore() {
        InMemoryStakeStore store = new InMemoryStakeStore();
        store.put(ALICE, UserStake.opened(BigInteger.valueOf(100), BigInteger.ONE));

        Map<String, UserStake> snapshot = store.snapshot();
        store.put(ALICE, UserStake.inactive());

        assertThat(snapshot.get(ALICE).isActive()).isTrue();
        assertThat(store.get(ALICE).isActive()).isFalse();
    }

    @Test
    void unknownAccountHasZeroPendingBalance() {
        assertThat(new InMemoryPendingWithdrawalStore().get(ALICE)).isEqualTo(BigInteger.ZERO);
    }

    @Test
    void negativePendingBalanceIsRefused() {
        InMemoryPendingWithdrawalStore store = new InMemoryPendingWithdrawalStore();
        store.put(ALICE, BigInteger.TEN);

        assertThatThrownBy(() -> store.put(ALICE, BigInteger.valueOf(-1)))
            .isInstanceOf(IllegalStateException.class);
        assertThat(store.get(ALICE)).isEqualTo(BigInteger.TEN);
    }

    @Test
    void pendingTransfersAreMatchedByHashIgnoringCase() {
        InMemoryPendingTransferStore store = new InMemoryPendingTransferStore();
        store.put(new PendingTransfer("0xABC", PendingTransfer.Kind.PAYOUT, ALICE, BigInteger.TEN, BigInteger.ONE, 2L));
        store.put(new PendingTransfer("0xdef", PendingTransfer.Kind.DEPOSIT, ALICE, BigInteger.TEN, BigInteger.ONE, 1L));

        assertThat(store.findAll()).extracting(PendingTransfer::getTransactionHash).containsExactly("0xdef", "0xABC");
        assertThat(store.hasPending(ALICE, PendingTransfer.Kind.DEPOSIT)).isTrue();

        assertThat(store.remove(" 0xabc ")).isPresent();
        assertThat(store.remove("0xabc")).isEmpty();
        assertThat(store.remove(null)).isEmpty();
        assertThat(store.hasPending(ALICE, PendingTransfer.Kind.PAYOUT)).isFalse();
    }
}
