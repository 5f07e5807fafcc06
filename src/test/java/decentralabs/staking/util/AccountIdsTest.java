package decentralabs.staking.util;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccountIdsTest {

    private static final String CHECKSUMMED = "0x5aAeb6053F3E94C9b9A09f33669435E7Ef1BeAed";
    private static final String LOWER = "0x5aaeb6053f3e94c9b9a09f33669435e7ef1beaed";

    @Test
    void acceptsLowercaseAndValidChecksum() {
        assertThat(AccountIds.isValid(LOWER)).isTrue();
        assertThat(AccountIds.isValid(CHECKSUMMED)).isTrue();
    }

    @Test
    void rejectsBadChecksumAndMalformedInput() {
        assertThat(AccountIds.isValid("0x5AAeb6053F3E94C9b9A09f33669435E7Ef1BeAed")).isFalse();
        assertThat(AccountIds.isValid("0x123")).isFalse();
        assertThat(AccountIds.isValid("5aaeb6053f3e94c9b9a09f33669435e7ef1beaed00")).isFalse();
        assertThat(AccountIds.isValid("0xzzzeb6053f3e94c9b9a09f33669435e7ef1beaed")).isFalse();
        assertThat(AccountIds.isValid(null)).isFalse();
    }

    @Test
    void normalizeTrimsAndLowercases() {
        assertThat(AccountIds.normalize("  " + CHECKSUMMED + " ")).isEqualTo(LOWER);
        assertThat(AccountIds.toChecksum(LOWER)).isEqualTo(CHECKSUMMED);
    }

    @Test
    void normalizeRejectsInvalidAddress() {
        assertThatThrownBy(() -> AccountIds.normalize("0xnope\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Invalid account address: 0xnope_");
    }

    @Test
    void parseAmountAcceptsNonNegativeIntegers() {
        assertThat(AccountIds.parseAmount(" 1000000000000000000000 ", "amount"))
            .isEqualTo(new BigInteger("1000000000000000000000"));
        assertThat(AccountIds.parseAmount("0", "amount")).isEqualTo(BigInteger.ZERO);
    }

    @Test
    void parseAmountRejectsNegativeBlankAndGarbage() {
        assertThatThrownBy(() -> AccountIds.parseAmount("-1", "amount"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("negative");
        assertThatThrownBy(() -> AccountIds.parseAmount(" ", "amount"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AccountIds.parseAmount("1.5", "amount"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("valid number");
    }

    @Test
    void maskShortensAddresses() {
        assertThat(AccountIds.mask(LOWER)).isEqualTo("0x5aae...eaed");
        assertThat(AccountIds.mask("short")).isEqualTo("s***");
        assertThat(AccountIds.mask(null)).isEmpty();
    }
}
