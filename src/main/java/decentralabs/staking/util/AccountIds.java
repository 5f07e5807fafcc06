package decentralabs.staking.util;

import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;
import org.web3j.crypto.Keys;
import org.web3j.utils.Numeric;

/**
 * Helpers for account identifiers and user supplied numbers.
 *
 * Accounts are EVM addresses. Every ledger key is the lowercase form so that
 * checksummed and lowercase spellings of one address hit the same entry.
 */
public final class AccountIds {

    private static final int ADDRESS_LENGTH_WITH_PREFIX = 42; // 0x + 40 hex chars
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\r\\n\\t]+");

    private AccountIds() {
        // Utility class
    }

    /**
     * Checks the address format. Mixed-case input must carry a valid EIP-55 checksum.
     */
    public static boolean isValid(String address) {
        if (address == null || address.length() != ADDRESS_LENGTH_WITH_PREFIX || !address.startsWith("0x")) {
            return false;
        }
        try {
            Numeric.toBigInt(address);
        } catch (RuntimeException e) {
            return false;
        }

        String body = address.substring(2);
        if (body.equals(body.toLowerCase(Locale.ROOT))) {
            return true;
        }
        try {
            return Keys.toChecksumAddress(address.toLowerCase(Locale.ROOT)).equals(address);
        } catch (RuntimeException e) {
            return false;
        }
    }

    /**
     * Validates and returns the canonical ledger key for an address.
     *
     * @throws IllegalArgumentException if the address is malformed
     */
    public static String normalize(String address) {
        String trimmed = address == null ? null : address.trim();
        if (!isValid(trimmed)) {
            throw new IllegalArgumentException("Invalid account address: " + sanitize(address));
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }

    public static String toChecksum(String address) {
        return Keys.toChecksumAddress(normalize(address));
    }

    /**
     * Parses a non-negative decimal amount.
     */
    public static BigInteger parseAmount(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " cannot be null or empty");
        }
        BigInteger parsed;
        try {
            parsed = new BigInteger(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(fieldName + " must be a valid number: " + sanitize(value), ex);
        }
        if (parsed.signum() < 0) {
            throw new IllegalArgumentException(fieldName + " cannot be negative");
        }
        return parsed;
    }

    /**
     * Strips control characters to prevent log injection.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return CONTROL_CHARS.matcher(value).replaceAll("_");
    }

    /**
     * Short masked form for log statements, e.g. {@code 0xab12...9f0e}.
     */
    public static String mask(String account) {
        String sanitized = sanitize(account);
        if (sanitized.length() <= 10) {
            return sanitized.isEmpty() ? "" : sanitized.charAt(0) + "***";
        }
        return sanitized.substring(0, 6) + "..." + sanitized.substring(sanitized.length() - 4);
    }
}
