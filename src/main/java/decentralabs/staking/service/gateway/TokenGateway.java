package decentralabs.staking.service.gateway;

import java.math.BigInteger;

/**
 * Moves the staked asset into and out of custody.
 *
 * Implementations must be all-or-nothing: a {@code false} result or an exception
 * means no asset moved. The one exception is {@link TransferPendingException},
 * thrown when a transfer was submitted but its outcome is not known yet.
 */
public interface TokenGateway {

    /**
     * Pulls {@code amount} from {@code from} into custody.
     *
     * @return true when the transfer completed
     */
    boolean deposit(String from, BigInteger amount);

    /**
     * Sends {@code amount} from custody to {@code to}.
     *
     * @return true when the transfer completed
     */
    boolean payout(String to, BigInteger amount);
}
