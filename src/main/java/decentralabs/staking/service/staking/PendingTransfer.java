package decentralabs.staking.service.staking;

import java.math.BigInteger;
import lombok.Value;

/**
 * Token transfer broadcast to the chain whose outcome has not been confirmed.
 * While one exists, the ledger keeps the effects of the operation that sent it.
 */
@Value
public class PendingTransfer {

    public enum Kind {
        DEPOSIT,
        PAYOUT
    }

    String transactionHash;
    Kind kind;
    String account;
    BigInteger amount;
    BigInteger blockNumber;
    long recordedAt;
}
