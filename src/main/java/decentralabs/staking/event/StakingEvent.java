package decentralabs.staking.event;

import java.math.BigInteger;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Fact emitted by the ledger once an operation has committed.
 */
@Getter
public abstract class StakingEvent extends ApplicationEvent {

    private final String account;
    private final BigInteger amount;
    private final BigInteger blockNumber;

    protected StakingEvent(Object source, String account, BigInteger amount, BigInteger blockNumber) {
        super(source);
        this.account = account;
        this.amount = amount;
        this.blockNumber = blockNumber;
    }

    public abstract String getType();
}
