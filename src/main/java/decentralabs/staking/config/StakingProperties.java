package decentralabs.staking.config;

import java.math.BigInteger;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "staking")
public class StakingProperties {

    /** Address allowed to change the minimum stake. Fixed for the lifetime of the process. */
    private String ownerAddress;

    /** Block-height units that must elapse per unit of reward. Must be positive. */
    private BigInteger payoutGap = BigInteger.TEN;

    /** Initial minimum stake; the owner may change it at runtime. */
    private BigInteger minimumStake = BigInteger.ONE;

    private Gateway gateway = new Gateway();

    private Chain chain = new Chain();

    private Audit audit = new Audit();

    private RateLimit rateLimit = new RateLimit();

    @Data
    public static class Gateway {

        /** "simulated" keeps balances in memory, "erc20" talks to a token contract. */
        private String mode = "simulated";

        /** Balance every wallet starts with in simulated mode. */
        private BigInteger simulatedOpeningBalance = BigInteger.valueOf(1_000_000L);

        /** Tokens already in simulated custody at startup, used to pay rewards. */
        private BigInteger simulatedRewardReserve = BigInteger.valueOf(1_000_000L);

        /** ERC-20 contract holding the staked asset. */
        private String tokenAddress;

        /** Hex private key of the custody wallet that receives deposits and signs payouts. */
        private String custodyPrivateKey;

        private long gasLimit = 120_000L;

        private String gasPriceGwei = "20";

        /** How many times to poll for a receipt before reporting the transfer as pending. */
        private int receiptAttempts = 40;

        private long receiptPollMillis = 1_500L;
    }

    @Data
    public static class Chain {

        /** JSON-RPC endpoint. When blank the block height is advanced manually. */
        private String rpcUrl;

        /** Starting height for the manual block counter. */
        private BigInteger initialBlock = BigInteger.ZERO;
    }

    @Data
    public static class Audit {

        private int maxRecordsPerAccount = 200;

        private Persistence persistence = new Persistence();

        @Data
        public static class Persistence {

            private boolean enabled = false;

            private String filePath = "./data/staking-audit.jsonl";
        }
    }

    @Data
    public static class RateLimit {

        /** Mutating requests allowed per account per minute. */
        private int operationsPerMinute = 30;
    }
}
