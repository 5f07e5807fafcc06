package decentralabs.staking.service.chain;

import java.math.BigInteger;

/**
 * Source of the current block height. Heights never decrease.
 */
public interface BlockHeightProvider {

    BigInteger currentBlock();
}
