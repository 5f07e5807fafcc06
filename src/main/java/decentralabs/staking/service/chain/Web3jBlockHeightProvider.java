package decentralabs.staking.service.chain;

import java.io.IOException;
import java.math.BigInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.response.EthBlockNumber;

/**
 * Reads the latest block number from the configured node.
 */
@Slf4j
@RequiredArgsConstructor
public class Web3jBlockHeightProvider implements BlockHeightProvider {

    private final Web3j web3j;

    @Override
    public BigInteger currentBlock() {
        try {
            EthBlockNumber response = web3j.ethBlockNumber().send();
            if (response.hasError()) {
                throw new IllegalStateException("Node returned error for eth_blockNumber: "
                    + response.getError().getMessage());
            }
            return response.getBlockNumber();
        } catch (IOException e) {
            log.error("Unable to read block height: {}", e.getMessage());
            throw new IllegalStateException("Unable to read block height", e);
        }
    }
}
