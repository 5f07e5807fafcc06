package decentralabs.staking.config;

import decentralabs.staking.service.chain.BlockHeightProvider;
import decentralabs.staking.service.chain.ManualBlockHeightProvider;
import decentralabs.staking.service.chain.Web3jBlockHeightProvider;
import decentralabs.staking.service.gateway.Erc20TokenGateway;
import decentralabs.staking.service.gateway.SimulatedTokenGateway;
import decentralabs.staking.service.gateway.TokenGateway;
import decentralabs.staking.util.AccountIds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

/**
 * Wires the external collaborators: chain client, block height source and token custody.
 */
@Configuration
@Slf4j
public class StakingGatewayConfig {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnProperty(prefix = "staking.chain", name = "rpc-url")
    public Web3j web3j(StakingProperties properties) {
        log.info("Connecting to chain node at {}", AccountIds.sanitize(properties.getChain().getRpcUrl()));
        return Web3j.build(new HttpService(properties.getChain().getRpcUrl()));
    }

    @Bean
    public BlockHeightProvider blockHeightProvider(StakingProperties properties, ObjectProvider<Web3j> web3j) {
        Web3j client = web3j.getIfAvailable();
        if (client != null) {
            return new Web3jBlockHeightProvider(client);
        }
        log.info("No chain endpoint configured, block height starts at {} and is advanced manually",
            properties.getChain().getInitialBlock());
        return new ManualBlockHeightProvider(properties.getChain().getInitialBlock());
    }

    @Bean
    public TokenGateway tokenGateway(StakingProperties properties, ObjectProvider<Web3j> web3j) {
        StakingProperties.Gateway settings = properties.getGateway();
        String mode = settings.getMode() == null ? "simulated" : settings.getMode().trim().toLowerCase();
        switch (mode) {
            case "simulated":
                log.info("Using simulated token custody with reward reserve {}", settings.getSimulatedRewardReserve());
                return new SimulatedTokenGateway(settings.getSimulatedOpeningBalance(),
                    settings.getSimulatedRewardReserve());
            case "erc20":
                Web3j client = web3j.getIfAvailable();
                if (client == null) {
                    throw new IllegalStateException("staking.gateway.mode=erc20 requires staking.chain.rpc-url");
                }
                if (!AccountIds.isValid(settings.getTokenAddress())) {
                    throw new IllegalStateException("staking.gateway.token-address is missing or invalid");
                }
                if (settings.getCustodyPrivateKey() == null || settings.getCustodyPrivateKey().isBlank()) {
                    throw new IllegalStateException("staking.gateway.custody-private-key must be configured");
                }
                Credentials custody = Credentials.create(settings.getCustodyPrivateKey().trim());
                log.info("Using ERC-20 custody {} for token {}",
                    AccountIds.mask(custody.getAddress()), AccountIds.mask(settings.getTokenAddress()));
                return new Erc20TokenGateway(client, custody, settings);
            default:
                throw new IllegalStateException("Unknown staking.gateway.mode: " + AccountIds.sanitize(mode));
        }
    }
}
