package decentralabs.staking.service.gateway;

import decentralabs.staking.config.StakingProperties;
import decentralabs.staking.util.AccountIds;
import java.io.IOException;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.utils.Convert;
import org.web3j.utils.Numeric;

/**
 * Custody backed by an ERC-20 contract. Deposits pull tokens with
 * {@code transferFrom} (the staker must have approved the custody wallet),
 * payouts push them with {@code transfer}. A transfer counts as done only once
 * its receipt reports success. A transaction the node rejected or that reverted
 * is a plain failure; one that was broadcast without a receipt in time raises
 * {@link TransferPendingException}.
 */
@Slf4j
public class Erc20TokenGateway implements TokenGateway {

    private final Web3j web3j;
    private final Credentials custody;
    private final StakingProperties.Gateway settings;

    public Erc20TokenGateway(Web3j web3j, Credentials custody, StakingProperties.Gateway settings) {
        this.web3j = web3j;
        this.custody = custody;
        this.settings = settings;
    }

    @Override
    public boolean deposit(String from, BigInteger amount) {
        Function function = new Function(
            "transferFrom",
            Arrays.asList(new Address(from), new Address(custody.getAddress()), new Uint256(amount)),
            Collections.emptyList()
        );
        return execute("deposit", from, amount, function);
    }

    @Override
    public boolean payout(String to, BigInteger amount) {
        Function function = new Function(
            "transfer",
            Arrays.asList(new Address(to), new Uint256(amount)),
            Collections.emptyList()
        );
        return execute("payout", to, amount, function);
    }

    public String getCustodyAddress() {
        return custody.getAddress();
    }

    private boolean execute(String operation, String account, BigInteger amount, Function function) {
        String signedTransaction;
        try {
            signedTransaction = signTransaction(function);
        } catch (IOException e) {
            log.error("Token {} of {} for {} could not be prepared: {}", operation, amount, AccountIds.mask(account), e.getMessage(), e);
            return false;
        }

        // From here on the node may have the transaction, so failures are reported as pending
        String txHash = Hash.sha3(signedTransaction);
        EthSendTransaction sent;
        try {
            sent = web3j.ethSendRawTransaction(signedTransaction).send();
        } catch (IOException e) {
            log.error("Broadcast of token {} {} for {} did not complete: {}", operation, txHash, AccountIds.mask(account), e.getMessage());
            throw new TransferPendingException(txHash, "Broadcast of " + txHash + " did not complete", e);
        }
        if (sent.hasError()) {
            log.error("Token {} of {} for {} rejected by node: {}", operation, amount, AccountIds.mask(account), sent.getError().getMessage());
            return false;
        }
        if (sent.getTransactionHash() != null) {
            txHash = sent.getTransactionHash();
        }
        log.info("Token {} of {} for {} submitted: {}", operation, amount, AccountIds.mask(account), txHash);

        try {
            return awaitSuccess(txHash);
        } catch (IOException e) {
            log.error("Receipt lookup for {} failed: {}", txHash, e.getMessage());
            throw new TransferPendingException(txHash, "Receipt lookup for " + txHash + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Token {} for {} interrupted while waiting for receipt of {}", operation, AccountIds.mask(account), txHash);
            throw new TransferPendingException(txHash, "Interrupted while waiting for receipt of " + txHash, e);
        }
    }

    private String signTransaction(Function function) throws IOException {
        String encodedFunction = FunctionEncoder.encode(function);

        EthGetTransactionCount transactionCount = web3j.ethGetTransactionCount(
            custody.getAddress(), DefaultBlockParameterName.PENDING).send();
        BigInteger nonce = transactionCount.getTransactionCount();

        BigInteger gasPrice = Convert.toWei(settings.getGasPriceGwei(), Convert.Unit.GWEI).toBigInteger();
        RawTransaction rawTransaction = RawTransaction.createTransaction(
            nonce,
            gasPrice,
            BigInteger.valueOf(settings.getGasLimit()),
            settings.getTokenAddress(),
            encodedFunction
        );

        byte[] signedMessage = TransactionEncoder.signMessage(rawTransaction, custody);
        return Numeric.toHexString(signedMessage);
    }

    /**
     * @return true when mined successfully, false when reverted
     * @throws TransferPendingException when no receipt shows up in time
     */
    private boolean awaitSuccess(String txHash) throws IOException, InterruptedException {
        for (int attempt = 0; attempt < settings.getReceiptAttempts(); attempt++) {
            EthGetTransactionReceipt response = web3j.ethGetTransactionReceipt(txHash).send();
            Optional<TransactionReceipt> receipt = response.getTransactionReceipt();
            if (receipt.isPresent()) {
                boolean ok = receipt.get().isStatusOK();
                if (!ok) {
                    log.warn("Token transfer {} reverted", txHash);
                }
                return ok;
            }
            Thread.sleep(settings.getReceiptPollMillis());
        }
        log.warn("No receipt for {} after {} attempts", txHash, settings.getReceiptAttempts());
        throw new TransferPendingException(txHash,
            "No receipt for " + txHash + " after " + settings.getReceiptAttempts() + " attempts");
    }
}
