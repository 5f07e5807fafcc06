package decentralabs.staking.service.gateway;

import decentralabs.staking.config.StakingProperties;
import java.io.IOException;
import java.math.BigInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionDecoder;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.utils.Numeric;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@SuppressWarnings({"unchecked", "rawtypes"})
class Erc20TokenGatewayTest {

    private static final String TOKEN = "0x4444444444444444444444444444444444444444";
    private static final String ALICE = "0x1111111111111111111111111111111111111111";
    private static final String TX_HASH = "0xabc";

    @Mock
    private Web3j web3j;

    private Credentials custody;
    private Erc20TokenGateway gateway;

    @BeforeEach
    void setUp() {
        custody = Credentials.create("0x1");
        StakingProperties.Gateway settings = new StakingProperties.Gateway();
        settings.setMode("erc20");
        settings.setTokenAddress(TOKEN);
        settings.setReceiptAttempts(3);
        settings.setReceiptPollMillis(0);
        gateway = new Erc20TokenGateway(web3j, custody, settings);
    }

    private void stubNonce(String hexNonce) throws IOException {
        Request<?, EthGetTransactionCount> countRequest = (Request<?, EthGetTransactionCount>) mock(Request.class);
        EthGetTransactionCount countResponse = new EthGetTransactionCount();
        countResponse.setResult(hexNonce);
        when(countRequest.send()).thenReturn(countResponse);
        when(web3j.ethGetTransactionCount(eq(custody.getAddress()), eq(DefaultBlockParameterName.PENDING)))
            .thenReturn((Request) countRequest);
    }

    private void stubSend(EthSendTransaction response) throws IOException {
        Request<?, EthSendTransaction> sendRequest = (Request<?, EthSendTransaction>) mock(Request.class);
        when(sendRequest.send()).thenReturn(response);
        when(web3j.ethSendRawTransaction(any())).thenReturn((Request) sendRequest);
    }

    private void stubAccepted() throws IOException {
        EthSendTransaction sendResponse = new EthSendTransaction();
        sendResponse.setResult(TX_HASH);
        stubSend(sendResponse);
    }

    private void stubReceipt(String status) throws IOException {
        Request<?, EthGetTransactionReceipt> receiptRequest = (Request<?, EthGetTransactionReceipt>) mock(Request.class);
        EthGetTransactionReceipt receiptResponse = new EthGetTransactionReceipt();
        if (status != null) {
            TransactionReceipt receipt = new TransactionReceipt();
            receipt.setTransactionHash(TX_HASH);
            receipt.setStatus(status);
            receiptResponse.setResult(receipt);
        }
        when(receiptRequest.send()).thenReturn(receiptResponse);
        when(web3j.ethGetTransactionReceipt(TX_HASH)).thenReturn((Request) receiptRequest);
    }

    private RawTransaction sentTransaction() {
        ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
        verify(web3j).ethSendRawTransaction(captor.capture());
        return TransactionDecoder.decode(captor.getValue());
    }

    @Test
    void depositPullsTokensWithTransferFrom() throws Exception {
        stubNonce("0x5");
        stubAccepted();
        stubReceipt("0x1");

        boolean result = gateway.deposit(ALICE, BigInteger.valueOf(100));

        assertThat(result).isTrue();
        RawTransaction sent = sentTransaction();
        assertThat(sent.getNonce()).isEqualTo(BigInteger.valueOf(5));
        assertThat(sent.getTo()).isEqualToIgnoringCase(TOKEN);
        assertThat(Numeric.cleanHexPrefix(sent.getData())).startsWith("23b872dd");
    }

    @Test
    void payoutPushesTokensWithTransfer() throws Exception {
        stubNonce("0x0");
        stubAccepted();
        stubReceipt("0x1");

        boolean result = gateway.payout(ALICE, BigInteger.valueOf(102));

        assertThat(result).isTrue();
        assertThat(Numeric.cleanHexPrefix(sentTransaction().getData())).startsWith("a9059cbb");
    }

    @Test
    void revertedReceiptCountsAsFailure() throws Exception {
        stubNonce("0x0");
        stubAccepted();
        stubReceipt("0x0");

        assertThat(gateway.payout(ALICE, BigInteger.TEN)).isFalse();
    }

    @Test
    void nodeErrorCountsAsFailure() throws Exception {
        stubNonce("0x0");
        EthSendTransaction rejected = new EthSendTransaction();
        rejected.setError(new Response.Error(-32000, "insufficient funds for gas"));
        stubSend(rejected);

        assertThat(gateway.deposit(ALICE, BigInteger.TEN)).isFalse();
        verify(web3j, never()).ethGetTransactionReceipt(any());
    }

    @Test
    void missingReceiptAfterAllAttemptsIsReportedAsPending() throws Exception {
        stubNonce("0x0");
        stubAccepted();
        stubReceipt(null);

        assertThatThrownBy(() -> gateway.payout(ALICE, BigInteger.TEN))
            .isInstanceOf(TransferPendingException.class)
            .extracting(e -> ((TransferPendingException) e).getTransactionHash())
            .isEqualTo(TX_HASH);
        verify(web3j, times(3)).ethGetTransactionReceipt(TX_HASH);
    }

    @Test
    void broadcastFailureIsReportedAsPendingWithLocallyComputedHash() throws Exception {
        stubNonce("0x0");
        Request<?, EthSendTransaction> sendRequest = (Request<?, EthSendTransaction>) mock(Request.class);
        when(sendRequest.send()).thenThrow(new IOException("read timed out"));
        when(web3j.ethSendRawTransaction(any())).thenReturn((Request) sendRequest);

        Throwable thrown = catchThrowable(() -> gateway.deposit(ALICE, BigInteger.TEN));

        ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
        verify(web3j).ethSendRawTransaction(captor.capture());
        assertThat(thrown).isInstanceOf(TransferPendingException.class);
        assertThat(((TransferPendingException) thrown).getTransactionHash())
            .isEqualTo(Hash.sha3(captor.getValue()));
        verify(web3j, never()).ethGetTransactionReceipt(any());
    }

    @Test
    void ioFailureCountsAsFailure() throws Exception {
        Request<?, EthGetTransactionCount> countRequest = (Request<?, EthGetTransactionCount>) mock(Request.class);
        when(countRequest.send()).thenThrow(new IOException("connection refused"));
        when(web3j.ethGetTransactionCount(eq(custody.getAddress()), eq(DefaultBlockParameterName.PENDING)))
            .thenReturn((Request) countRequest);

        assertThat(gateway.deposit(ALICE, BigInteger.TEN)).isFalse();
        verify(web3j, never()).ethSendRawTransaction(any());
    }

    @Test
    void exposesCustodyAddress() {
        assertThat(gateway.getCustodyAddress()).isEqualTo(custody.getAddress());
    }
}
