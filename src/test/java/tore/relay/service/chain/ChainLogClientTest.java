package tore.relay.service.chain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import org.web3j.protocol.core.methods.response.EthLog;
import org.web3j.protocol.core.methods.response.Log;
import tore.relay.exception.ChainConnectionException;
import tore.relay.support.LogFixtures;

@ExtendWith(MockitoExtension.class)
class ChainLogClientTest {

    @Mock
    private Web3j web3j;

    @Mock
    private Request<?, EthBlockNumber> blockNumberRequest;

    @Mock
    private Request<?, EthLog> logsRequest;

    private ChainLogClient client;

    @BeforeEach
    void setUp() {
        client = new ChainLogClient(web3j);
    }

    @Nested
    @DisplayName("currentBlockNumber")
    class CurrentBlockNumber {

        @Test
        @DisplayName("Should decode the chain height")
        void shouldReturnHeight() throws IOException {
            EthBlockNumber response = new EthBlockNumber();
            response.setResult("0x3e8");
            doReturn(blockNumberRequest).when(web3j).ethBlockNumber();
            when(blockNumberRequest.send()).thenReturn(response);

            assertThat(client.currentBlockNumber()).isEqualTo(1000);
        }

        @Test
        @DisplayName("Should wrap transport failures")
        void shouldWrapTransportFailure() throws IOException {
            doReturn(blockNumberRequest).when(web3j).ethBlockNumber();
            when(blockNumberRequest.send()).thenThrow(new IOException("connection reset"));

            assertThatThrownBy(() -> client.currentBlockNumber())
                .isInstanceOf(ChainConnectionException.class)
                .hasMessageContaining("connection reset")
                .extracting(e -> ((ChainConnectionException) e).getOperation())
                .isEqualTo("eth_blockNumber");
        }

        @Test
        @DisplayName("Should wrap RPC errors")
        void shouldWrapRpcError() throws IOException {
            EthBlockNumber response = new EthBlockNumber();
            response.setError(new Response.Error(-32000, "header not found"));
            doReturn(blockNumberRequest).when(web3j).ethBlockNumber();
            when(blockNumberRequest.send()).thenReturn(response);

            assertThatThrownBy(() -> client.currentBlockNumber())
                .isInstanceOf(ChainConnectionException.class)
                .hasMessageContaining("header not found");
        }

        @Test
        @DisplayName("Should wrap heights that do not fit in a long")
        void shouldWrapOversizedHeight() throws IOException {
            EthBlockNumber response = new EthBlockNumber();
            response.setResult("0x10000000000000000");
            doReturn(blockNumberRequest).when(web3j).ethBlockNumber();
            when(blockNumberRequest.send()).thenReturn(response);

            assertThatThrownBy(() -> client.currentBlockNumber())
                .isInstanceOf(ChainConnectionException.class)
                .hasMessageContaining("Malformed block number")
                .hasCauseInstanceOf(ArithmeticException.class);
        }
    }

    @Nested
    @DisplayName("getLogs")
    class GetLogs {

        @Test
        @DisplayName("Should filter by address and topic over the requested range")
        @SuppressWarnings({"rawtypes", "unchecked"})
        void shouldQueryLogs() throws IOException {
            Log raw = LogFixtures.nftLocked(10, 0, 1);
            EthLog.LogObject logObject = new EthLog.LogObject();
            logObject.setAddress(raw.getAddress());
            logObject.setTopics(raw.getTopics());
            logObject.setData(raw.getData());
            logObject.setBlockNumber(raw.getBlockNumberRaw());
            logObject.setLogIndex(raw.getLogIndexRaw());
            logObject.setTransactionHash(raw.getTransactionHash());
            EthLog response = new EthLog();
            response.setResult((List) List.of(logObject));
            doReturn(logsRequest).when(web3j).ethGetLogs(any(EthFilter.class));
            when(logsRequest.send()).thenReturn(response);

            List<Log> logs = client.getLogs(LogFixtures.VAULT, LogFixtures.NFT_LOCKED.topic(), 10, 20);

            assertThat(logs).singleElement()
                .satisfies(eventLog -> assertThat(eventLog.getTransactionHash()).isEqualTo(raw.getTransactionHash()));
            ArgumentCaptor<EthFilter> filter = ArgumentCaptor.forClass(EthFilter.class);
            verify(web3j).ethGetLogs(filter.capture());
            assertThat(filter.getValue().getAddress()).containsExactly(LogFixtures.VAULT);
            assertThat(filter.getValue().getFromBlock().getValue()).isEqualTo("0xa");
            assertThat(filter.getValue().getToBlock().getValue()).isEqualTo("0x14");
        }

        @Test
        @DisplayName("Should wrap query failures")
        void shouldWrapQueryFailure() throws IOException {
            doReturn(logsRequest).when(web3j).ethGetLogs(any(EthFilter.class));
            when(logsRequest.send()).thenThrow(new IOException("timeout"));

            assertThatThrownBy(() -> client.getLogs(LogFixtures.VAULT, LogFixtures.NFT_LOCKED.topic(), 1, 2))
                .isInstanceOf(ChainConnectionException.class)
                .extracting(e -> ((ChainConnectionException) e).getOperation())
                .isEqualTo("eth_getLogs");
        }
    }
}
