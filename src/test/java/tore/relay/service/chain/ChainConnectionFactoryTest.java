package tore.relay.service.chain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import okhttp3.OkHttpClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tore.relay.exception.ChainConnectionException;
import tore.relay.exception.RelayConfigurationException;

class ChainConnectionFactoryTest {

    private final ChainConnectionFactory factory = new ChainConnectionFactory(new OkHttpClient());

    @Test
    @DisplayName("Should open HTTP connections without contacting the node")
    void shouldOpenHttpConnection() {
        ChainLogClient client = factory.open("http://localhost:8545");

        assertThat(client.getWeb3j()).isNotNull();
        client.shutdown();
    }

    @Test
    @DisplayName("Should reject blank URLs and unsupported schemes")
    void shouldRejectInvalidUrls() {
        assertThatThrownBy(() -> factory.open(""))
            .isInstanceOf(RelayConfigurationException.class);
        assertThatThrownBy(() -> factory.open("ftp://node.example.com"))
            .isInstanceOf(RelayConfigurationException.class)
            .hasMessageContaining("Unsupported");
    }

    @Test
    @DisplayName("Should report an unreachable WebSocket node as a connection error")
    void shouldWrapWebSocketFailure() {
        assertThatThrownBy(() -> factory.open("ws://127.0.0.1:1"))
            .isInstanceOf(ChainConnectionException.class)
            .extracting(e -> ((ChainConnectionException) e).getOperation())
            .isEqualTo("connect");
    }
}
