package tore.relay.service.chain;

import java.net.ConnectException;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;
import org.web3j.protocol.websocket.WebSocketService;
import tore.relay.exception.ChainConnectionException;
import tore.relay.exception.RelayConfigurationException;

/**
 * Opens web3j connections to the chain node: WebSocket for {@code ws://}/{@code wss://} URLs,
 * HTTP otherwise.
 */
@Component
@Slf4j
public class ChainConnectionFactory {

    private final OkHttpClient httpClient;

    public ChainConnectionFactory(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public ChainLogClient open(String nodeUrl) {
        if (nodeUrl == null || nodeUrl.isBlank()) {
            throw new RelayConfigurationException("relay.node.url", "relay.node.url is required");
        }
        String normalized = nodeUrl.trim();
        String scheme = normalized.toLowerCase(Locale.ROOT);

        if (scheme.startsWith("ws://") || scheme.startsWith("wss://")) {
            WebSocketService webSocketService = new WebSocketService(normalized, false);
            try {
                webSocketService.connect();
            } catch (ConnectException | RuntimeException e) {
                throw new ChainConnectionException("connect", "Cannot open WebSocket to chain node: " + e.getMessage(), e);
            }
            log.info("Opened WebSocket connection to chain node");
            return new ChainLogClient(Web3j.build(webSocketService));
        }
        if (scheme.startsWith("http://") || scheme.startsWith("https://")) {
            log.info("Using HTTP connection to chain node");
            return new ChainLogClient(Web3j.build(new HttpService(normalized, httpClient)));
        }
        throw new RelayConfigurationException("relay.node.url", "Unsupported chain node URL scheme: " + normalized);
    }
}
