package tore.relay.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.concurrent.TimeUnit;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import tore.relay.exception.RelayConfigurationException;
import tore.relay.service.queue.ExponentialBackoff;
import tore.relay.service.queue.RelayJobQueue;
import tore.relay.service.worker.DownstreamRelayClient;
import tore.relay.service.worker.RelayWorkerPool;

/**
 * Beans shared by the listener and the worker pool.
 */
@Configuration
public class RelayConfig {

    @Bean
    public Clock relayClock() {
        return Clock.systemUTC();
    }

    // Shared by the HTTP chain transport and the downstream client
    @Bean
    public OkHttpClient relayHttpClient(RelayProperties properties) {
        RelayProperties.Downstream downstream = properties.getDownstream();
        return new OkHttpClient.Builder()
            .connectionPool(new ConnectionPool(10, 5, TimeUnit.MINUTES))
            .connectTimeout(downstream.getConnectTimeout())
            .readTimeout(downstream.getReadTimeout())
            .writeTimeout(downstream.getReadTimeout())
            .build();
    }

    @Bean
    public RelayJobQueue relayJobQueue(
        JdbcTemplate jdbcTemplate,
        ObjectMapper objectMapper,
        RelayProperties properties,
        Clock relayClock
    ) {
        RelayProperties.Queue queue = properties.getQueue();
        try {
            return new RelayJobQueue(
                jdbcTemplate,
                objectMapper,
                queue.getTable(),
                queue.getMaxAttempts(),
                ExponentialBackoff.of(queue.getBackoffDelay()),
                queue.getKeepCompleted(),
                relayClock
            );
        } catch (IllegalArgumentException e) {
            throw new RelayConfigurationException("relay.queue", "Invalid relay queue settings: " + e.getMessage(), e);
        }
    }

    @Bean
    public DownstreamRelayClient downstreamRelayClient(
        OkHttpClient relayHttpClient,
        ObjectMapper objectMapper,
        RelayProperties properties
    ) {
        String baseUrl = properties.getDownstream().getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new RelayConfigurationException("relay.downstream.base-url", "relay.downstream.base-url is required");
        }
        return new DownstreamRelayClient(relayHttpClient, objectMapper, baseUrl);
    }

    @Bean
    public RelayWorkerPool relayWorkerPool(DownstreamRelayClient downstreamRelayClient, RelayProperties properties) {
        RelayProperties.Worker worker = properties.getWorker();
        return new RelayWorkerPool(downstreamRelayClient, worker.getPollInterval(), worker.getStallTimeout());
    }
}
