package tore.relay.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Data
@Component
@Validated
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    /** Master switch for the listener and the worker pool. */
    private boolean enabled = true;

    private Node node = new Node();
    private List<ContractSettings> contracts = new ArrayList<>();
    private Downstream downstream = new Downstream();
    @Valid
    private Worker worker = new Worker();
    @Valid
    private Queue queue = new Queue();
    private Checkpoint checkpoint = new Checkpoint();
    @Valid
    private Backfill backfill = new Backfill();

    @Data
    public static class Node {
        /** ws://, wss:// or http(s):// endpoint of the chain node. */
        private String url;
        private Duration reconnectDelay = Duration.ofSeconds(30);
    }

    @Data
    public static class ContractSettings {
        /** Label copied into every relayed event as {@code sourceContract}. */
        private String name;
        private String address;
        /**
         * Typed event signatures, e.g.
         * {@code NftLocked(address indexed owner,uint256 indexed tokenId,address nft)}.
         */
        private List<String> events = new ArrayList<>();
    }

    @Data
    public static class Downstream {
        private String baseUrl;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Worker {
        @Min(1)
        private int concurrency = 5;
        private Duration pollInterval = Duration.ofSeconds(1);
        /** ACTIVE jobs locked for longer than this are handed out again. */
        private Duration stallTimeout = Duration.ofMinutes(5);
    }

    @Data
    public static class Queue {
        private String table = "relay_jobs";
        @Min(1)
        private int maxAttempts = 5;
        private Duration backoffDelay = Duration.ofSeconds(5);
        @Min(0)
        private int keepCompleted = 500;
    }

    @Data
    public static class Checkpoint {
        private String path = "./data/lastProcessedBlock.json";
    }

    @Data
    public static class Backfill {
        @Min(1)
        private int maxBlockRange = 2000;
        /** Lower bound for the first scan when no checkpoint exists yet, usually the deployment block. */
        @Min(0)
        private long startBlock = 0;
        /** Pause between retries of range queries and enqueues a backfill could not finish. */
        private Duration retryDelay = Duration.ofSeconds(30);
    }
}
