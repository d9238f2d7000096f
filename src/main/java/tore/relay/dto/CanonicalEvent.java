package tore.relay.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serialization-safe representation of a decoded contract event, as stored in the relay queue
 * and posted to the downstream service.
 *
 * @param eventName       event name from the contract ABI
 * @param args            decoded arguments in declaration order, values already normalized
 * @param blockNumber     block that contains the log
 * @param transactionHash transaction that emitted the log
 * @param logIndex        position of the log inside the block
 * @param removed         true when a chain reorganization retracted the log
 * @param sourceContract  configured name of the emitting contract
 */
@JsonPropertyOrder({"eventName", "args", "blockNumber", "transactionHash", "logIndex", "removed", "sourceContract"})
public record CanonicalEvent(
    String eventName,
    Map<String, Object> args,
    long blockNumber,
    String transactionHash,
    long logIndex,
    boolean removed,
    String sourceContract
) {

    public CanonicalEvent {
        args = args == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    /**
     * Key the downstream service deduplicates on.
     */
    public String deliveryKey() {
        return transactionHash + "-" + logIndex + "-" + eventName;
    }
}
