package tore.relay.service.event;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;
import org.web3j.abi.datatypes.Type;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.utils.Numeric;
import tore.relay.dto.CanonicalEvent;
import tore.relay.exception.EventParseException;

/**
 * Decodes raw logs against an {@link EventDescriptor} and converts every decoded value into
 * something Jackson can write without losing precision.
 */
@Component
public class EventNormalizer {

    /**
     * Builds the canonical payload for a log.
     *
     * @throws EventParseException when the log does not match the descriptor or cannot be decoded
     */
    public CanonicalEvent normalize(EventDescriptor descriptor, Log eventLog, String contractName) {
        String txHash = eventLog.getTransactionHash();
        List<String> topics = eventLog.getTopics();
        if (topics == null || topics.isEmpty() || !descriptor.topic().equalsIgnoreCase(topics.get(0))) {
            throw new EventParseException(txHash, "Log topic does not match " + descriptor.signature());
        }

        List<Object> values;
        try {
            values = EventLogDecoder.decode(descriptor, eventLog);
        } catch (RuntimeException e) {
            throw new EventParseException(txHash, "Cannot decode " + descriptor.name() + ": " + e.getMessage(), e);
        }

        Map<String, Object> args = new LinkedHashMap<>();
        List<EventDescriptor.Parameter> parameters = descriptor.parameters();
        for (int i = 0; i < parameters.size(); i++) {
            args.put(parameters.get(i).name(), normalizeValue(values.get(i)));
        }

        return new CanonicalEvent(
            descriptor.name(),
            args,
            requireQuantity(eventLog::getBlockNumber, "blockNumber", txHash),
            txHash,
            requireQuantity(eventLog::getLogIndex, "logIndex", txHash),
            eventLog.isRemoved(),
            contractName
        );
    }

    /**
     * Recursively converts a decoded value: big numbers become decimal strings, byte arrays become
     * 0x-prefixed hex, arrays and lists are converted element-wise, decoded tuples and other maps become
     * ordered maps keyed by member name.
     */
    public Object normalizeValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Type<?> abiValue) {
            return normalizeValue(abiValue.getValue());
        }
        if (value instanceof BigInteger bigInteger) {
            return bigInteger.toString();
        }
        if (value instanceof BigDecimal bigDecimal) {
            return bigDecimal.toPlainString();
        }
        if (value instanceof byte[] bytes) {
            return Numeric.toHexString(bytes);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> normalized = new LinkedHashMap<>();
            map.forEach((key, val) -> normalized.put(String.valueOf(key), normalizeValue(val)));
            return normalized;
        }
        if (value instanceof Iterable<?> iterable) {
            List<Object> normalized = new ArrayList<>();
            for (Object item : iterable) {
                normalized.add(normalizeValue(item));
            }
            return normalized;
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> normalized = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                normalized.add(normalizeValue(Array.get(value, i)));
            }
            return normalized;
        }
        return value;
    }

    private static long requireQuantity(Supplier<BigInteger> reader, String field, String txHash) {
        BigInteger quantity;
        try {
            quantity = reader.get();
        } catch (RuntimeException e) {
            throw new EventParseException(txHash, "Malformed " + field + ": " + e.getMessage(), e);
        }
        if (quantity == null) {
            throw new EventParseException(txHash, "Log is missing " + field);
        }
        try {
            return quantity.longValueExact();
        } catch (ArithmeticException e) {
            throw new EventParseException(txHash, field + " out of range: " + quantity, e);
        }
    }
}
