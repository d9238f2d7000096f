package tore.relay.service.event;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.Utils;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.utils.Numeric;

/**
 * ABI decoding of a log against an {@link EventDescriptor}.
 *
 * <p>Plain parameters are decoded by web3j. Tuples are laid out in the head either inline (all
 * members static) or as an offset to their own block, so the head is first decoded with
 * placeholder words in their place and every tuple is then decoded from its slice of the data.
 * Indexed tuples and indexed dynamic values only carry their hash; that hash is returned as is.
 */
final class EventLogDecoder {

    private static final int WORD_HEX_LENGTH = 64;
    private static final Pattern FIXED_DIMENSION = Pattern.compile("\\[(\\d+)]");

    private EventLogDecoder() {
        // Utility class
    }

    /**
     * @return decoded values aligned with {@code descriptor.parameters()}; tuples are name-keyed maps
     * @throws IllegalArgumentException when topics or data do not fit the descriptor
     */
    static List<Object> decode(EventDescriptor descriptor, Log eventLog) {
        List<EventDescriptor.Parameter> indexed = new ArrayList<>();
        List<EventDescriptor.Parameter> data = new ArrayList<>();
        for (EventDescriptor.Parameter parameter : descriptor.parameters()) {
            (parameter.indexed() ? indexed : data).add(parameter);
        }

        List<String> topics = eventLog.getTopics();
        if (topics == null || topics.size() != indexed.size() + 1) {
            throw new IllegalArgumentException("Expected " + (indexed.size() + 1) + " topics for "
                + descriptor.name() + ", got " + (topics == null ? 0 : topics.size()));
        }
        List<Object> indexedValues = new ArrayList<>();
        for (int i = 0; i < indexed.size(); i++) {
            indexedValues.add(decodeTopic(indexed.get(i), topics.get(i + 1)));
        }
        String rawData = eventLog.getData() == null ? "" : Numeric.cleanHexPrefix(eventLog.getData());
        List<Object> dataValues = decodeData(rawData, data);

        List<Object> values = new ArrayList<>();
        int nextIndexed = 0;
        int nextData = 0;
        for (EventDescriptor.Parameter parameter : descriptor.parameters()) {
            values.add(parameter.indexed() ? indexedValues.get(nextIndexed++) : dataValues.get(nextData++));
        }
        return values;
    }

    @SuppressWarnings("unchecked")
    private static Object decodeTopic(EventDescriptor.Parameter parameter, String topic) {
        if (parameter.isTuple() || isDynamic(parameter)) {
            return new Bytes32(Numeric.hexStringToByteArray(topic));
        }
        return FunctionReturnDecoder.decodeIndexedValue(topic, (TypeReference<Type>) parameter.typeReference());
    }

    private static List<Object> decodeData(String hex, List<EventDescriptor.Parameter> parameters) {
        if (parameters.isEmpty()) {
            return List.of();
        }
        List<TypeReference<?>> head = new ArrayList<>();
        for (EventDescriptor.Parameter parameter : parameters) {
            if (!parameter.isTuple()) {
                head.add(parameter.typeReference());
            } else if (isDynamic(parameter)) {
                head.add(new TypeReference<Uint256>() { });
            } else {
                for (int i = 0; i < headWords(parameter); i++) {
                    head.add(new TypeReference<Bytes32>() { });
                }
            }
        }
        List<Type> decoded = FunctionReturnDecoder.decode(hex, Utils.convert(head));
        if (decoded.size() != head.size()) {
            throw new IllegalArgumentException("Log data holds " + decoded.size() + " of " + head.size() + " values");
        }

        List<Object> values = new ArrayList<>();
        int next = 0;
        int word = 0;
        for (EventDescriptor.Parameter parameter : parameters) {
            int words = headWords(parameter);
            if (!parameter.isTuple()) {
                values.add(decoded.get(next++));
            } else if (isDynamic(parameter)) {
                int offset = ((Uint256) decoded.get(next++)).getValue().intValueExact();
                values.add(decodeTuple(parameter, slice(hex, offset * 2, hex.length())));
            } else {
                int start = word * WORD_HEX_LENGTH;
                values.add(decodeTuple(parameter, slice(hex, start, start + words * WORD_HEX_LENGTH)));
                next += words;
            }
            word += words;
        }
        return values;
    }

    private static Map<String, Object> decodeTuple(EventDescriptor.Parameter tuple, String hex) {
        List<Object> members = decodeData(hex, tuple.components());
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i < members.size(); i++) {
            fields.put(tuple.components().get(i).name(), members.get(i));
        }
        return fields;
    }

    private static String slice(String hex, int from, int to) {
        if (from < 0 || to > hex.length() || from > to) {
            throw new IllegalArgumentException("Tuple bounds " + from / 2 + "-" + to / 2 + " outside log data");
        }
        return hex.substring(from, to);
    }

    static boolean isDynamic(EventDescriptor.Parameter parameter) {
        if (parameter.isTuple()) {
            return parameter.components().stream().anyMatch(EventLogDecoder::isDynamic);
        }
        String type = parameter.type();
        if (type.contains("[]")) {
            return true;
        }
        int bracket = type.indexOf('[');
        String base = bracket < 0 ? type : type.substring(0, bracket);
        return "string".equals(base) || "bytes".equals(base);
    }

    /**
     * Number of 32-byte words the parameter takes in the head of its enclosing block.
     */
    static int headWords(EventDescriptor.Parameter parameter) {
        if (isDynamic(parameter)) {
            return 1;
        }
        if (parameter.isTuple()) {
            return parameter.components().stream().mapToInt(EventLogDecoder::headWords).sum();
        }
        int words = 1;
        Matcher dimension = FIXED_DIMENSION.matcher(parameter.type());
        while (dimension.find()) {
            words *= Integer.parseInt(dimension.group(1));
        }
        return words;
    }
}
