package tore.relay.service.event;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.web3j.abi.TypeReference;
import tore.relay.exception.RelayConfigurationException;

/**
 * Parses human-readable event signatures into {@link EventDescriptor}s.
 *
 * <p>Accepted form: {@code Name(type [indexed] [name], ...)}, for example
 * {@code NftLocked(address indexed owner,uint256 indexed tokenId,address nft)}.
 * Tuples are written {@code (type name, ...)} or {@code tuple(type name, ...)} and may nest;
 * arrays of tuples are not supported.
 */
public final class EventSignatureParser {

    private static final Pattern SIGNATURE = Pattern.compile("^\\s*([A-Za-z_$][A-Za-z0-9_$]*)\\s*\\((.*)\\)\\s*$");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");
    private static final Pattern TYPE = Pattern.compile("^([a-z]+)([0-9]*)((\\[[0-9]*])*)$");

    private EventSignatureParser() {
        // Utility class
    }

    public static EventDescriptor parse(String signature) {
        if (signature == null || signature.isBlank()) {
            throw new RelayConfigurationException("relay.contracts.events", "Event signature cannot be empty");
        }
        Matcher matcher = SIGNATURE.matcher(signature);
        if (!matcher.matches()) {
            throw invalid(signature, "expected Name(type [indexed] [name], ...)");
        }
        String eventName = matcher.group(1);
        List<EventDescriptor.Parameter> parameters = parseParameters(signature, matcher.group(2).trim(), true);

        long indexedCount = parameters.stream().filter(EventDescriptor.Parameter::indexed).count();
        if (indexedCount > 3) {
            throw invalid(signature, "at most 3 parameters can be indexed");
        }
        return EventDescriptor.of(eventName, parameters);
    }

    private static List<EventDescriptor.Parameter> parseParameters(String signature, String body, boolean topLevel) {
        List<EventDescriptor.Parameter> parameters = new ArrayList<>();
        if (body.isEmpty()) {
            return parameters;
        }
        List<String> declarations = splitTopLevel(signature, body);
        for (int i = 0; i < declarations.size(); i++) {
            parameters.add(parseParameter(signature, declarations.get(i).trim(), i, topLevel));
        }
        return parameters;
    }

    private static List<String> splitTopLevel(String signature, String body) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    throw invalid(signature, "unbalanced parentheses");
                }
            } else if (c == ',' && depth == 0) {
                parts.add(body.substring(start, i));
                start = i + 1;
            }
        }
        if (depth != 0) {
            throw invalid(signature, "unbalanced parentheses");
        }
        parts.add(body.substring(start));
        return parts;
    }

    private static EventDescriptor.Parameter parseParameter(String signature, String declaration, int index, boolean topLevel) {
        if (declaration.isEmpty()) {
            throw invalid(signature, "empty parameter at position " + index);
        }
        if (declaration.startsWith("(") || declaration.toLowerCase(Locale.ROOT).startsWith("tuple(")) {
            return parseTuple(signature, declaration, index, topLevel);
        }

        String[] tokens = declaration.split("\\s+");
        if (tokens.length > 3) {
            throw invalid(signature, "cannot parse parameter '" + declaration + "'");
        }
        String type = canonicalType(signature, tokens[0]);
        Modifiers modifiers = parseModifiers(signature, declaration, Arrays.copyOfRange(tokens, 1, tokens.length), index, topLevel);
        return new EventDescriptor.Parameter(
            modifiers.name(), type, modifiers.indexed(), typeReference(signature, type, modifiers.indexed()));
    }

    private static EventDescriptor.Parameter parseTuple(String signature, String declaration, int index, boolean topLevel) {
        int open = declaration.indexOf('(');
        int close = matchingParenthesis(declaration, open);
        if (close < 0) {
            throw invalid(signature, "unbalanced parentheses");
        }
        String members = declaration.substring(open + 1, close).trim();
        String rest = declaration.substring(close + 1).trim();
        if (rest.startsWith("[")) {
            throw invalid(signature, "arrays of tuples are not supported");
        }
        if (members.isEmpty()) {
            throw invalid(signature, "empty tuple at position " + index);
        }

        List<EventDescriptor.Parameter> components = parseParameters(signature, members, false);
        String type = "(" + String.join(",", components.stream().map(EventDescriptor.Parameter::type).toList()) + ")";
        String[] tokens = rest.isEmpty() ? new String[0] : rest.split("\\s+");
        if (tokens.length > 2) {
            throw invalid(signature, "cannot parse parameter '" + declaration + "'");
        }
        Modifiers modifiers = parseModifiers(signature, declaration, tokens, index, topLevel);
        return new EventDescriptor.Parameter(modifiers.name(), type, modifiers.indexed(), null, components);
    }

    private static Modifiers parseModifiers(String signature, String declaration, String[] tokens, int index, boolean topLevel) {
        boolean indexed = false;
        String name = null;
        for (int i = 0; i < tokens.length; i++) {
            if ("indexed".equals(tokens[i]) && i == 0) {
                if (!topLevel) {
                    throw invalid(signature, "tuple members cannot be indexed");
                }
                indexed = true;
            } else if (name == null && IDENTIFIER.matcher(tokens[i]).matches()) {
                name = tokens[i];
            } else {
                throw invalid(signature, "cannot parse parameter '" + declaration + "'");
            }
        }
        return new Modifiers(indexed, name != null ? name : "arg" + index);
    }

    private static int matchingParenthesis(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static String canonicalType(String signature, String rawType) {
        Matcher matcher = TYPE.matcher(rawType.toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw invalid(signature, "unknown type '" + rawType + "'");
        }
        String base = matcher.group(1);
        String size = matcher.group(2);
        String dimensions = matcher.group(3);
        if (size.isEmpty()) {
            switch (base) {
                case "uint", "int" -> size = "256";
                case "byte" -> {
                    base = "bytes";
                    size = "1";
                }
                default -> {
                    // address, bool, string, dynamic bytes
                }
            }
        }
        return base + size + dimensions;
    }

    private static TypeReference<?> typeReference(String signature, String type, boolean indexed) {
        try {
            return TypeReference.makeTypeReference(type, indexed, false);
        } catch (ClassNotFoundException | RuntimeException e) {
            throw new RelayConfigurationException(
                "relay.contracts.events",
                "Unsupported type '" + type + "' in event signature " + signature,
                e
            );
        }
    }

    private static RelayConfigurationException invalid(String signature, String reason) {
        return new RelayConfigurationException(
            "relay.contracts.events",
            "Invalid event signature '" + signature + "': " + reason
        );
    }

    private record Modifiers(boolean indexed, String name) {
    }
}
