package tore.relay.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns contract event names into URL path tokens.
 */
public final class EventNames {

    private static final Pattern LOWER_TO_UPPER = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern ACRONYM_BOUNDARY = Pattern.compile("([A-Z]+)([A-Z][a-z0-9]+)");

    private EventNames() {
        // Utility class
    }

    /**
     * Converts {@code NftLocked} to {@code nft-locked} and {@code NFTListed} to {@code nft-listed}.
     * The result is stable for a given input and contains only URL-safe characters for
     * identifier-style names.
     */
    public static String toKebabCase(String eventName) {
        if (eventName == null || eventName.isBlank()) {
            throw new IllegalArgumentException("Event name cannot be null or empty");
        }
        String step = LOWER_TO_UPPER.matcher(eventName.trim()).replaceAll("$1-$2");
        step = ACRONYM_BOUNDARY.matcher(step).replaceAll("$1-$2");
        return step.toLowerCase(Locale.ROOT);
    }
}
