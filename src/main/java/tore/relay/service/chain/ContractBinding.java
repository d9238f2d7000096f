package tore.relay.service.chain;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.web3j.crypto.Keys;
import tore.relay.config.RelayProperties;
import tore.relay.exception.RelayConfigurationException;
import tore.relay.service.event.EventDescriptor;
import tore.relay.service.event.EventSignatureParser;

/**
 * A contract the relay listens to, with the typed events configured for it.
 *
 * @param name    label copied into relayed events as {@code sourceContract}
 * @param address lowercase 0x-prefixed contract address
 * @param events  descriptors of the events to relay
 */
public record ContractBinding(String name, String address, List<EventDescriptor> events) {

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    public ContractBinding {
        events = List.copyOf(events);
    }

    /**
     * Validates the configured contracts and parses their event signatures.
     *
     * @throws RelayConfigurationException when no contract is configured or any entry is invalid
     */
    public static List<ContractBinding> fromProperties(RelayProperties properties) {
        List<RelayProperties.ContractSettings> contracts = properties.getContracts();
        if (contracts == null || contracts.isEmpty()) {
            throw new RelayConfigurationException("relay.contracts", "At least one contract must be configured");
        }

        List<ContractBinding> bindings = new ArrayList<>();
        Set<String> seenAddresses = new HashSet<>();
        for (int i = 0; i < contracts.size(); i++) {
            RelayProperties.ContractSettings settings = contracts.get(i);
            String prefix = "relay.contracts[" + i + "]";

            String address = normalizeAddress(prefix + ".address", settings.getAddress());
            if (!seenAddresses.add(address)) {
                throw new RelayConfigurationException(prefix + ".address", "Contract " + address + " is configured twice");
            }
            String name = settings.getName() == null || settings.getName().isBlank()
                ? address
                : settings.getName().trim();

            List<String> signatures = settings.getEvents() == null ? List.of() : settings.getEvents();
            if (signatures.isEmpty()) {
                throw new RelayConfigurationException(prefix + ".events", "Contract " + name + " has no events configured");
            }
            List<EventDescriptor> descriptors = new ArrayList<>();
            Set<String> topics = new HashSet<>();
            for (String signature : signatures) {
                EventDescriptor descriptor = EventSignatureParser.parse(signature);
                if (topics.add(descriptor.topic())) {
                    descriptors.add(descriptor);
                }
            }
            bindings.add(new ContractBinding(name, address, descriptors));
        }
        return List.copyOf(bindings);
    }

    private static String normalizeAddress(String property, String address) {
        if (address == null || !ADDRESS.matcher(address.trim()).matches()) {
            throw new RelayConfigurationException(property, "Invalid contract address: " + address);
        }
        String trimmed = address.trim();
        String body = trimmed.substring(2);
        boolean mixedCase = !body.equals(body.toLowerCase(Locale.ROOT)) && !body.equals(body.toUpperCase(Locale.ROOT));
        if (mixedCase && !Keys.toChecksumAddress(trimmed).equals(trimmed)) {
            throw new RelayConfigurationException(property, "Contract address fails checksum validation: " + address);
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }
}
