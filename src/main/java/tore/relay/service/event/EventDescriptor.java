package tore.relay.service.event;

import java.util.List;
import org.web3j.abi.EventEncoder;
import org.web3j.abi.TypeReference;

/**
 * Typed description of one contract event: its name, its parameters in declaration order and
 * the topic0 hash used to build filters.
 */
public record EventDescriptor(String name, List<Parameter> parameters, String topic) {

    public EventDescriptor {
        parameters = List.copyOf(parameters);
    }

    public static EventDescriptor of(String name, List<Parameter> parameters) {
        EventDescriptor unhashed = new EventDescriptor(name, parameters, null);
        return new EventDescriptor(name, parameters, EventEncoder.buildEventSignature(unhashed.signature()));
    }

    /**
     * Canonical signature such as {@code NftLocked(address,uint256,address)}; tuples are written
     * as {@code (uint256,address)}.
     */
    public String signature() {
        return name + "(" + String.join(",", parameters.stream().map(Parameter::type).toList()) + ")";
    }

    /**
     * @param name          argument name, {@code arg<index>} when the signature leaves it out
     * @param type          canonical solidity type
     * @param indexed       whether the argument is carried in a topic
     * @param typeReference web3j reference for {@code type}, null for tuples
     * @param components    tuple members in declaration order, empty for every other type
     */
    public record Parameter(String name, String type, boolean indexed, TypeReference<?> typeReference, List<Parameter> components) {

        public Parameter {
            components = components == null ? List.of() : List.copyOf(components);
        }

        public Parameter(String name, String type, boolean indexed, TypeReference<?> typeReference) {
            this(name, type, indexed, typeReference, List.of());
        }

        public boolean isTuple() {
            return !components.isEmpty();
        }
    }
}
