package io.configtree.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.function.Predicate;

/**
 * Default of a schema node, as a pure function of the processor's {@link Capabilities}. Every
 * call returns a fresh tree so callers may mutate the result.
 */
@FunctionalInterface
public interface DefaultValue {

    /** Explicit {@code null} default. Distinct from a node declaring no default at all. */
    DefaultValue NULL = capabilities -> NullNode.getInstance();

    /**
     * Resolves the default for the given capability set.
     *
     * @param capabilities available optional features
     * @return the default value, never Java {@code null}
     */
    JsonNode resolve(Capabilities capabilities);

    /** A constant default. Lists, maps and boxed scalars are converted with Jackson. */
    static DefaultValue of(Object value) {
        JsonNode node = Values.toNode(value);
        return capabilities -> node.deepCopy();
    }

    /** {@code ifAvailable} when the capability is present, {@code otherwise} when it is not. */
    static DefaultValue when(String capability, Object ifAvailable, Object otherwise) {
        JsonNode yes = Values.toNode(ifAvailable);
        JsonNode no = Values.toNode(otherwise);
        return capabilities -> (capabilities.has(capability) ? yes : no).deepCopy();
    }

    /** A boolean default computed from the capability set. */
    static DefaultValue flag(Predicate<Capabilities> predicate) {
        return capabilities -> BooleanNode.valueOf(predicate.test(capabilities));
    }

    /** Conversion of plain Java values to Jackson trees. */
    final class Values {

        private static final ObjectMapper MAPPER = new ObjectMapper();

        private Values() {
            // utility class
        }

        static JsonNode toNode(Object value) {
            if (value == null) {
                return NullNode.getInstance();
            }
            if (value instanceof JsonNode node) {
                return node.deepCopy();
            }
            return MAPPER.valueToTree(value);
        }
    }
}
