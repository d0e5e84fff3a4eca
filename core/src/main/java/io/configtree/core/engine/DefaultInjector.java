package io.configtree.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.configtree.core.error.RequiredValueError;
import io.configtree.core.error.SchemaDefinitionException;
import io.configtree.core.schema.Capabilities;
import io.configtree.core.schema.NodeKind;
import io.configtree.core.schema.SchemaNode;
import io.configtree.core.validation.Invariant;
import java.util.ArrayList;
import java.util.List;

/**
 * Fills every key still unset after merging with its node's default, then lets group invariants
 * complete inferable values.
 *
 * <p>
 * Defaulting is lazy inside a disabled toggle group: children declaring no default are left out
 * and required children are not enforced. Children with a declared default, explicit {@code null}
 * included, are always present.
 */
final class DefaultInjector {

    private final Capabilities capabilities;

    DefaultInjector(Capabilities capabilities) {
        this.capabilities = capabilities;
    }

    /**
     * Returns the defaulted value of {@code node}.
     *
     * @param value merged value, or {@code null} when no layer set the node; modified in place
     */
    JsonNode inject(SchemaNode node, JsonNode value, String path) {
        return switch (node.kind()) {
            case GROUP -> injectGroup(node, value, path);
            case MAP -> injectMap(node, value != null ? value : resolveDefault(node, path), path);
            case LIST -> injectList(node, value != null ? value : resolveDefault(node, path), path);
            case SCALAR, VARIABLE -> value != null ? value : resolveDefault(node, path);
        };
    }

    private ObjectNode injectGroup(SchemaNode node, JsonNode value, String path) {
        if (value != null && !value.isObject()) {
            throw new SchemaDefinitionException("default of group \"" + path + "\" is not an object: " + value);
        }
        ObjectNode group = value != null ? (ObjectNode) value : JsonNodeFactory.instance.objectNode();

        boolean disabled = false;
        if (node.isToggle()) {
            SchemaNode flag = node.child(SchemaNode.ENABLED);
            JsonNode enabled = group.get(SchemaNode.ENABLED);
            if (enabled == null || enabled.isNull()) {
                enabled = resolveDefault(flag, path + "." + SchemaNode.ENABLED);
                group.set(SchemaNode.ENABLED, enabled);
            }
            disabled = !enabled.asBoolean();
        }

        for (SchemaNode child : node.children()) {
            JsonNode current = group.get(child.name());
            if (current == null && isLeaf(child) && child.defaultValue() == null) {
                if (disabled) {
                    continue;
                }
                if (child.required()) {
                    throw new RequiredValueError(path, child.name());
                }
                group.set(child.name(), NullNode.getInstance());
                continue;
            }
            group.set(child.name(), inject(child, current, path + "." + child.name()));
        }

        for (Invariant invariant : node.invariants()) {
            invariant.complete(group, path);
        }
        return group;
    }

    private JsonNode injectMap(SchemaNode node, JsonNode value, String path) {
        if (!value.isObject()) {
            throw new SchemaDefinitionException("value of map \"" + path + "\" is not an object: " + value);
        }
        ObjectNode entries = (ObjectNode) value;
        List<String> names = new ArrayList<>();
        entries.fieldNames().forEachRemaining(names::add);
        for (String name : names) {
            entries.set(name, inject(node.prototype(), entries.get(name), path + "." + name));
        }
        return entries;
    }

    private JsonNode injectList(SchemaNode node, JsonNode value, String path) {
        if (!value.isArray()) {
            throw new SchemaDefinitionException("value of list \"" + path + "\" is not a list: " + value);
        }
        ArrayNode items = (ArrayNode) value;
        for (int i = 0; i < items.size(); i++) {
            items.set(i, inject(node.prototype(), items.get(i), path + "." + i));
        }
        return items;
    }

    private JsonNode resolveDefault(SchemaNode node, String path) {
        if (node.defaultValue() == null) {
            return NullNode.getInstance();
        }
        JsonNode resolved = node.defaultValue().resolve(capabilities);
        if (resolved == null) {
            throw new SchemaDefinitionException("default of \"" + path + "\" resolved to Java null");
        }
        return resolved;
    }

    private static boolean isLeaf(SchemaNode node) {
        return node.kind() == NodeKind.SCALAR || node.kind() == NodeKind.VARIABLE;
    }
}
