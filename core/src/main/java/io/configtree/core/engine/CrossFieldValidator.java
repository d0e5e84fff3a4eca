package io.configtree.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.configtree.core.schema.SchemaNode;
import io.configtree.core.validation.Invariant;
import java.util.Iterator;
import java.util.Map;

/**
 * Runs group invariants over the merged, not yet defaulted tree. A group's invariants run in
 * declaration order before its children are visited; the first violation propagates.
 */
final class CrossFieldValidator {

    void validate(SchemaNode node, JsonNode value, String path) {
        if (value == null || value.isNull()) {
            return;
        }
        switch (node.kind()) {
            case GROUP -> {
                if (!value.isObject()) {
                    return;
                }
                for (Invariant invariant : node.invariants()) {
                    invariant.check((ObjectNode) value, path);
                }
                for (SchemaNode child : node.children()) {
                    validate(child, value.get(child.name()), path + "." + child.name());
                }
            }
            case MAP -> {
                Iterator<Map.Entry<String, JsonNode>> entries = value.fields();
                while (entries.hasNext()) {
                    Map.Entry<String, JsonNode> entry = entries.next();
                    validate(node.prototype(), entry.getValue(), path + "." + entry.getKey());
                }
            }
            case LIST -> {
                int index = 0;
                for (JsonNode item : value) {
                    validate(node.prototype(), item, path + "." + index++);
                }
            }
            default -> {
                // scalars carry no invariants
            }
        }
    }
}
