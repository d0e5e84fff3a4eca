package io.configtree.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.configtree.core.schema.MergePolicy;
import io.configtree.core.schema.NodeKind;
import io.configtree.core.schema.SchemaNode;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Folds normalized layers into one tree. Later layers take priority; how a later value combines
 * with the accumulated one is decided per node by its {@link MergePolicy}.
 */
final class LayerMerger {

    /**
     * Folds the layers in order.
     *
     * @param root   root group of the schema
     * @param layers normalized layers, lowest priority first
     * @return the merged tree; an empty object when there are no layers
     */
    ObjectNode fold(SchemaNode root, List<ObjectNode> layers) {
        JsonNode merged = null;
        for (ObjectNode layer : layers) {
            merged = merge(root, merged, layer);
        }
        return merged != null ? (ObjectNode) merged : JsonNodeFactory.instance.objectNode();
    }

    /**
     * Merges {@code later} over {@code earlier}. Neither argument is modified.
     *
     * @param earlier accumulated value, or {@code null} when no earlier layer set the node
     */
    JsonNode merge(SchemaNode node, JsonNode earlier, JsonNode later) {
        if (earlier == null || earlier.isNull() || later.isNull()) {
            return later.deepCopy();
        }
        return switch (node.mergePolicy()) {
            case REPLACE -> later.deepCopy();
            case APPEND_UNIQUE -> node.kind() == NodeKind.LIST
                    ? appendUnique(node, earlier, later)
                    : replaceEntries(earlier, later);
            case COLLECT -> replaceEntries(earlier, later);
            case MERGE_MAP -> mergeEntries(node, earlier, later);
        };
    }

    private JsonNode mergeEntries(SchemaNode node, JsonNode earlier, JsonNode later) {
        if (!earlier.isObject() || !later.isObject()) {
            return later.deepCopy();
        }
        ObjectNode result = ((ObjectNode) earlier).deepCopy();
        Iterator<Map.Entry<String, JsonNode>> fields = later.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            SchemaNode child = node.kind() == NodeKind.MAP ? node.prototype() : node.child(field.getKey());
            if (child == null) {
                result.set(field.getKey(), field.getValue().deepCopy());
            } else {
                result.set(field.getKey(), merge(child, earlier.get(field.getKey()), field.getValue()));
            }
        }
        return result;
    }

    private static JsonNode replaceEntries(JsonNode earlier, JsonNode later) {
        if (!earlier.isObject() || !later.isObject()) {
            return later.deepCopy();
        }
        ObjectNode result = ((ObjectNode) earlier).deepCopy();
        later.fields().forEachRemaining(e -> result.set(e.getKey(), e.getValue().deepCopy()));
        return result;
    }

    private static JsonNode appendUnique(SchemaNode node, JsonNode earlier, JsonNode later) {
        if (!earlier.isArray() || !later.isArray()) {
            return later.deepCopy();
        }
        ArrayNode result = ((ArrayNode) earlier).deepCopy();
        for (JsonNode item : later) {
            int existing = indexOf(node.keyAttribute(), result, item);
            if (existing < 0) {
                result.add(item.deepCopy());
            } else {
                result.set(existing, item.deepCopy());
            }
        }
        return result;
    }

    /** Position of the entry {@code item} collapses into, or -1. */
    private static int indexOf(String keyAttribute, ArrayNode items, JsonNode item) {
        JsonNode key = keyAttribute != null ? item.get(keyAttribute) : null;
        for (int i = 0; i < items.size(); i++) {
            JsonNode candidate = items.get(i);
            if (key != null ? key.equals(candidate.get(keyAttribute)) : item.equals(candidate)) {
                return i;
            }
        }
        return -1;
    }
}
