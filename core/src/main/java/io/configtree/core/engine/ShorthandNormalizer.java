package io.configtree.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.JsonNodeType;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.configtree.core.error.InvalidTypeError;
import io.configtree.core.error.InvalidValueError;
import io.configtree.core.error.ShapeError;
import io.configtree.core.error.UnknownKeyError;
import io.configtree.core.schema.MergePolicy;
import io.configtree.core.schema.NodeKind;
import io.configtree.core.schema.ScalarType;
import io.configtree.core.schema.SchemaNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Expands shorthand input into the canonical shape its schema node declares, and coerces and
 * validates scalars on the way. Works on one layer at a time and never mutates its input.
 *
 * <p>
 * Dispatch is on the value's {@link JsonNodeType} tag: a layer value is a scalar, an array or an
 * object, and each node kind states what each of those means.
 */
final class ShorthandNormalizer {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final Pattern INTEGER_LITERAL = Pattern.compile("[-+]?\\d{1,18}");

    /**
     * Normalizes {@code raw} against {@code node}.
     *
     * @param node schema of the value
     * @param raw  layer value, never Java {@code null}
     * @param path dotted path of the value, for error messages
     * @return the canonical value; a fresh tree
     */
    JsonNode normalize(SchemaNode node, JsonNode raw, String path) {
        return switch (node.kind()) {
            case SCALAR -> normalizeScalar(node, raw, path);
            case LIST -> normalizeList(node, raw, path);
            case MAP -> normalizeMap(node, raw, path);
            case GROUP -> normalizeGroup(node, raw, path);
            case VARIABLE -> raw.deepCopy();
        };
    }

    // --- Groups ---

    private ObjectNode normalizeGroup(SchemaNode node, JsonNode raw, String path) {
        ObjectNode expanded = expandGroupShorthand(node, raw, path);
        ObjectNode canonical = canonicalKeys(node, expanded, path);
        if (node.isToggle() && !canonical.has(SchemaNode.ENABLED)) {
            canonical.put(SchemaNode.ENABLED, true);
        }

        ObjectNode result = NODES.objectNode();
        for (SchemaNode child : node.children()) {
            JsonNode value = canonical.get(child.name());
            if (value != null) {
                result.set(child.name(), normalize(child, value, path + "." + child.name()));
            }
        }
        return result;
    }

    /** Turns every accepted input shape of a group into an object. */
    private ObjectNode expandGroupShorthand(SchemaNode node, JsonNode raw, String path) {
        JsonNodeType type = raw.getNodeType();
        if (type == JsonNodeType.NULL) {
            return NODES.objectNode();
        }
        if (type == JsonNodeType.BOOLEAN && node.isToggle()) {
            return NODES.objectNode().put(SchemaNode.ENABLED, raw.booleanValue());
        }
        if (type == JsonNodeType.OBJECT && node.singleKeyChild() != null && !hasDeclaredKey(node, raw)) {
            if (raw.size() != 1) {
                throw new ShapeError(
                        path,
                        "Invalid configuration for path \"" + path + "\": a map with a single \""
                                + node.singleKeyChild() + "\" as key and its \"" + node.singleValueChild()
                                + "\" as value was expected, " + raw + " given.");
            }
            Map.Entry<String, JsonNode> entry = raw.fields().next();
            ObjectNode expanded = NODES.objectNode().put(node.singleKeyChild(), entry.getKey());
            if (!entry.getValue().isNull()) {
                expanded.set(node.singleValueChild(), entry.getValue().deepCopy());
            }
            return expanded;
        }
        if (node.shorthandChild() != null) {
            ObjectNode expanded = expandShorthandChild(node, raw);
            if (expanded != null) {
                return expanded;
            }
        }
        if (type != JsonNodeType.OBJECT) {
            throw new ShapeError(path, "array", describe(raw));
        }
        return ((ObjectNode) raw).deepCopy();
    }

    /**
     * Routes a scalar, a list, or a map without declared keys to the shorthand child. An inline
     * {@code enabled} flag (a key of the map, or an {@code {enabled: bool}} item of the list) is
     * extracted first. Returns {@code null} when the input is a regular group object.
     */
    private ObjectNode expandShorthandChild(SchemaNode node, JsonNode raw) {
        ObjectNode expanded = NODES.objectNode();
        JsonNode rest;
        switch (raw.getNodeType()) {
            case OBJECT -> {
                if (hasDeclaredKey(node, raw)) {
                    return null;
                }
                ObjectNode copy = ((ObjectNode) raw).deepCopy();
                if (node.isToggle()) {
                    JsonNode flag = copy.remove(SchemaNode.ENABLED);
                    if (flag != null) {
                        expanded.set(SchemaNode.ENABLED, flag);
                    }
                }
                rest = copy;
            }
            case ARRAY -> {
                ArrayNode items = NODES.arrayNode();
                for (JsonNode item : raw) {
                    if (node.isToggle() && isEnabledFlag(item)) {
                        expanded.set(SchemaNode.ENABLED, item.get(SchemaNode.ENABLED));
                    } else {
                        items.add(item.deepCopy());
                    }
                }
                rest = items;
            }
            default -> rest = raw.deepCopy();
        }
        if (!rest.isContainerNode() || rest.size() > 0) {
            expanded.set(node.shorthandChild(), rest);
        }
        return expanded;
    }

    private static boolean isEnabledFlag(JsonNode item) {
        return item.isObject() && item.size() == 1 && item.has(SchemaNode.ENABLED) && item.get(SchemaNode.ENABLED)
                .isBoolean();
    }

    /** Whether any key of {@code raw} (other than the toggle flag) names a declared child or alias. */
    private static boolean hasDeclaredKey(SchemaNode node, JsonNode raw) {
        Iterator<String> names = raw.fieldNames();
        while (names.hasNext()) {
            String key = names.next();
            if (node.isToggle() && SchemaNode.ENABLED.equals(key)) {
                continue;
            }
            if (resolveKey(node, key) != null) {
                return true;
            }
        }
        return false;
    }

    /** Applies aliases and dash-to-underscore renaming, and rejects undeclared keys. */
    private ObjectNode canonicalKeys(SchemaNode node, ObjectNode raw, String path) {
        ObjectNode result = NODES.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = raw.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = resolveKey(node, field.getKey());
            if (key == null) {
                List<String> available = new ArrayList<>();
                node.children().forEach(child -> available.add(child.name()));
                throw new UnknownKeyError(path, field.getKey(), available);
            }
            JsonNode value = field.getValue();
            if (node.aliases().containsKey(field.getKey())) {
                if (raw.has(key)) {
                    // the plural form wins when both are given
                    continue;
                }
                if (!value.isArray()) {
                    value = NODES.arrayNode().add(value);
                }
            }
            result.set(key, value);
        }
        return result;
    }

    private static String resolveKey(SchemaNode node, String key) {
        if (node.child(key) != null) {
            return key;
        }
        String alias = node.aliases().get(key);
        if (alias != null) {
            return alias;
        }
        if (key.indexOf('-') >= 0) {
            String underscored = key.replace('-', '_');
            if (node.child(underscored) != null) {
                return underscored;
            }
        }
        return null;
    }

    // --- Lists ---

    private ArrayNode normalizeList(SchemaNode node, JsonNode raw, String path) {
        ArrayNode result = NODES.arrayNode();
        switch (raw.getNodeType()) {
            case NULL -> {
                return result;
            }
            case ARRAY -> {
                int index = 0;
                for (JsonNode item : raw) {
                    result.add(normalize(node.prototype(), item, path + "." + index++));
                }
            }
            default -> result.add(normalize(node.prototype(), raw, path + ".0"));
        }
        return result;
    }

    // --- Maps ---

    private ObjectNode normalizeMap(SchemaNode node, JsonNode raw, String path) {
        Map<String, JsonNode> entries = new LinkedHashMap<>();
        switch (raw.getNodeType()) {
            case NULL -> {
                // empty map
            }
            case OBJECT -> raw.fields().forEachRemaining(e -> entries.put(e.getKey(), e.getValue()));
            case ARRAY -> collectNamedEntries(node, raw, path, entries);
            default -> {
                if (node.defaultKey() == null) {
                    throw new ShapeError(path, "array", describe(raw));
                }
                entries.put(node.defaultKey(), raw);
            }
        }

        ObjectNode result = NODES.objectNode();
        entries.forEach((key, value) -> result.set(key, normalize(node.prototype(), value, path + "." + key)));
        return result;
    }

    /**
     * Reads the list form of a map. Items carrying the key attribute become named entries (their
     * {@code value} attribute, or the rest of the item); other items go to the default key. Under
     * {@link MergePolicy#COLLECT}, repeated names accumulate into one list. Unnamed items accumulate
     * too when entries are lists; otherwise only one unnamed item is accepted.
     */
    private void collectNamedEntries(SchemaNode node, JsonNode raw, String path, Map<String, JsonNode> entries) {
        String keyAttribute = node.keyAttribute() != null ? node.keyAttribute() : "name";
        boolean collect = node.mergePolicy() == MergePolicy.COLLECT;
        boolean listEntries = node.prototype().kind() == NodeKind.LIST;
        int index = 0;
        for (JsonNode item : raw) {
            String entryName;
            JsonNode value;
            boolean unnamed = false;
            if (item.isObject() && item.has(keyAttribute) && item.get(keyAttribute).isValueNode()) {
                entryName = item.get(keyAttribute).asText();
                ObjectNode rest = ((ObjectNode) item).deepCopy();
                rest.remove(keyAttribute);
                value = rest.size() == 1 && rest.has("value") ? rest.get("value") : rest;
            } else if (node.defaultKey() != null) {
                entryName = node.defaultKey();
                value = item;
                unnamed = true;
            } else {
                throw new ShapeError(
                        path + "." + index,
                        "Invalid configuration for path \"" + path + "." + index + "\": an entry with a \""
                                + keyAttribute + "\" attribute was expected, " + item + " given.");
            }
            if (collect || (unnamed && listEntries)) {
                ArrayNode bucket = bucket(entries, entryName);
                if (value.isArray()) {
                    value.forEach(v -> bucket.add(v.deepCopy()));
                } else {
                    bucket.add(value.deepCopy());
                }
            } else if (unnamed && entries.containsKey(entryName)) {
                throw new ShapeError(
                        path + "." + index,
                        "Invalid configuration for path \"" + path + "." + index + "\": only one unnamed entry is"
                                + " allowed, it goes to \"" + entryName + "\", " + item + " given.");
            } else {
                entries.put(entryName, value);
            }
            index++;
        }
    }

    private static ArrayNode bucket(Map<String, JsonNode> entries, String name) {
        JsonNode existing = entries.get(name);
        if (existing instanceof ArrayNode array) {
            return array;
        }
        ArrayNode bucket = NODES.arrayNode();
        if (existing != null) {
            bucket.add(existing);
        }
        entries.put(name, bucket);
        return bucket;
    }

    // --- Scalars ---

    private JsonNode normalizeScalar(SchemaNode node, JsonNode raw, String path) {
        if (raw.isContainerNode()) {
            throw new ShapeError(path, node.scalarType().displayName(), describe(raw));
        }
        JsonNode value = raw.isNull() ? NullNode.getInstance() : coerce(node.scalarType(), raw, path);
        if (node.scalarType() == ScalarType.ANY && value.isTextual() && !node.literalTypes().isEmpty()) {
            value = resolveLiteral(node, value);
        }

        if (node.allowedValues() != null && !value.isNull() && !node.allowedValues().contains(value)) {
            throw new InvalidValueError(
                    path,
                    "The value " + value + " is not allowed for path \"" + path + "\". Permissible values: "
                            + joinAllowed(node) + ".");
        }
        if (node.notEmpty() && (value.isNull() || (value.isTextual() && value.textValue().isEmpty()))) {
            throw new InvalidValueError(
                    path, "The path \"" + path + "\" cannot contain an empty value, but got " + value + ".");
        }
        if (value.isNumber()) {
            if (node.min() != null && value.asDouble() < node.min()) {
                throw new InvalidValueError(
                        path,
                        "The value " + value + " is too small for path \"" + path + "\". Should be greater than or "
                                + "equal to " + node.min() + ".");
            }
            if (node.max() != null && value.asDouble() > node.max()) {
                throw new InvalidValueError(
                        path,
                        "The value " + value + " is too big for path \"" + path + "\". Should be less than or "
                                + "equal to " + node.max() + ".");
            }
        }
        return value;
    }

    private static JsonNode coerce(ScalarType type, JsonNode raw, String path) {
        switch (type) {
            case ANY -> {
                return raw.deepCopy();
            }
            case STRING -> {
                if (raw.isTextual()) {
                    return raw.deepCopy();
                }
            }
            case BOOLEAN -> {
                if (raw.isBoolean()) {
                    return raw.deepCopy();
                }
                if (raw.isTextual()) {
                    String text = raw.textValue().trim();
                    if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
                        return BooleanNode.valueOf(Boolean.parseBoolean(text));
                    }
                }
            }
            case INTEGER -> {
                if (raw.isIntegralNumber()) {
                    return raw.canConvertToInt() ? IntNode.valueOf(raw.intValue()) : LongNode.valueOf(raw.longValue());
                }
                if (raw.isTextual()) {
                    try {
                        long parsed = Long.parseLong(raw.textValue().trim());
                        return parsed == (int) parsed ? IntNode.valueOf((int) parsed) : LongNode.valueOf(parsed);
                    } catch (NumberFormatException e) {
                        throw new InvalidTypeError(path, type.displayName(), "string \"" + raw.textValue() + "\"");
                    }
                }
            }
            case FLOAT -> {
                if (raw.isNumber()) {
                    return DoubleNode.valueOf(raw.doubleValue());
                }
                if (raw.isTextual()) {
                    try {
                        return DoubleNode.valueOf(Double.parseDouble(raw.textValue().trim()));
                    } catch (NumberFormatException e) {
                        throw new InvalidTypeError(path, type.displayName(), "string \"" + raw.textValue() + "\"");
                    }
                }
            }
        }
        throw new InvalidTypeError(path, type.displayName(), describe(raw));
    }

    /**
     * Reads text as the boolean or number it spells when the node accepts that type and, if it
     * restricts its values, the result is one of them. Otherwise the text is kept.
     */
    private static JsonNode resolveLiteral(SchemaNode node, JsonNode text) {
        String trimmed = text.textValue().trim();
        JsonNode literal = null;
        if (node.literalTypes().contains(JsonNodeType.BOOLEAN)
                && ("true".equalsIgnoreCase(trimmed) || "false".equalsIgnoreCase(trimmed))) {
            literal = BooleanNode.valueOf(Boolean.parseBoolean(trimmed));
        } else if (node.literalTypes().contains(JsonNodeType.NUMBER) && INTEGER_LITERAL.matcher(trimmed).matches()) {
            long parsed = Long.parseLong(trimmed);
            literal = parsed == (int) parsed ? IntNode.valueOf((int) parsed) : LongNode.valueOf(parsed);
        }
        if (literal == null || (node.allowedValues() != null && !node.allowedValues().contains(literal))) {
            return text;
        }
        return literal;
    }

    private static String joinAllowed(SchemaNode node) {
        StringBuilder sb = new StringBuilder();
        for (JsonNode allowed : node.allowedValues()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(allowed);
        }
        return sb.toString();
    }

    /** Short type name of a value, for error messages. */
    static String describe(JsonNode value) {
        return switch (value.getNodeType()) {
            case ARRAY, OBJECT -> "array";
            case BOOLEAN -> "bool";
            case NUMBER -> value.isIntegralNumber() ? "int" : "float";
            case STRING -> "string";
            case NULL, MISSING -> "null";
            default -> value.getNodeType().name().toLowerCase();
        };
    }
}
