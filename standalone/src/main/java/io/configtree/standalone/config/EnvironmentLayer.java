package io.configtree.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds the highest-priority layer from environment variables.
 *
 * <p>
 * A variable named {@code PREFIX__SESSION__COOKIE_SECURE} sets {@code session.cookie_secure}:
 * segments are separated by a double underscore and lowercased. Values are taken as text; the
 * processor coerces them to the declared scalar type, or to the boolean or number a mixed scalar
 * accepts.
 *
 * <p>
 * A variable is "set" if and only if its trimmed value is non-empty. Empty or whitespace-only
 * values are ignored, so the file layers stand.
 */
public final class EnvironmentLayer {

    /** Separator between prefix and path segments. */
    public static final String SEPARATOR = "__";

    private EnvironmentLayer() {
        // utility class
    }

    /**
     * Builds the layer.
     *
     * @param environment variable names to values, e.g. {@link System#getenv()}
     * @param prefix      variable prefix without the trailing separator, e.g. {@code FRAMEWORK}
     * @return the overlay; an empty object when no variable is set
     * @throws LayerLoadException if two variables disagree on the shape of a key, or a name has an
     *                            empty segment
     */
    public static ObjectNode from(Map<String, String> environment, String prefix) {
        String head = prefix + SEPARATOR;
        ObjectNode layer = JsonNodeFactory.instance.objectNode();

        // sorted, so parents are seen before children and the conflict reported is stable
        Map<String, String> sorted = new TreeMap<>(environment);
        for (Map.Entry<String, String> variable : sorted.entrySet()) {
            String name = variable.getKey();
            if (!name.startsWith(head) || !isSet(variable.getValue())) {
                continue;
            }
            String[] segments = name.substring(head.length()).split(SEPARATOR, -1);
            ObjectNode parent = layer;
            for (int i = 0; i < segments.length; i++) {
                String key = segments[i].toLowerCase(Locale.ROOT);
                if (key.isEmpty()) {
                    throw new LayerLoadException("Environment variable " + name + " has an empty path segment");
                }
                JsonNode existing = parent.get(key);
                boolean last = i == segments.length - 1;
                if (last) {
                    if (existing != null) {
                        throw new LayerLoadException("Environment variable " + name
                                + " conflicts with another variable setting keys below it");
                    }
                    parent.put(key, variable.getValue().trim());
                } else if (existing == null) {
                    parent = parent.putObject(key);
                } else if (existing.isObject()) {
                    parent = (ObjectNode) existing;
                } else {
                    throw new LayerLoadException("Environment variable " + name
                            + " conflicts with a variable setting \"" + key + "\" to a value");
                }
            }
        }
        return layer;
    }

    private static boolean isSet(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
