package io.configtree.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * A constraint spanning several sibling fields of one group. Checked against the merged tree before
 * defaults are injected, so only values supplied by the user are seen.
 *
 * <p>
 * Implementations must be immutable: one schema, and so one invariant instance, is shared by every
 * processing call.
 */
public interface Invariant {

    /** Names of the sibling fields this invariant reads. Each must be a declared child of the group. */
    List<String> fields();

    /**
     * Checks the invariant.
     *
     * @param group the merged, not yet defaulted group value
     * @param path  dotted path of the group
     * @throws io.configtree.core.error.ConfigValidationException if the invariant is violated
     */
    void check(ObjectNode group, String path);

    /**
     * Fills in values the invariant can infer once defaults are in place, and re-checks what only
     * defaults can break. Called on the fully defaulted group after {@link #check} passed. No-op by
     * default.
     *
     * @param group the defaulted group value, modified in place
     * @param path  dotted path of the group
     * @throws io.configtree.core.error.ConfigValidationException if the defaulted group violates the
     *                                                            invariant
     */
    default void complete(ObjectNode group, String path) {}

    /** A field counts as set when it is present, not null, and not an empty list or map. */
    static boolean isSet(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return false;
        }
        return !value.isContainerNode() || value.size() > 0;
    }
}
