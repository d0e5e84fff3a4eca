package io.configtree.core.error;

import java.util.List;

/**
 * Thrown when a selector names an entry that its sibling collection does not contain. Available
 * keys are reported in ascending order so the message is reproducible.
 */
public final class UnresolvedReferenceError extends ConfigValidationException {

    private static final long serialVersionUID = 1L;

    private final String selector;
    private final String value;
    private final List<String> availableKeys;

    public UnresolvedReferenceError(
            String path, String selector, String value, List<String> availableKeys, String noun, String pluralNoun) {
        super(
                "The specified " + noun + " \"" + value + "\" is not configured. Available " + pluralNoun + " are "
                        + UnknownKeyError.quoteAll(availableKeys) + ".",
                path);
        this.selector = selector;
        this.value = value;
        this.availableKeys = List.copyOf(availableKeys);
    }

    public String selector() {
        return selector;
    }

    /** The unresolved selector value. */
    public String value() {
        return value;
    }

    /** Keys present in the collection, sorted ascending. */
    public List<String> availableKeys() {
        return availableKeys;
    }
}
