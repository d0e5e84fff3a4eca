package io.configtree.core.error;

import java.util.List;

/** Thrown when a group contains a key its schema does not declare. */
public final class UnknownKeyError extends ConfigValidationException {

    private static final long serialVersionUID = 1L;

    private final String key;
    private final List<String> availableKeys;

    public UnknownKeyError(String path, String key, List<String> availableKeys) {
        super(
                "Unrecognized option \"" + key + "\" under \"" + path + "\". Available option"
                        + (availableKeys.size() == 1 ? " is " : "s are ") + quoteAll(availableKeys) + ".",
                path);
        this.key = key;
        this.availableKeys = List.copyOf(availableKeys);
    }

    /** The unrecognized key. */
    public String key() {
        return key;
    }

    /** Keys the group declares, in declaration order. */
    public List<String> availableKeys() {
        return availableKeys;
    }

    static String quoteAll(List<String> values) {
        StringBuilder sb = new StringBuilder();
        for (String value : values) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append('"').append(value).append('"');
        }
        return sb.toString();
    }
}
