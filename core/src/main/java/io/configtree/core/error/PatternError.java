package io.configtree.core.error;

/** Thrown when a string field contains characters its name pattern does not allow. */
public final class PatternError extends ConfigValidationException {

    private static final long serialVersionUID = 1L;

    private final String field;
    private final String value;

    public PatternError(String path, String field, String value, String detail) {
        super("Invalid configuration for path \"" + path + "\": " + detail, path);
        this.field = field;
        this.value = value;
    }

    public String field() {
        return field;
    }

    /** The rejected value. */
    public String value() {
        return value;
    }
}
