package io.configtree.core.error;

/** Thrown when a scalar cannot be coerced to the node's declared scalar type. */
public final class InvalidTypeError extends ConfigValidationException {

    private static final long serialVersionUID = 1L;

    private final String expected;

    public InvalidTypeError(String path, String expected, String actual) {
        super(
                "Invalid type for path \"" + path + "\". Expected \"" + expected + "\", but got \"" + actual
                        + "\".",
                path);
        this.expected = expected;
    }

    /** Name of the declared scalar type. */
    public String expected() {
        return expected;
    }
}
