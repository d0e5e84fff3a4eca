package io.configtree.core.error;

/** Thrown when a value has the wrong container shape (e.g. a list where a scalar is expected). */
public final class ShapeError extends ConfigValidationException {

    private static final long serialVersionUID = 1L;

    private final String expected;
    private final String actual;

    public ShapeError(String path, String expected, String actual) {
        super(
                "Invalid type for path \"" + path + "\". Expected \"" + expected + "\", but got \"" + actual
                        + "\".",
                path);
        this.expected = expected;
        this.actual = actual;
    }

    public ShapeError(String path, String message) {
        super(message, path);
        this.expected = null;
        this.actual = null;
    }

    /** Expected shape name, or {@code null} for free-form shape errors. */
    public String expected() {
        return expected;
    }

    /** Shape actually found, or {@code null} for free-form shape errors. */
    public String actual() {
        return actual;
    }
}
