package io.configtree.core.error;

/** Thrown when a well-typed scalar is rejected: not an allowed value, out of bounds, or empty. */
public final class InvalidValueError extends ConfigValidationException {

    private static final long serialVersionUID = 1L;

    public InvalidValueError(String path, String message) {
        super(message, path);
    }
}
