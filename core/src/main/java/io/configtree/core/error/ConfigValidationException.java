package io.configtree.core.error;

/**
 * Abstract parent for user-input validation failures. Carries the dotted {@code path} of the
 * offending key (e.g. {@code framework.session.name}). Configuration errors are not transient:
 * processing aborts on the first one and no partial document is returned.
 */
public abstract class ConfigValidationException extends ConfigTreeException {

    private static final long serialVersionUID = 1L;

    private final String path;

    protected ConfigValidationException(String message, String path) {
        super(message, Category.VALIDATION);
        this.path = path;
    }

    /** Dotted path of the offending key. */
    public String path() {
        return path;
    }
}
