package io.configtree.core.error;

/**
 * Abstract base for all config-tree exceptions. Never thrown directly; use the concrete
 * subclasses under {@link ConfigValidationException} (bad user input) or
 * {@link SchemaDefinitionException} (a broken schema, i.e. a programming error).
 */
public abstract class ConfigTreeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Distinguishes user-input failures from schema programming errors. */
    public enum Category {
        VALIDATION,
        DEFINITION
    }

    private final Category category;

    protected ConfigTreeException(String message, Category category) {
        super(message);
        this.category = category;
    }

    protected ConfigTreeException(String message, Throwable cause, Category category) {
        super(message, cause);
        this.category = category;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** Whether the failure stems from user input or from the schema itself. */
    public Category category() {
        return category;
    }
}
