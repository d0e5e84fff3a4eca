package io.configtree.core.error;

/**
 * Thrown when a schema itself is malformed (children on a scalar node, a default of the wrong
 * shape, an invariant referring to an undeclared field). This is a programming error in the
 * schema definition, never a problem with user input.
 */
public final class SchemaDefinitionException extends ConfigTreeException {

    private static final long serialVersionUID = 1L;

    public SchemaDefinitionException(String message) {
        super(message, Category.DEFINITION);
    }

    public SchemaDefinitionException(String message, Throwable cause) {
        super(message, cause, Category.DEFINITION);
    }
}
