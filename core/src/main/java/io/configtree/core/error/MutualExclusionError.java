package io.configtree.core.error;

/**
 * Thrown when two sibling fields declared mutually exclusive are both set. The {@code scope} names
 * the enclosing group so the same rule reads differently at top level ({@code "assets"}) and in a
 * nested entry ({@code "assets" packages}).
 */
public final class MutualExclusionError extends ConfigValidationException {

    private static final long serialVersionUID = 1L;

    private final String fieldA;
    private final String fieldB;
    private final String scope;

    public MutualExclusionError(String path, String fieldA, String fieldB, String scope) {
        super(
                "You cannot use both \"" + fieldA + "\" and \"" + fieldB + "\" at the same time under " + scope
                        + ".",
                path);
        this.fieldA = fieldA;
        this.fieldB = fieldB;
        this.scope = scope;
    }

    public String fieldA() {
        return fieldA;
    }

    public String fieldB() {
        return fieldB;
    }

    public String scope() {
        return scope;
    }
}
