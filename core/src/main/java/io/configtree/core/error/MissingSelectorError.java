package io.configtree.core.error;

/** Thrown when a collection holds several entries but the selector choosing one of them is unset. */
public final class MissingSelectorError extends ConfigValidationException {

    private static final long serialVersionUID = 1L;

    private final String selector;
    private final String scope;

    public MissingSelectorError(String scope, String selector, String entryNoun) {
        super(
                "You must specify the \"" + selector + "\" if you define more than one " + entryNoun + ".",
                scope + "." + selector);
        this.selector = selector;
        this.scope = scope;
    }

    public String selector() {
        return selector;
    }

    /** Path of the group holding the selector and its collection. */
    public String scope() {
        return scope;
    }
}
