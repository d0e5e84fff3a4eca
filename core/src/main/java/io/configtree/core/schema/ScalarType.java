package io.configtree.core.schema;

/** Declared type of a {@link NodeKind#SCALAR} node. */
public enum ScalarType {
    ANY("scalar"),
    STRING("string"),
    BOOLEAN("bool"),
    INTEGER("int"),
    FLOAT("float");

    private final String displayName;

    ScalarType(String displayName) {
        this.displayName = displayName;
    }

    /** Name used in error messages. */
    public String displayName() {
        return displayName;
    }
}
