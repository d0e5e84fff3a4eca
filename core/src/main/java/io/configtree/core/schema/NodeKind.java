package io.configtree.core.schema;

/** Shape of a configuration key. Determines which normalization and merge rules apply. */
public enum NodeKind {
    /** A single scalar value (string, number, boolean or null). */
    SCALAR,
    /** An ordered list of values described by one element prototype. */
    LIST,
    /** Named entries chosen by the user, each described by one entry prototype. */
    MAP,
    /** A fixed set of declared children. */
    GROUP,
    /** Any value, taken verbatim. */
    VARIABLE
}
