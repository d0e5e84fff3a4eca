package io.configtree.core.schema;

/** How a later layer's value for a node combines with the value accumulated from earlier layers. */
public enum MergePolicy {
    /** The later value replaces the earlier one entirely. */
    REPLACE,
    /**
     * Lists: entries not already present are appended; an entry sharing the list's key attribute
     * with an earlier one replaces it in place. Maps: entries are replaced whole, by key.
     */
    APPEND_UNIQUE,
    /** Entries merge recursively by key; keys absent from the later layer are preserved. */
    MERGE_MAP,
    /**
     * Named resource lists: within one layer, repeated names accumulate into one list instead of
     * replacing each other. Across layers entries are replaced by key.
     */
    COLLECT
}
