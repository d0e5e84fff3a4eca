package io.configtree.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.configtree.core.error.MissingSelectorError;
import java.util.List;
import java.util.Objects;

/**
 * When a named collection holds more than one entry, the selector field choosing among them must
 * be set. With exactly one entry and no selector, {@link #complete} points the selector at that
 * entry.
 */
public final class ConditionalRequirement implements Invariant {

    private final String selector;
    private final String collection;
    private final String entryNoun;

    /**
     * @param selector   field naming the chosen entry, e.g. {@code default_bus}
     * @param collection sibling map of named entries, e.g. {@code buses}
     * @param entryNoun  singular noun for one entry, used in the error message
     */
    public ConditionalRequirement(String selector, String collection, String entryNoun) {
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.collection = Objects.requireNonNull(collection, "collection must not be null");
        this.entryNoun = Objects.requireNonNull(entryNoun, "entryNoun must not be null");
    }

    @Override
    public List<String> fields() {
        return List.of(selector, collection);
    }

    @Override
    public void check(ObjectNode group, String path) {
        JsonNode entries = group.get(collection);
        if (entries != null && entries.isObject() && entries.size() > 1 && !Invariant.isSet(group.get(selector))) {
            throw new MissingSelectorError(path, selector, entryNoun);
        }
    }

    @Override
    public void complete(ObjectNode group, String path) {
        JsonNode entries = group.get(collection);
        if (entries != null && entries.isObject() && entries.size() == 1 && !Invariant.isSet(group.get(selector))) {
            group.set(selector, TextNode.valueOf(entries.fieldNames().next()));
        }
    }
}
