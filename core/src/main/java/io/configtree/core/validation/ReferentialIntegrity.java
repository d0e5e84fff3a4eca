package io.configtree.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.configtree.core.error.UnresolvedReferenceError;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A selector field must name an entry of its sibling collection. Before defaults, only checked when
 * both are set; a selector given without a collection is checked again against the defaulted
 * collection in {@link #complete}.
 */
public final class ReferentialIntegrity implements Invariant {

    private final String selector;
    private final String collection;
    private final String noun;
    private final String pluralNoun;

    /**
     * @param selector   field holding the reference, e.g. {@code default_bus}
     * @param collection sibling map the reference must resolve in, e.g. {@code buses}
     * @param noun       how the selector is named in the message, e.g. {@code default bus}
     * @param pluralNoun how the entries are named in the message, e.g. {@code buses}
     */
    public ReferentialIntegrity(String selector, String collection, String noun, String pluralNoun) {
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.collection = Objects.requireNonNull(collection, "collection must not be null");
        this.noun = Objects.requireNonNull(noun, "noun must not be null");
        this.pluralNoun = Objects.requireNonNull(pluralNoun, "pluralNoun must not be null");
    }

    @Override
    public List<String> fields() {
        return List.of(selector, collection);
    }

    @Override
    public void check(ObjectNode group, String path) {
        JsonNode value = group.get(selector);
        JsonNode entries = group.get(collection);
        if (!Invariant.isSet(value) || !Invariant.isSet(entries) || !entries.isObject()) {
            return;
        }
        resolve(value, entries, path);
    }

    @Override
    public void complete(ObjectNode group, String path) {
        JsonNode value = group.get(selector);
        JsonNode entries = group.get(collection);
        if (!Invariant.isSet(value) || entries == null || !entries.isObject()) {
            return;
        }
        resolve(value, entries, path);
    }

    private void resolve(JsonNode value, JsonNode entries, String path) {
        String reference = value.asText();
        if (entries.has(reference)) {
            return;
        }
        List<String> available = new ArrayList<>();
        entries.fieldNames().forEachRemaining(available::add);
        Collections.sort(available);
        throw new UnresolvedReferenceError(path + "." + selector, selector, reference, available, noun, pluralNoun);
    }
}
