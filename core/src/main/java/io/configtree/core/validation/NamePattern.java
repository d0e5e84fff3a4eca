package io.configtree.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.configtree.core.error.PatternError;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A string field must match an allowed-character pattern in full. Null values pass.
 *
 * <p>
 * The message is a {@link String#format} template receiving the quoted value, e.g. {@code Session
 * name %s contains illegal character(s).}
 */
public final class NamePattern implements Invariant {

    private final String field;
    private final Pattern pattern;
    private final String message;

    public NamePattern(String field, Pattern pattern, String message) {
        this.field = Objects.requireNonNull(field, "field must not be null");
        this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public List<String> fields() {
        return List.of(field);
    }

    public Pattern pattern() {
        return pattern;
    }

    @Override
    public void check(ObjectNode group, String path) {
        JsonNode value = group.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return;
        }
        String text = value.asText();
        if (!pattern.matcher(text).matches()) {
            throw new PatternError(path + "." + field, field, text, String.format(message, "\"" + text + "\""));
        }
    }
}
