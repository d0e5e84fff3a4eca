package io.configtree.core.validation;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.configtree.core.error.MutualExclusionError;
import java.util.List;
import java.util.Objects;

/**
 * At most one of the named sibling fields may be set. Pairs are examined in declaration order and
 * the first conflicting pair is reported.
 */
public final class MutualExclusion implements Invariant {

    private final List<String> fields;
    private final String scope;

    /**
     * @param scope  how the enclosing group is named in the error message, e.g. {@code "assets"}
     *               or {@code "assets" packages}
     * @param fields two or more mutually exclusive sibling fields
     */
    public MutualExclusion(String scope, String... fields) {
        this.scope = Objects.requireNonNull(scope, "scope must not be null");
        this.fields = List.of(fields);
        if (this.fields.size() < 2) {
            throw new IllegalArgumentException("mutual exclusion needs at least two fields");
        }
    }

    @Override
    public List<String> fields() {
        return fields;
    }

    public String scope() {
        return scope;
    }

    @Override
    public void check(ObjectNode group, String path) {
        for (int i = 0; i < fields.size(); i++) {
            if (!Invariant.isSet(group.get(fields.get(i)))) {
                continue;
            }
            for (int j = i + 1; j < fields.size(); j++) {
                if (Invariant.isSet(group.get(fields.get(j)))) {
                    throw new MutualExclusionError(path, fields.get(i), fields.get(j), scope);
                }
            }
        }
    }
}
