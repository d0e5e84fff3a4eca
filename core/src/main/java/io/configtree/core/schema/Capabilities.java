package io.configtree.core.schema;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * The explicit set of optional features available to a processor. Capability-dependent defaults
 * (see {@link DefaultValue#when}) are resolved against this set only; nothing is detected from the
 * runtime environment. Immutable, thread-safe.
 */
public final class Capabilities {

    private static final Capabilities NONE = new Capabilities(Set.of());

    private final Set<String> available;

    private Capabilities(Set<String> available) {
        this.available = available;
    }

    /** A set with no optional feature available. */
    public static Capabilities none() {
        return NONE;
    }

    /** A set where exactly the given feature ids are available. */
    public static Capabilities of(String... ids) {
        return of(Arrays.asList(ids));
    }

    /** A set where exactly the given feature ids are available. */
    public static Capabilities of(Collection<String> ids) {
        Objects.requireNonNull(ids, "ids must not be null");
        TreeSet<String> sorted = new TreeSet<>();
        for (String id : ids) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("capability id must not be null or blank");
            }
            sorted.add(id);
        }
        return new Capabilities(Collections.unmodifiableSet(sorted));
    }

    /** Returns {@code true} if the feature is available. */
    public boolean has(String id) {
        return available.contains(id);
    }

    /** Returns a copy of this set with one more feature available. */
    public Capabilities with(String id) {
        TreeSet<String> copy = new TreeSet<>(available);
        copy.add(id);
        return of(copy);
    }

    /** Returns a copy of this set with the feature unavailable. */
    public Capabilities without(String id) {
        TreeSet<String> copy = new TreeSet<>(available);
        copy.remove(id);
        return of(copy);
    }

    /** Available feature ids, sorted. */
    public Set<String> available() {
        return available;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Capabilities that)) return false;
        return available.equals(that.available);
    }

    @Override
    public int hashCode() {
        return available.hashCode();
    }

    @Override
    public String toString() {
        return "Capabilities" + available;
    }
}
