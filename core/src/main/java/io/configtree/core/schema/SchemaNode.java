package io.configtree.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeType;
import io.configtree.core.error.SchemaDefinitionException;
import io.configtree.core.validation.Invariant;
import io.configtree.core.validation.NamePattern;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Declarative description of one configuration key: its kind, default, validation rules, shorthand
 * forms and children. Immutable and thread-safe once built; a schema is defined once and shared by
 * every processing call.
 *
 * <p>
 * Nodes are created through the static factories and {@link Builder}. Shape rules are checked when
 * the builder runs: children only on {@link NodeKind#GROUP}, a prototype on {@link NodeKind#LIST}
 * and {@link NodeKind#MAP}, scalar rules only on {@link NodeKind#SCALAR}. A violation is a
 * {@link SchemaDefinitionException}.
 */
public final class SchemaNode {

    /** Name of the flag child added to toggle groups. */
    public static final String ENABLED = "enabled";

    private final String name;
    private final NodeKind kind;
    private final ScalarType scalarType;
    private final DefaultValue defaultValue;
    private final boolean required;
    private final boolean notEmpty;
    private final Set<JsonNode> allowedValues;
    private final Pattern pattern;
    private final Long min;
    private final Long max;
    private final List<SchemaNode> children;
    private final Map<String, SchemaNode> childIndex;
    private final SchemaNode prototype;
    private final MergePolicy mergePolicy;
    private final boolean toggle;
    private final String shorthandChild;
    private final Map<String, String> aliases;
    private final String singleKeyChild;
    private final String singleValueChild;
    private final String defaultKey;
    private final String keyAttribute;
    private final List<Invariant> invariants;
    private final Set<JsonNodeType> literalTypes;

    private SchemaNode(Builder b, List<SchemaNode> children, SchemaNode prototype, List<Invariant> invariants) {
        this.name = b.name;
        this.kind = b.kind;
        this.scalarType = b.scalarType;
        this.defaultValue = b.defaultValue;
        this.required = b.required;
        this.notEmpty = b.notEmpty;
        this.allowedValues = b.allowedValues != null ? Collections.unmodifiableSet(b.allowedValues) : null;
        this.pattern = b.pattern;
        this.min = b.min;
        this.max = b.max;
        this.children = Collections.unmodifiableList(children);
        Map<String, SchemaNode> index = new LinkedHashMap<>();
        children.forEach(child -> index.put(child.name(), child));
        this.childIndex = Collections.unmodifiableMap(index);
        this.prototype = prototype;
        this.mergePolicy = b.mergePolicy != null ? b.mergePolicy : defaultPolicy(b.kind);
        this.toggle = b.enabledDefault != null;
        this.shorthandChild = b.shorthandChild;
        this.aliases = Collections.unmodifiableMap(new LinkedHashMap<>(b.aliases));
        this.singleKeyChild = b.singleKeyChild;
        this.singleValueChild = b.singleValueChild;
        this.defaultKey = b.defaultKey;
        this.keyAttribute = b.keyAttribute;
        this.invariants = Collections.unmodifiableList(invariants);
        this.literalTypes = b.literalTypes.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(b.literalTypes));
    }

    // --- Factories ---

    /** A scalar accepting any scalar value. */
    public static Builder scalar(String name) {
        return new Builder(name, NodeKind.SCALAR).type(ScalarType.ANY);
    }

    /** A scalar accepting strings only. */
    public static Builder string(String name) {
        return new Builder(name, NodeKind.SCALAR).type(ScalarType.STRING);
    }

    /** A boolean scalar; textual {@code "true"}/{@code "false"} are coerced. */
    public static Builder bool(String name) {
        return new Builder(name, NodeKind.SCALAR).type(ScalarType.BOOLEAN);
    }

    /** An integer scalar; textual integers are coerced. */
    public static Builder integer(String name) {
        return new Builder(name, NodeKind.SCALAR).type(ScalarType.INTEGER);
    }

    /** A floating-point scalar; integers and textual numbers are coerced. */
    public static Builder number(String name) {
        return new Builder(name, NodeKind.SCALAR).type(ScalarType.FLOAT);
    }

    /** A node accepting any value verbatim. */
    public static Builder variable(String name) {
        return new Builder(name, NodeKind.VARIABLE);
    }

    /** A list whose elements are described by {@code element}. Defaults to an empty list. */
    public static Builder list(String name, Builder element) {
        Builder b = new Builder(name, NodeKind.LIST);
        b.prototype = Objects.requireNonNull(element, "element must not be null");
        return b;
    }

    /** A map of user-named entries, each described by {@code entry}. Defaults to an empty map. */
    public static Builder map(String name, Builder entry) {
        Builder b = new Builder(name, NodeKind.MAP);
        b.prototype = Objects.requireNonNull(entry, "entry must not be null");
        return b;
    }

    /** A group of declared children. */
    public static Builder group(String name) {
        return new Builder(name, NodeKind.GROUP);
    }

    private static MergePolicy defaultPolicy(NodeKind kind) {
        return switch (kind) {
            case SCALAR, VARIABLE -> MergePolicy.REPLACE;
            case LIST -> MergePolicy.APPEND_UNIQUE;
            case MAP, GROUP -> MergePolicy.MERGE_MAP;
        };
    }

    // --- Accessors ---

    public String name() {
        return name;
    }

    public NodeKind kind() {
        return kind;
    }

    /** Declared scalar type, or {@code null} for non-scalar nodes. */
    public ScalarType scalarType() {
        return scalarType;
    }

    /** The node's default, or {@code null} when it declares none. */
    public DefaultValue defaultValue() {
        return defaultValue;
    }

    public boolean required() {
        return required;
    }

    public boolean notEmpty() {
        return notEmpty;
    }

    /** Allowed values, or {@code null} when any value of the scalar type is accepted. */
    public Set<JsonNode> allowedValues() {
        return allowedValues;
    }

    /** Allowed-character pattern, or {@code null}. */
    public Pattern pattern() {
        return pattern;
    }

    public Long min() {
        return min;
    }

    public Long max() {
        return max;
    }

    /** Declared children of a group, in declaration order. Empty for other kinds. */
    public List<SchemaNode> children() {
        return children;
    }

    /** Looks up a declared child by name, or {@code null}. */
    public SchemaNode child(String childName) {
        return childIndex.get(childName);
    }

    /** Element node of a list or entry node of a map, {@code null} for other kinds. */
    public SchemaNode prototype() {
        return prototype;
    }

    public MergePolicy mergePolicy() {
        return mergePolicy;
    }

    /** Returns {@code true} if this group carries an {@value #ENABLED} flag. */
    public boolean isToggle() {
        return toggle;
    }

    /** Child receiving scalar, list or undeclared-key map input, or {@code null}. */
    public String shorthandChild() {
        return shorthandChild;
    }

    /** Singular key → declared plural child (e.g. {@code resource} → {@code resources}). */
    public Map<String, String> aliases() {
        return aliases;
    }

    /** Child receiving the key of a single-entry map, or {@code null}. */
    public String singleKeyChild() {
        return singleKeyChild;
    }

    /** Child receiving the value of a single-entry map, or {@code null}. */
    public String singleValueChild() {
        return singleValueChild;
    }

    /** Map entry receiving unnamed shorthand values, or {@code null}. */
    public String defaultKey() {
        return defaultKey;
    }

    /** Attribute naming an entry in list form, or {@code null}. */
    public String keyAttribute() {
        return keyAttribute;
    }

    /** Cross-field invariants of a group, in the order they are checked. */
    public List<Invariant> invariants() {
        return invariants;
    }

    /**
     * Value types a text value of an {@link ScalarType#ANY} scalar may stand for, taken from its
     * constant default and its allowed values. Lets {@code "true"} from an environment variable mean
     * {@code true} where the node accepts booleans.
     */
    public Set<JsonNodeType> literalTypes() {
        return literalTypes;
    }

    @Override
    public String toString() {
        return "SchemaNode[" + name + ", " + kind + "]";
    }

    /** Fluent builder for {@link SchemaNode}. Not thread-safe; build once at startup. */
    public static final class Builder {

        private final String name;
        private final NodeKind kind;
        private ScalarType scalarType;
        private DefaultValue defaultValue;
        private boolean required;
        private boolean notEmpty;
        private Set<JsonNode> allowedValues;
        private Pattern pattern;
        private String patternMessage;
        private Long min;
        private Long max;
        private final List<Builder> children = new ArrayList<>();
        private Builder prototype;
        private MergePolicy mergePolicy;
        private DefaultValue enabledDefault;
        private String shorthandChild;
        private final Map<String, String> aliases = new LinkedHashMap<>();
        private String singleKeyChild;
        private String singleValueChild;
        private String defaultKey;
        private String keyAttribute;
        private final List<Invariant> invariants = new ArrayList<>();
        private final Set<JsonNodeType> literalTypes = new HashSet<>();

        private Builder(String name, NodeKind kind) {
            if (name == null || name.isEmpty()) {
                throw new SchemaDefinitionException("schema node name must not be null or empty");
            }
            this.name = name;
            this.kind = kind;
        }

        private Builder type(ScalarType type) {
            this.scalarType = type;
            return this;
        }

        public Builder defaultValue(Object value) {
            if (value instanceof DefaultValue dv) {
                this.defaultValue = dv;
                return this;
            }
            this.defaultValue = DefaultValue.of(value);
            if (value instanceof Boolean || value instanceof Number) {
                literalTypes.add(DefaultValue.Values.toNode(value).getNodeType());
            }
            return this;
        }

        public Builder defaultValue(DefaultValue value) {
            this.defaultValue = Objects.requireNonNull(value, "default must not be null");
            return this;
        }

        /** Declares an explicit {@code null} default, kept even inside disabled groups. */
        public Builder defaultNull() {
            this.defaultValue = DefaultValue.NULL;
            return this;
        }

        public Builder required() {
            this.required = true;
            return this;
        }

        public Builder notEmpty() {
            requireKind("notEmpty", NodeKind.SCALAR);
            this.notEmpty = true;
            return this;
        }

        public Builder allowedValues(Object... values) {
            requireKind("allowedValues", NodeKind.SCALAR);
            Set<JsonNode> set = new LinkedHashSet<>();
            for (Object value : values) {
                JsonNode node = DefaultValue.Values.toNode(value);
                set.add(node);
                if (node.isBoolean() || node.isNumber()) {
                    literalTypes.add(node.getNodeType());
                }
            }
            this.allowedValues = set;
            return this;
        }

        /**
         * Restricts a scalar to values matching {@code regex} in full. The enclosing group checks it
         * as a {@link NamePattern} invariant.
         *
         * @param message {@link String#format} template receiving the quoted rejected value
         */
        public Builder pattern(String regex, String message) {
            requireKind("pattern", NodeKind.SCALAR);
            this.pattern = Pattern.compile(regex);
            this.patternMessage = Objects.requireNonNull(message, "message must not be null");
            return this;
        }

        public Builder min(long value) {
            requireKind("min", NodeKind.SCALAR);
            this.min = value;
            return this;
        }

        public Builder max(long value) {
            requireKind("max", NodeKind.SCALAR);
            this.max = value;
            return this;
        }

        public Builder children(Builder... nodes) {
            requireKind("children", NodeKind.GROUP);
            children.addAll(Arrays.asList(nodes));
            return this;
        }

        public Builder mergePolicy(MergePolicy policy) {
            this.mergePolicy = Objects.requireNonNull(policy, "policy must not be null");
            return this;
        }

        /** Shortcut for {@code mergePolicy(MergePolicy.REPLACE)}. */
        public Builder noDeepMerging() {
            return mergePolicy(MergePolicy.REPLACE);
        }

        /**
         * Makes this group switchable through an {@value #ENABLED} flag. A group appearing in a layer
         * without the flag is enabled; a group absent from every layer takes {@code enabledByDefault}.
         */
        public Builder toggle(DefaultValue enabledByDefault) {
            requireKind("toggle", NodeKind.GROUP);
            this.enabledDefault = Objects.requireNonNull(enabledByDefault, "enabledByDefault must not be null");
            return this;
        }

        public Builder toggle(boolean enabledByDefault) {
            return toggle(DefaultValue.of(enabledByDefault));
        }

        /** Routes scalar, list and undeclared-key map input to the named child. */
        public Builder shorthand(String child) {
            requireKind("shorthand", NodeKind.GROUP);
            this.shorthandChild = child;
            return this;
        }

        /** Accepts {@code singular} as an alias of the declared child {@code plural}. */
        public Builder alias(String singular, String plural) {
            requireKind("alias", NodeKind.GROUP);
            aliases.put(singular, plural);
            return this;
        }

        /** Expands {@code {key: value}} into {@code {keyChild: key, valueChild: value}}. */
        public Builder singleKeyShorthand(String keyChild, String valueChild) {
            requireKind("singleKeyShorthand", NodeKind.GROUP);
            this.singleKeyChild = keyChild;
            this.singleValueChild = valueChild;
            return this;
        }

        /** Entry receiving unnamed values given in scalar or list form. */
        public Builder defaultKey(String key) {
            requireKind("defaultKey", NodeKind.MAP);
            this.defaultKey = key;
            return this;
        }

        /** Attribute naming entries in list form (maps) or identifying entries (lists). */
        public Builder keyAttribute(String attribute) {
            if (kind != NodeKind.MAP && kind != NodeKind.LIST) {
                throw new SchemaDefinitionException("keyAttribute is only valid on map and list nodes: " + name);
            }
            this.keyAttribute = attribute;
            return this;
        }

        public Builder invariant(Invariant invariant) {
            requireKind("invariant", NodeKind.GROUP);
            invariants.add(Objects.requireNonNull(invariant, "invariant must not be null"));
            return this;
        }

        /**
         * Builds the node and all of its descendants.
         *
         * @throws SchemaDefinitionException if the definition is inconsistent
         */
        public SchemaNode build() {
            List<SchemaNode> builtChildren = new ArrayList<>();
            if (enabledDefault != null) {
                builtChildren.add(bool(ENABLED).defaultValue(enabledDefault).build());
            }
            for (Builder child : children) {
                builtChildren.add(child.build());
            }
            Set<String> names = new LinkedHashSet<>();
            for (SchemaNode child : builtChildren) {
                if (!names.add(child.name())) {
                    throw new SchemaDefinitionException("duplicate child \"" + child.name() + "\" under " + name);
                }
            }

            SchemaNode builtPrototype = null;
            if (kind == NodeKind.LIST || kind == NodeKind.MAP) {
                builtPrototype = prototype.build();
                if (prototype.pattern != null) {
                    throw new SchemaDefinitionException("pattern of \"" + prototype.name + "\" is only checked on group"
                            + " children, but it is the prototype of " + kind + " node " + name);
                }
                if (defaultValue == null) {
                    defaultValue = kind == NodeKind.LIST ? DefaultValue.of(List.of()) : DefaultValue.of(Map.of());
                }
            }

            checkReference("shorthand", shorthandChild, names);
            checkReference("singleKeyShorthand", singleKeyChild, names);
            checkReference("singleKeyShorthand", singleValueChild, names);
            aliases.values().forEach(target -> checkReference("alias", target, names));
            checkPolicy(builtPrototype);

            List<Invariant> allInvariants = new ArrayList<>();
            for (Builder child : children) {
                if (child.pattern != null) {
                    allInvariants.add(new NamePattern(child.name, child.pattern, child.patternMessage));
                }
            }
            allInvariants.addAll(invariants);
            for (Invariant invariant : allInvariants) {
                for (String field : invariant.fields()) {
                    checkReference(invariant.getClass().getSimpleName(), field, names);
                }
            }

            return new SchemaNode(this, builtChildren, builtPrototype, allInvariants);
        }

        private void checkPolicy(SchemaNode builtPrototype) {
            if (mergePolicy == null || mergePolicy == MergePolicy.REPLACE) {
                return;
            }
            boolean valid = switch (mergePolicy) {
                case APPEND_UNIQUE -> kind == NodeKind.LIST || kind == NodeKind.MAP;
                case MERGE_MAP -> kind == NodeKind.MAP || kind == NodeKind.GROUP;
                case COLLECT -> kind == NodeKind.MAP && builtPrototype.kind() == NodeKind.LIST;
                case REPLACE -> true;
            };
            if (!valid) {
                throw new SchemaDefinitionException(
                        "merge policy " + mergePolicy + " is not applicable to " + kind + " node " + name);
            }
        }

        private void checkReference(String feature, String child, Set<String> declared) {
            if (child != null && !declared.contains(child)) {
                throw new SchemaDefinitionException(
                        feature + " of \"" + name + "\" refers to undeclared child \"" + child + "\"");
            }
        }

        private void requireKind(String feature, NodeKind expected) {
            if (kind != expected) {
                throw new SchemaDefinitionException(
                        feature + " is only valid on " + expected + " nodes, but \"" + name + "\" is " + kind);
            }
        }
    }
}
