package io.configtree.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.configtree.core.error.ConfigValidationException;
import io.configtree.core.error.SchemaDefinitionException;
import io.configtree.core.error.ShapeError;
import io.configtree.core.schema.Capabilities;
import io.configtree.core.schema.NodeKind;
import io.configtree.core.schema.SchemaNode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: turns an ordered list of partial configuration documents into one normalized,
 * fully defaulted document.
 *
 * <p>
 * Steps, strictly in this order:
 * <ol>
 * <li>expand shorthand and coerce scalars, per layer ({@link ShorthandNormalizer});</li>
 * <li>fold the layers, later ones taking priority ({@link LayerMerger});</li>
 * <li>check cross-field invariants on the merged tree, before any default exists
 * ({@link CrossFieldValidator});</li>
 * <li>inject defaults and complete inferable selectors ({@link DefaultInjector}).</li>
 * </ol>
 * The first validation error aborts processing; no partial document is returned.
 *
 * <p>
 * Thread-safe: the schema and capability set are immutable and every call works on fresh copies
 * of its input, so one processor can serve concurrent callers.
 */
public final class ConfigProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigProcessor.class);

    private final SchemaNode root;
    private final Capabilities capabilities;
    private final ShorthandNormalizer normalizer = new ShorthandNormalizer();
    private final LayerMerger merger = new LayerMerger();
    private final CrossFieldValidator validator = new CrossFieldValidator();
    private final DefaultInjector injector;

    /**
     * Creates a processor for the given schema.
     *
     * @param root         root group of the schema; its name prefixes every error path
     * @param capabilities optional features available when resolving defaults
     * @throws SchemaDefinitionException if the root is not a group
     */
    public ConfigProcessor(SchemaNode root, Capabilities capabilities) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.capabilities = Objects.requireNonNull(capabilities, "capabilities must not be null");
        if (root.kind() != NodeKind.GROUP) {
            throw new SchemaDefinitionException("schema root must be a group, but \"" + root.name() + "\" is "
                    + root.kind());
        }
        this.injector = new DefaultInjector(capabilities);
    }

    /** Convenience overload of {@link #process(List)}. */
    public ObjectNode process(JsonNode... layers) {
        return process(Arrays.asList(layers));
    }

    /**
     * Processes the layers.
     *
     * @param layers partial documents, lowest priority first; {@code null} or JSON {@code null}
     *               entries count as empty layers
     * @return the normalized document, a fresh tree owned by the caller
     * @throws ConfigValidationException on the first invalid value or violated invariant
     */
    public ObjectNode process(List<? extends JsonNode> layers) {
        Objects.requireNonNull(layers, "layers must not be null");
        LOG.debug("Processing configuration: root={}, layers={}, capabilities={}", root.name(), layers.size(),
                capabilities.available());

        try {
            List<ObjectNode> normalized = new ArrayList<>(layers.size());
            for (JsonNode layer : layers) {
                normalized.add(normalizeLayer(layer));
            }
            ObjectNode merged = merger.fold(root, normalized);
            validator.validate(root, merged, root.name());
            ObjectNode result = (ObjectNode) injector.inject(root, merged, root.name());
            LOG.debug("Configuration processed: root={}, keys={}", root.name(), result.size());
            return result;
        } catch (ConfigValidationException e) {
            LOG.debug("Configuration rejected: path={}, reason={}", e.path(), e.getMessage());
            throw e;
        }
    }

    private ObjectNode normalizeLayer(JsonNode layer) {
        if (layer == null || layer.isNull() || layer.isMissingNode()) {
            return JsonNodeFactory.instance.objectNode();
        }
        if (!layer.isObject()) {
            throw new ShapeError(root.name(), "array", ShorthandNormalizer.describe(layer));
        }
        return (ObjectNode) normalizer.normalize(root, layer, root.name());
    }

    /** The root group this processor applies. */
    public SchemaNode schema() {
        return root;
    }

    /** The capability set defaults are resolved against. */
    public Capabilities capabilities() {
        return capabilities;
    }
}
