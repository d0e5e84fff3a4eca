package io.configtree.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads configuration layers from YAML files. JSON files are read too, JSON being a subset of
 * YAML.
 *
 * <p>
 * Each file is one layer; the returned list keeps the order of the paths, so later files take
 * priority when the layers are processed. An empty document is an empty layer. A document whose
 * only key is the root name (e.g. {@code framework:}) is unwrapped, so files can be written either
 * way.
 */
public final class LayerLoader {

    private static final Logger LOG = LoggerFactory.getLogger(LayerLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private LayerLoader() {
        // utility class
    }

    /**
     * Loads every file as one layer.
     *
     * @param paths   layer files, lowest priority first
     * @param rootKey name of the schema root, unwrapped when it is a document's only key
     * @return the parsed layers, in order
     * @throws LayerLoadException if a file is missing or is not valid YAML
     */
    public static List<JsonNode> load(List<Path> paths, String rootKey) {
        List<JsonNode> layers = new ArrayList<>(paths.size());
        for (Path path : paths) {
            layers.add(load(path, rootKey));
        }
        return layers;
    }

    /**
     * Loads a single layer file.
     *
     * @throws LayerLoadException if the file is missing or is not valid YAML
     */
    public static JsonNode load(Path path, String rootKey) {
        if (!Files.exists(path)) {
            throw new LayerLoadException(
                    "Configuration file not found: " + path + ". Use --config <path> to specify a config file.");
        }

        JsonNode document;
        try (InputStream in = Files.newInputStream(path)) {
            document = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new LayerLoadException("Failed to parse YAML configuration: " + path, e);
        }

        if (document == null || document.isMissingNode() || document.isNull()) {
            LOG.info("Loaded empty configuration layer: {}", path);
            return JsonNodeFactory.instance.objectNode();
        }
        if (document.isObject() && document.size() == 1 && document.has(rootKey)) {
            document = document.get(rootKey);
        }
        LOG.info("Loaded configuration layer: {} (keys={})", path, document.size());
        return document;
    }
}
