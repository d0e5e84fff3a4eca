package io.configtree.standalone;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.configtree.core.engine.ConfigProcessor;
import io.configtree.core.error.ConfigValidationException;
import io.configtree.core.schema.Capabilities;
import io.configtree.framework.FrameworkSchema;
import io.configtree.standalone.config.EnvironmentLayer;
import io.configtree.standalone.config.LayerLoadException;
import io.configtree.standalone.config.LayerLoader;
import io.configtree.standalone.logging.LogbackConfigurator;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line processing of the framework configuration: loads the layer files, adds the
 * environment overlay on top, processes them and prints the normalized document.
 *
 * <p>
 * Startup sequence:
 * <ol>
 * <li>Parse options</li>
 * <li>Configure logging</li>
 * <li>Load file layers, then the environment layer</li>
 * <li>Process against {@link FrameworkSchema} with the requested capabilities</li>
 * <li>Print the result</li>
 * </ol>
 */
public final class ConfigTreeApp {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigTreeApp.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_INVALID = 2;

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private ConfigTreeApp() {
        // utility class
    }

    /**
     * Runs the processor.
     *
     * @param args        command-line arguments
     * @param out         receives the processed document, or the usage text
     * @param environment environment variables for the overlay layer
     * @return {@link #EXIT_OK}, {@link #EXIT_INVALID} when the configuration is rejected, or
     *         {@link #EXIT_FAILURE} on any other error
     */
    public static int run(String[] args, PrintStream out, Map<String, String> environment) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            LOG.error("Invalid arguments: {}", e.getMessage());
            out.print(CliOptions.USAGE);
            return EXIT_FAILURE;
        }
        if (options.help()) {
            out.print(CliOptions.USAGE);
            return EXIT_OK;
        }

        Level level = LogbackConfigurator.configure(options.logFormat(), options.logLevel());
        LOG.debug("Logging configured: format={}, level={}", options.logFormat(), level);

        try {
            List<JsonNode> layers = new ArrayList<>(LayerLoader.load(options.configPaths(), FrameworkSchema.ROOT));
            ObjectNode overlay = EnvironmentLayer.from(environment, options.envPrefix());
            if (!overlay.isEmpty()) {
                LOG.info("Applying environment overlay: prefix={}, keys={}", options.envPrefix(), overlay.size());
                layers.add(overlay);
            }

            ConfigProcessor processor = FrameworkSchema.processor(Capabilities.of(options.capabilities()));
            ObjectNode result = processor.process(layers);
            out.print(render(result, options.format()));
            out.flush();
            LOG.info("Configuration processed: layers={}, capabilities={}", layers.size(), options.capabilities());
            return EXIT_OK;
        } catch (ConfigValidationException e) {
            LOG.error("Invalid configuration at {}: {}", e.path(), e.getMessage());
            return EXIT_INVALID;
        } catch (LayerLoadException e) {
            LOG.error("Failed to load configuration: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        } catch (JsonProcessingException e) {
            LOG.error("Failed to write processed configuration: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            LOG.error("Processing failed: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    static String render(JsonNode document, String format) throws JsonProcessingException {
        if ("json".equals(format)) {
            return JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(document) + System.lineSeparator();
        }
        return YAML_MAPPER.writeValueAsString(document);
    }
}
