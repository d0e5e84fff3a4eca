package io.configtree.standalone;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line options of the processor.
 *
 * @param configPaths  layer files, lowest priority first ({@code --config}, repeatable)
 * @param capabilities available optional features ({@code --capability}, repeatable)
 * @param format       output format, {@code yaml} or {@code json}
 * @param logFormat    log output, {@code text} or {@code json}
 * @param logLevel     level of the application loggers
 * @param envPrefix    prefix of overlay environment variables
 * @param help         whether usage was requested
 */
public record CliOptions(
        List<Path> configPaths,
        Set<String> capabilities,
        String format,
        String logFormat,
        String logLevel,
        String envPrefix,
        boolean help) {

    static final String USAGE = """
            Usage: config-tree [options]
              --config <path>      configuration layer file, repeatable; later files win
              --capability <id>    available optional feature, repeatable
              --format yaml|json   output format (default: yaml)
              --log-format text|json
                                   log output (default: text)
              --log-level <level>  TRACE, DEBUG, INFO, WARN or ERROR (default: INFO)
              --env-prefix <name>  prefix of overlay environment variables (default: FRAMEWORK)
              --help               print this message
            """;

    public static final String DEFAULT_ENV_PREFIX = "FRAMEWORK";

    public CliOptions {
        configPaths = List.copyOf(configPaths);
        capabilities = Collections.unmodifiableSet(new LinkedHashSet<>(capabilities));
    }

    /**
     * Parses the arguments.
     *
     * @throws IllegalArgumentException on an unknown option, a missing value, or an unsupported
     *                                  format
     */
    public static CliOptions parse(String[] args) {
        List<Path> configPaths = new ArrayList<>();
        Set<String> capabilities = new LinkedHashSet<>();
        String format = "yaml";
        String logFormat = "text";
        String logLevel = "INFO";
        String envPrefix = DEFAULT_ENV_PREFIX;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--config" -> configPaths.add(Path.of(value(args, ++i, arg)));
                case "--capability" -> capabilities.add(value(args, ++i, arg));
                case "--format" -> format = oneOf(value(args, ++i, arg), arg, "yaml", "json");
                case "--log-format" -> logFormat = oneOf(value(args, ++i, arg), arg, "text", "json");
                case "--log-level" -> logLevel = value(args, ++i, arg);
                case "--env-prefix" -> envPrefix = value(args, ++i, arg);
                case "--help", "-h" -> help = true;
                default -> throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }
        return new CliOptions(configPaths, capabilities, format, logFormat, logLevel, envPrefix, help);
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args[index];
    }

    private static String oneOf(String value, String option, String... allowed) {
        String normalized = value.toLowerCase(Locale.ROOT);
        for (String candidate : allowed) {
            if (candidate.equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException(
                option + " must be one of " + String.join(", ", allowed) + ", but got " + value);
    }
}
