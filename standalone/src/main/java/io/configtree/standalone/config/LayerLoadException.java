package io.configtree.standalone.config;

/**
 * Thrown when a configuration layer cannot be read: missing file, malformed YAML, or conflicting
 * environment variables. The message is suitable for command-line error output.
 */
public class LayerLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public LayerLoadException(String message) {
        super(message);
    }

    public LayerLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
