package io.configtree.standalone;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the command-line processor.
 *
 * <p>
 * Delegates to {@link ConfigTreeApp#run} and exits with its status code.
 */
public final class ConfigTreeMain {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigTreeMain.class);

    private ConfigTreeMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code --config config/framework.yaml})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int status;
        try {
            status = ConfigTreeApp.run(args, System.out, System.getenv());
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            status = ConfigTreeApp.EXIT_FAILURE;
        }
        System.exit(status);
    }
}
