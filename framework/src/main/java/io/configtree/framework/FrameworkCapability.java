package io.configtree.framework;

import io.configtree.core.schema.Capabilities;

/**
 * Ids of the optional features that shape the framework bundle's defaults. Pass the available ones
 * to {@link FrameworkSchema#processor(Capabilities)}.
 */
public final class FrameworkCapability {

    /** The full-stack distribution is installed: most feature groups become opt-in. */
    public static final String FULL_STACK = "full-stack";

    /** SysV semaphores are supported: locks default to the semaphore store. */
    public static final String SEMAPHORE_STORE = "semaphore-store";

    public static final String MESSENGER = "messenger";
    public static final String HTTP_CLIENT = "http-client";
    public static final String MAILER = "mailer";
    public static final String NOTIFIER = "notifier";
    public static final String RATE_LIMITER = "rate-limiter";
    public static final String UID = "uid";

    /** A DBAL connection is available: the PDO cache provider defaults to it. */
    public static final String DOCTRINE_DBAL = "doctrine-dbal";

    private FrameworkCapability() {
        // constants
    }

    /** Every optional feature present, full-stack distribution absent. */
    public static Capabilities standalone() {
        return Capabilities.of(SEMAPHORE_STORE, MESSENGER, HTTP_CLIENT, MAILER, NOTIFIER, RATE_LIMITER, UID,
                DOCTRINE_DBAL);
    }
}
