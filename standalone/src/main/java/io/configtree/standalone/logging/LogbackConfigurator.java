package io.configtree.standalone.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code --log-format} and {@code --log-level} options to Logback.
 *
 * <p>
 * One console appender on standard error replaces whatever {@code logback.xml} installed, so the
 * processed document printed on standard output stays parseable. The requested level applies to
 * the {@value #APPLICATION_LOGGER} loggers (loading, processing, CLI); everything else stays at
 * {@code WARN}. JSON mode uses Logback's built-in {@link JsonEncoder}.
 */
public final class LogbackConfigurator {

    /** Parent of every logger in this project. */
    public static final String APPLICATION_LOGGER = "io.configtree";

    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";

    static final String APPENDER_NAME = "STDERR";

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Reconfigures logging for one CLI run.
     *
     * @param format {@code json} for one JSON object per event, anything else for text
     * @param level  level of the application loggers; unknown names mean {@code INFO}
     * @return the level applied to the application loggers
     */
    public static Level configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.detachAndStopAllAppenders();
        root.setLevel(Level.WARN);

        Level applied = Level.toLevel(level, Level.INFO);
        context.getLogger(APPLICATION_LOGGER).setLevel(applied);

        ConsoleAppender<ILoggingEvent> stderr = new ConsoleAppender<>();
        stderr.setContext(context);
        stderr.setName(APPENDER_NAME);
        stderr.setTarget("System.err");
        stderr.setEncoder("json".equalsIgnoreCase(format) ? jsonEncoder(context) : textEncoder(context));
        stderr.start();
        root.addAppender(stderr);
        return applied;
    }

    private static Encoder<ILoggingEvent> jsonEncoder(LoggerContext context) {
        JsonEncoder json = new JsonEncoder();
        json.setContext(context);
        json.start();
        return json;
    }

    private static Encoder<ILoggingEvent> textEncoder(LoggerContext context) {
        PatternLayoutEncoder text = new PatternLayoutEncoder();
        text.setContext(context);
        text.setPattern(TEXT_PATTERN);
        text.start();
        return text;
    }
}
