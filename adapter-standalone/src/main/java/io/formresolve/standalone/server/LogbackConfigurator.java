package io.formresolve.standalone.server;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.EncoderBase;
import java.util.Map;
import org.slf4j.LoggerFactory;

/**
 * Reconfigures the Logback root logger from {@code logging.format} and {@code logging.level}.
 *
 * <p>
 * {@code json} uses Logback's {@link JsonEncoder}, which also writes the key-value pairs of the
 * engine's {@code compile.*} entries. Anything else uses {@link #TEXT_PATTERN}.
 */
public final class LogbackConfigurator {

    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg %kvp%n";

    /** Server internals stay quiet regardless of the root level. */
    private static final Map<String, Level> FIXED_LEVELS =
            Map.of("org.eclipse.jetty", Level.WARN, "io.javalin", Level.INFO);

    private LogbackConfigurator() {}

    /**
     * @param format {@code json} or {@code text}
     * @param level  root level name; unknown names fall back to INFO
     */
    public static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.detachAndStopAllAppenders();
        root.setLevel(Level.toLevel(level, Level.INFO));

        EncoderBase<ILoggingEvent> encoder = isJson(format) ? new JsonEncoder() : textEncoder();
        encoder.setContext(context);
        encoder.start();

        ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
        console.setName("STDOUT");
        console.setContext(context);
        console.setEncoder(encoder);
        console.start();
        root.addAppender(console);

        FIXED_LEVELS.forEach((name, fixed) -> context.getLogger(name).setLevel(fixed));
    }

    static boolean isJson(String format) {
        return format != null && format.trim().equalsIgnoreCase("json");
    }

    private static PatternLayoutEncoder textEncoder() {
        PatternLayoutEncoder text = new PatternLayoutEncoder();
        text.setPattern(TEXT_PATTERN);
        return text;
    }
}
