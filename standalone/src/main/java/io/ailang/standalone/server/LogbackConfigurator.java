package io.ailang.standalone.server;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import io.ailang.core.engine.TaskEngine;
import io.ailang.core.engine.TreeExecutor;
import io.ailang.standalone.config.ServerConfig;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code logging} section of {@link ServerConfig} to Logback when the server starts.
 *
 * <p>{@code logging.level} drives the {@code io.ailang} loggers. Third-party loggers never go
 * below INFO, and the logger that prints {@code log} actions never goes above INFO, so task log
 * lines survive a quiet level. Every line carries the {@value TaskEngine#MDC_TASK_ID} MDC entry:
 * as a pattern field in text mode and inside the {@code mdc} object in JSON mode.
 */
public final class LogbackConfigurator {

    static final String APPENDER_NAME = "AILANG_CONSOLE";
    static final String APP_LOGGER = "io.ailang";
    static final String TEXT_PATTERN =
            "%d{HH:mm:ss.SSS} %-5level [%X{" + TaskEngine.MDC_TASK_ID + ":--}] %logger{36} - %msg%n";

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Replaces the root appender according to {@code config}. Unknown levels fall back to INFO.
     */
    public static void configure(ServerConfig config) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Level level = Level.toLevel(config.loggingLevel(), Level.INFO);

        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);
        rootLogger.detachAndStopAllAppenders();
        rootLogger.setLevel(level.isGreaterOrEqual(Level.INFO) ? level : Level.INFO);

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setEncoder(encoder(context, config.loggingFormat()));
        appender.start();
        rootLogger.addAppender(appender);

        context.getLogger(APP_LOGGER).setLevel(level);
        context.getLogger(TreeExecutor.class).setLevel(level.isGreaterOrEqual(Level.INFO) ? Level.INFO : level);
        context.getLogger("org.eclipse.jetty").setLevel(Level.WARN);
    }

    static Encoder<ILoggingEvent> encoder(LoggerContext context, String format) {
        if ("json".equals(format)) {
            JsonEncoder json = new JsonEncoder();
            json.setContext(context);
            json.start();
            return json;
        }
        PatternLayoutEncoder text = new PatternLayoutEncoder();
        text.setContext(context);
        text.setPattern(TEXT_PATTERN);
        text.start();
        return text;
    }
}
