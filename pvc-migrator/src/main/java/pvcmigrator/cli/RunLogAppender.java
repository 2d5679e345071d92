package pvcmigrator.cli;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Tees every log event of a run into its master log file.
 */
final class RunLogAppender implements AutoCloseable {

    static final String APPENDER_NAME = "RUN";
    static final String PATTERN = "[%d{yyyy-MM-dd HH:mm:ss}] %-5level %logger{20} - %msg%n";

    private final Logger root;
    private final FileAppender<ILoggingEvent> appender;

    private RunLogAppender(Logger root, FileAppender<ILoggingEvent> appender) {
        this.root = root;
        this.appender = appender;
    }

    /**
     * Attaches a file appender for {@code logFile} to the root logger.
     *
     * @return the handle to detach it, or null when the SLF4J backend is not Logback
     */
    static RunLogAppender attach(Path logFile) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext)) {
            LoggerFactory.getLogger(RunLogAppender.class)
                    .warn("Logging backend is not Logback; run log {} not written", logFile);
            return null;
        }
        LoggerContext context = (LoggerContext) factory;

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(PATTERN);
        encoder.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setFile(logFile.toString());
        appender.setAppend(true);
        appender.setEncoder(encoder);
        appender.start();

        Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        root.addAppender(appender);
        return new RunLogAppender(root, appender);
    }

    @Override
    public void close() {
        root.detachAppender(appender);
        appender.stop();
    }
}
