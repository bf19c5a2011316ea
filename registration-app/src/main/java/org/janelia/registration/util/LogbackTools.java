package org.janelia.registration.util;

import java.io.File;
import java.text.SimpleDateFormat;
import java.util.Date;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;

import static org.slf4j.Logger.ROOT_LOGGER_NAME;

/**
 * Tools for manipulating logback loggers and appenders from code.
 *
 * @author Eric Trautman
 */
public class LogbackTools {

    /**
     * Adds a file appender with a timestamped name (e.g. registration.20241019_101500.log)
     * to the root logger so that every run of a client keeps its own log.
     *
     * @return the log file.
     */
    public static File setRootFileAppenderWithTimestamp(final File logDirectory,
                                                        final String logFileNamePrefix) {
        FileUtil.ensureWritableDirectory(logDirectory);
        final SimpleDateFormat sdf = new SimpleDateFormat("yyyyMMdd_HHmmss");
        final String logFileName = logFileNamePrefix + "." + sdf.format(new Date()) + ".log";
        final File logFile = new File(logDirectory, logFileName);
        setRootFileAppender(logFile);
        return logFile;
    }

    public static void setRootFileAppender(final File logFile) {
        final LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        final Logger rootLogger = loggerContext.getLogger(ROOT_LOGGER_NAME);

        // detach previous file appender if it already exists
        if (rootLogger.getAppender(ROOT_FILE_APPENDER_NAME) != null) {
            rootLogger.detachAppender(ROOT_FILE_APPENDER_NAME);
        }

        final PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(loggerContext);
        encoder.setPattern(FILE_PATTERN);
        encoder.start();

        final FileAppender<ILoggingEvent> fileAppender = new FileAppender<>();
        fileAppender.setName(ROOT_FILE_APPENDER_NAME);
        fileAppender.setFile(logFile.getAbsolutePath());
        fileAppender.setAppend(true);
        fileAppender.setEncoder(encoder);
        fileAppender.setContext(loggerContext);
        fileAppender.start();
        rootLogger.addAppender(fileAppender);
    }

    public static final String ROOT_FILE_APPENDER_NAME = "rootFileAppender";

    private static final String FILE_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";
}
