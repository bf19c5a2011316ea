package org.janelia.registration.util;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;

import static org.slf4j.Logger.ROOT_LOGGER_NAME;

/**
 * Tests the {@link LogbackTools} class.
 *
 * @author Eric Trautman
 */
public class LogbackToolsTest {

    private File testDirectory;

    @Before
    public void setup() throws Exception {
        testDirectory = TestDirectories.createTestDirectory("test_logback_tools");
    }

    @After
    public void tearDown() {
        final LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        final ch.qos.logback.classic.Logger rootLogger = loggerContext.getLogger(ROOT_LOGGER_NAME);
        final Appender<ILoggingEvent> fileAppender = rootLogger.getAppender(LogbackTools.ROOT_FILE_APPENDER_NAME);
        if (fileAppender != null) {
            fileAppender.stop();
            rootLogger.detachAppender(fileAppender);
        }
        FileUtil.deleteRecursive(testDirectory);
    }

    @Test
    public void testSetRootFileAppenderWithTimestamp() throws Exception {

        final File logFile = LogbackTools.setRootFileAppenderWithTimestamp(testDirectory, "registration");

        Assert.assertTrue("invalid log file name " + logFile.getName(),
                          logFile.getName().matches("registration\\.\\d{8}_\\d{6}\\.log"));

        LOG.info("testSetRootFileAppenderWithTimestamp: message for log file");

        Assert.assertTrue("log file " + logFile + " should exist", logFile.exists());
        final String content = new String(Files.readAllBytes(logFile.toPath()), StandardCharsets.UTF_8);
        Assert.assertTrue("log file should contain message", content.contains("message for log file"));
    }

    private static final Logger LOG = LoggerFactory.getLogger(LogbackToolsTest.class);
}
