package com.linbit.lzc.logging;

import com.linbit.lzc.Errno;
import com.linbit.lzc.LzcException;
import com.linbit.lzc.errors.ZfsErrorException;
import com.linbit.lzc.errors.ZfsErrorKind;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class Slf4jErrorReporterTest
{
    private static final String MODULE = "reportertest";

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;

    @Before
    public void setUp()
    {
        logger = (Logger) LoggerFactory.getLogger(Slf4jErrorReporter.LOGGER_PREFIX + "/" + MODULE);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @After
    public void tearDown()
    {
        logger.detachAppender(appender);
        logger.setLevel(null);
    }

    @Test
    public void testLogLevelFromConstructor()
    {
        ErrorReporter errorReporter = new Slf4jErrorReporter(MODULE, null, "debug");

        assertEquals(Level.DEBUG, errorReporter.getCurrentLogLevel());
        assertTrue(errorReporter.hasAtLeastLogLevel(Level.DEBUG));
        assertFalse(errorReporter.hasAtLeastLogLevel(Level.TRACE));
    }

    @Test
    public void testSetLogLevel()
    {
        ErrorReporter errorReporter = new Slf4jErrorReporter(MODULE);
        errorReporter.setLogLevel(null, Level.WARN);

        errorReporter.logInfo("dropped %d", 1);
        errorReporter.logWarning("kept %d", 2);

        assertThat(appender.list).hasSize(1);
        assertEquals("kept 2", appender.list.get(0).getFormattedMessage());
    }

    @Test
    public void testProblemReport()
    {
        ErrorReporter errorReporter = new Slf4jErrorReporter(MODULE, null, "DEBUG");
        ZfsErrorException exc = new ZfsErrorException(ZfsErrorKind.SNAPSHOT_NOT_FOUND, Errno.ENOENT, "pool/a@s");

        String logName = errorReporter.reportProblem(Level.DEBUG, exc, "lzc get holds of pool/a@s");

        assertThat(logName).startsWith(errorReporter.getInstanceId() + "-");
        assertThat(appender.list).hasSize(1);
        ILoggingEvent event = appender.list.get(0);
        assertEquals(ch.qos.logback.classic.Level.DEBUG, event.getLevel());
        assertThat(event.getFormattedMessage())
            .startsWith("Snapshot not found: pool/a@s [Report number " + logName + "]")
            .contains("lzc get holds of pool/a@s")
            .contains("ENOENT: No such file or directory")
            .containsPattern("Error code: +" + Errno.ENOENT)
            .doesNotContain("at com.linbit");
    }

    @Test
    public void testProblemReportIncludesExceptionTexts()
    {
        ErrorReporter errorReporter = new Slf4jErrorReporter(MODULE, null, "DEBUG");
        LzcException exc = new LzcException(
            "Loading the native library 'libzfs_core.so.3' failed",
            "Library load failed",
            "file not found",
            "Install the ZFS userland libraries",
            "Searched the default library path"
        );

        errorReporter.reportProblem(Level.DEBUG, exc, null);

        assertThat(appender.list).hasSize(1);
        assertThat(appender.list.get(0).getFormattedMessage())
            .contains("Library load failed")
            .contains("file not found")
            .contains("Install the ZFS userland libraries")
            .containsPattern("Details: +Searched the default library path")
            .doesNotContain("Error code:");
    }

    @Test
    public void testErrorReportIncludesStackTrace()
    {
        ErrorReporter errorReporter = new Slf4jErrorReporter(MODULE);

        String first = errorReporter.reportError(new IllegalStateException("broken"));
        String second = errorReporter.reportError(Level.WARN, new IllegalStateException());

        assertThat(first).isNotEqualTo(second);
        assertThat(appender.list).hasSize(2);
        assertThat(appender.list.get(0).getFormattedMessage())
            .startsWith("broken")
            .contains("java.lang.IllegalStateException: broken");
        assertThat(appender.list.get(1).getFormattedMessage())
            .startsWith("Problem of type 'java.lang.IllegalStateException'");
        assertEquals(ch.qos.logback.classic.Level.WARN, appender.list.get(1).getLevel());
    }
}
