package com.linbit.lzc.logging;

import com.linbit.lzc.LzcException;

import javax.annotation.Nullable;

import java.util.Random;

import org.slf4j.event.Level;

/**
 * Logs messages and reports errors of the libzfs_core bindings
 *
 * The log methods take {@link String#format(String, Object...)} style format strings.
 */
public interface ErrorReporter
{
    /**
     * Indicates if at least the given LogLevel is enabled.
     * ERROR < WARN < INFO < DEBUG < TRACE
     */
    boolean hasAtLeastLogLevel(Level level);

    /**
     * Returns the current log level, or null if logging is disabled
     */
    @Nullable Level getCurrentLogLevel();

    /**
     * Sets the log level, if the backing logging frameworks supports that.
     *
     * @param level
     *     The log-level that the logger for frameworks and libraries should use.<br/>
     *     Does NOT influence lzc log messages.
     * @param lzcLevel
     *     The log-level that the logger for lzc should use.
     */
    void setLogLevel(@Nullable Level level, @Nullable Level lzcLevel);

    void logTrace(String format, Object... args);

    void logDebug(String format, Object... args);

    void logInfo(String format, Object... args);

    void logWarning(String format, Object... args);

    void logError(String format, Object... args);

    /**
     * Returns the instance ID of the error reporter instance
     */
    String getInstanceId();

    /**
     * Reports errors that are not expected during normal operation, e.g. detected implementation
     * errors or failures to load the native libraries
     *
     * Implementations are not supposed to throw any exceptions, not even RuntimeExceptions.
     *
     * @return the id of the generated report
     */
    String reportError(Throwable errorInfo);

    String reportError(Level logLevel, Throwable errorInfo);

    /**
     * Reports less severe problems, such as the ones expected during normal operation, e.g. a
     * snapshot that cannot be created because it already exists
     *
     * @param contextInfo Information about the context in which the problem occurred, e.g. the
     *     libzfs_core operation being performed
     *
     * @return the id of the generated report
     */
    String reportProblem(Level logLevel, LzcException errorInfo, @Nullable String contextInfo);

    static String getNewLogId()
    {
        String zeros = "000000";
        Random rnd = new Random();
        String s = Integer.toString(rnd.nextInt(0X1000000), 16);
        return zeros.substring(s.length()) + s;
    }
}
