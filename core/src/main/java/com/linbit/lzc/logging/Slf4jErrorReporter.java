package com.linbit.lzc.logging;

import com.linbit.lzc.LzcException;

import javax.annotation.Nullable;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * {@link ErrorReporter} that writes log messages and error reports to SLF4J
 *
 * If Logback is the SLF4J backend, the log levels can be changed at runtime. The level of the
 * root logger applies to third party libraries, the lzc level applies to the lzc logger only.
 */
public final class Slf4jErrorReporter implements ErrorReporter
{
    public static final String LOGGER_PREFIX = "lzc";

    private static final String FIELD_FORMAT = "%-16s%s%n";

    private final Logger mainLogger;
    private final String instanceId;
    private final AtomicLong errorNr = new AtomicLong();

    public Slf4jErrorReporter(String moduleName)
    {
        this(moduleName, null, null);
    }

    public Slf4jErrorReporter(
        String moduleName,
        @Nullable String logLevelRef,
        @Nullable String lzcLogLevelRef
    )
    {
        mainLogger = LoggerFactory.getLogger(LOGGER_PREFIX + "/" + moduleName);
        instanceId = ErrorReporter.getNewLogId();

        if (logLevelRef != null || lzcLogLevelRef != null)
        {
            try
            {
                String lzcLogLevel = lzcLogLevelRef;
                if (lzcLogLevel == null)
                {
                    lzcLogLevel = logLevelRef;
                }
                setLogLevelImpl(
                    logLevelRef == null ? null : Level.valueOf(logLevelRef.toUpperCase()),
                    Level.valueOf(lzcLogLevel.toUpperCase())
                );
            }
            catch (IllegalArgumentException exc)
            {
                logError("Invalid log level '%s' / '%s'", logLevelRef, lzcLogLevelRef);
            }
        }
    }

    @Override
    public String getInstanceId()
    {
        return instanceId;
    }

    @Override
    public boolean hasAtLeastLogLevel(Level levelRef)
    {
        boolean hasRequiredLevel;
        switch (levelRef)
        {
            case DEBUG:
                hasRequiredLevel = mainLogger.isDebugEnabled();
                break;
            case ERROR:
                hasRequiredLevel = mainLogger.isErrorEnabled();
                break;
            case INFO:
                hasRequiredLevel = mainLogger.isInfoEnabled();
                break;
            case TRACE:
                hasRequiredLevel = mainLogger.isTraceEnabled();
                break;
            case WARN:
                hasRequiredLevel = mainLogger.isWarnEnabled();
                break;
            default:
                throw new IllegalArgumentException("Unknown log level " + levelRef);
        }
        return hasRequiredLevel;
    }

    @Override
    public @Nullable Level getCurrentLogLevel()
    {
        Level level = null; // no logging, aka OFF
        if (mainLogger.isTraceEnabled())
        {
            level = Level.TRACE;
        }
        else
        if (mainLogger.isDebugEnabled())
        {
            level = Level.DEBUG;
        }
        else
        if (mainLogger.isInfoEnabled())
        {
            level = Level.INFO;
        }
        else
        if (mainLogger.isWarnEnabled())
        {
            level = Level.WARN;
        }
        else
        if (mainLogger.isErrorEnabled())
        {
            level = Level.ERROR;
        }
        return level;
    }

    @Override
    public void setLogLevel(@Nullable Level level, @Nullable Level lzcLevel)
    {
        if (level != null || lzcLevel != null)
        {
            setLogLevelImpl(level, lzcLevel);
        }
    }

    private void setLogLevelImpl(@Nullable Level level, @Nullable Level lzcLevel)
    {
        // only works with logback as backend, with other SLF4J bindings this has no effect
        Logger rootLogger = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (rootLogger instanceof ch.qos.logback.classic.Logger)
        {
            if (level != null)
            {
                ((ch.qos.logback.classic.Logger) rootLogger).setLevel(
                    ch.qos.logback.classic.Level.toLevel(level.toString())
                );
            }
            if (lzcLevel != null)
            {
                if (mainLogger instanceof ch.qos.logback.classic.Logger)
                {
                    ((ch.qos.logback.classic.Logger) mainLogger).setLevel(
                        ch.qos.logback.classic.Level.toLevel(lzcLevel.toString())
                    );
                }
                else
                {
                    logError("MainLogger (lzc) is not a logback logger but the ROOT logger is!");
                }
            }
        }
    }

    @Override
    public void logTrace(String format, Object... args)
    {
        if (mainLogger.isTraceEnabled())
        {
            mainLogger.trace(String.format(format, args));
        }
    }

    @Override
    public void logDebug(String format, Object... args)
    {
        if (mainLogger.isDebugEnabled())
        {
            mainLogger.debug(String.format(format, args));
        }
    }

    @Override
    public void logInfo(String format, Object... args)
    {
        mainLogger.info(String.format(format, args));
    }

    @Override
    public void logWarning(String format, Object... args)
    {
        mainLogger.warn(String.format(format, args));
    }

    @Override
    public void logError(String format, Object... args)
    {
        mainLogger.error(String.format(format, args));
    }

    @Override
    public String reportError(Throwable errorInfo)
    {
        return reportError(Level.ERROR, errorInfo);
    }

    @Override
    public String reportError(Level logLevel, Throwable errorInfo)
    {
        return reportImpl(logLevel, errorInfo, null, true);
    }

    @Override
    public String reportProblem(Level logLevel, LzcException errorInfo, @Nullable String contextInfo)
    {
        return reportImpl(logLevel, errorInfo, contextInfo, false);
    }

    private String reportImpl(
        Level logLevel,
        Throwable errorInfo,
        @Nullable String contextInfo,
        boolean includeStackTrace
    )
    {
        long reportNr = errorNr.getAndIncrement();
        String logName = String.format("%s-%06d", instanceId, reportNr);
        try
        {
            String report = renderReport(logName, errorInfo, contextInfo, includeStackTrace);
            switch (logLevel)
            {
                case ERROR:
                    mainLogger.error(report);
                    break;
                case WARN:
                    mainLogger.warn(report);
                    break;
                case INFO:
                    mainLogger.info(report);
                    break;
                case DEBUG:
                    mainLogger.debug(report);
                    break;
                case TRACE:
                    mainLogger.trace(report);
                    break;
                default:
                    mainLogger.error(report);
                    break;
            }
        }
        catch (RuntimeException exc)
        {
            // the reporter itself must not fail, stderr is the last resort
            System.err.printf("Unable to log error report %s:%n", logName);
            exc.printStackTrace(System.err);
        }
        return logName;
    }

    private String renderReport(
        String logName,
        Throwable errorInfo,
        @Nullable String contextInfo,
        boolean includeStackTrace
    )
    {
        StringWriter text = new StringWriter();
        PrintWriter output = new PrintWriter(text);

        String excMsg = errorInfo.getMessage();
        if (excMsg == null)
        {
            output.printf("Problem of type '%s'", errorInfo.getClass().getName());
        }
        else
        {
            output.print(excMsg);
        }
        output.printf(" [Report number %s]%n", logName);

        if (contextInfo != null)
        {
            output.printf(FIELD_FORMAT, "Context:", contextInfo);
        }
        if (errorInfo instanceof LzcException)
        {
            LzcException lzcExc = (LzcException) errorInfo;
            printField(output, "Description:", lzcExc.getDescriptionText());
            printField(output, "Cause:", lzcExc.getCauseText());
            printField(output, "Correction:", lzcExc.getCorrectionText());
            printField(output, "Details:", lzcExc.getDetailsText());
            Long numericCode = lzcExc.getNumericCode();
            if (numericCode != null)
            {
                output.printf(FIELD_FORMAT, "Error code:", numericCode);
            }
        }
        if (includeStackTrace)
        {
            errorInfo.printStackTrace(output);
        }
        output.flush();
        return text.toString().trim();
    }

    private static void printField(PrintWriter output, String label, @Nullable String value)
    {
        if (value != null)
        {
            output.printf(FIELD_FORMAT, label, value);
        }
    }
}
