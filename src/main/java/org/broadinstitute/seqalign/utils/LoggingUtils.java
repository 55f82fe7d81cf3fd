package org.broadinstitute.seqalign.utils;

import com.google.common.collect.BiMap;
import com.google.common.collect.EnumHashBiMap;
import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;

import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Logger;

/**
 * Logging utilities.
 *
 * The htsjdk {@link Log.LogLevel} enum is the verbosity currency of this library (log4j represents each level as a
 * static object, so it has no enum to hand around). We convert back and forth between that and the log4j namespace
 * as necessary. The java built in logger has yet another set of level values, for which we chose a mapping too.
 */
public final class LoggingUtils {

    private static final BiMap<Log.LogLevel, Level> loggingLevelNamespaceMap;
    static {
        loggingLevelNamespaceMap = EnumHashBiMap.create(Log.LogLevel.class);
        loggingLevelNamespaceMap.put(Log.LogLevel.ERROR, Level.ERROR);
        loggingLevelNamespaceMap.put(Log.LogLevel.WARNING, Level.WARN);
        loggingLevelNamespaceMap.put(Log.LogLevel.INFO, Level.INFO);
        loggingLevelNamespaceMap.put(Log.LogLevel.DEBUG, Level.DEBUG);
    }

    private static final BiMap<Log.LogLevel, java.util.logging.Level> javaUtilLevelNamespaceMap;
    static {
        javaUtilLevelNamespaceMap = EnumHashBiMap.create(Log.LogLevel.class);
        javaUtilLevelNamespaceMap.put(Log.LogLevel.ERROR, java.util.logging.Level.SEVERE);
        javaUtilLevelNamespaceMap.put(Log.LogLevel.WARNING, java.util.logging.Level.WARNING);
        javaUtilLevelNamespaceMap.put(Log.LogLevel.INFO, java.util.logging.Level.INFO);
        javaUtilLevelNamespaceMap.put(Log.LogLevel.DEBUG, java.util.logging.Level.FINEST);
    }

    private LoggingUtils(){}

    // Package-private for unit test access
    static Log.LogLevel levelFromLog4jLevel(Level log4jLevel) {
        return loggingLevelNamespaceMap.inverse().get(log4jLevel);
    }

    /**
     * Converts an htsjdk log level to a log4j log level.
     * @param logLevel htsjdk {@link Log.LogLevel} to convert to a Log4J {@link Level}.
     * @return The {@link Level} that corresponds to the given {@code logLevel}.
     */
    public static Level levelToLog4jLevel(Log.LogLevel logLevel) {
        return loggingLevelNamespaceMap.get(logLevel);
    }

    /**
     * Set the java.util.logging level since callers embedding this library may route messages through it.
     */
    private static void setJavaUtilLoggingLevel(final Log.LogLevel verbosity) {
        Logger topLogger = java.util.logging.Logger.getLogger("");

        Handler consoleHandler = null;
        for (Handler handler : topLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                consoleHandler = handler;
                break;
            }
        }

        if (consoleHandler == null) {
            consoleHandler = new ConsoleHandler();
            topLogger.addHandler(consoleHandler);
        }
        consoleHandler.setLevel(levelToJavaUtilLevel(verbosity));
    }

    private static java.util.logging.Level levelToJavaUtilLevel(Log.LogLevel logLevel) {
        return javaUtilLevelNamespaceMap.get(logLevel);
    }

    /**
     * Propagate the verbosity level to htsjdk, log4j and the java built in logger.
     */
    public static void setLoggingLevel(final Log.LogLevel verbosity) {
        Utils.nonNull(verbosity);

        Log.setGlobalLogLevel(verbosity);

        setLog4JLoggingLevel(verbosity);

        setJavaUtilLoggingLevel(verbosity);
    }

    private static void setLog4JLoggingLevel(Log.LogLevel verbosity) {
        // Propagate the requested level to the logger configuration that governs this package.
        final LoggerContext loggerContext = (LoggerContext) LogManager.getContext(false);
        final Configuration loggerContextConfig = loggerContext.getConfiguration();
        final String contextClassName = LoggingUtils.class.getName();
        final LoggerConfig loggerConfig = loggerContextConfig.getLoggerConfig(contextClassName);

        loggerConfig.setLevel(levelToLog4jLevel(verbosity));
        loggerContext.updateLoggers();
    }
}
