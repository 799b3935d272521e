package org.broadinstitute.wombat.utils;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;

import java.util.Map;

/**
 * Logging utilities: propagates a single verbosity setting to htsjdk and Log4j.
 */
public final class LoggingUtils {

    // Map between the logging level used throughout our code (the htsjdk Log.LogLevel enum),
    // and the log4j log Level values.
    private static final Map<Log.LogLevel, Level> loggingLevelNamespaceMap = Maps.immutableEnumMap(ImmutableMap.of(
            Log.LogLevel.ERROR, Level.ERROR,
            Log.LogLevel.WARNING, Level.WARN,
            Log.LogLevel.INFO, Level.INFO,
            Log.LogLevel.DEBUG, Level.DEBUG));

    private LoggingUtils() {}

    public static Level levelToLog4jLevel(final Log.LogLevel htsjdkLevel) {
        return loggingLevelNamespaceMap.get(htsjdkLevel);
    }

    /**
     * Propagate a verbosity level to htsjdk and to every Log4j logger of the current configuration.
     */
    public static void setLoggingLevel(final Log.LogLevel verbosity) {
        Utils.nonNull(verbosity, "verbosity cannot be null");

        // htsjdk logs through its own facade (FASTA parsing, etc)
        Log.setGlobalLogLevel(verbosity);

        final LoggerContext loggerContext = (LoggerContext) LogManager.getContext(false);
        final Configuration loggerContextConfig = loggerContext.getConfiguration();
        final LoggerConfig loggerConfig = loggerContextConfig.getLoggerConfig(LoggingUtils.class.getName());

        loggerConfig.setLevel(levelToLog4jLevel(verbosity));
        loggerContext.updateLoggers();
    }
}
