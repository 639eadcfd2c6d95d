package io.crosslane.settings;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.util.List;
import java.util.Locale;

/**
 * Passes the log settings to log4j2.xml through system properties. Must run before the first logger is created.
 */
public final class LogInitializer {
    private static final String DEFAULT_LEVEL = "info";
    // most verbose first
    private static final List<String> LEVELS = List.of("all", "trace", "debug", "info", "warn", "error", "fatal", "off");

    private static boolean initialized = false;

    private LogInitializer() {}

    public static synchronized void initLogManager(LogInfo logInfo) {
        if (initialized)
            return;
        initialized = true;

        String fileLevel = getCheckedLevel(logInfo.getLogFileLevel());
        String consoleLevel = getCheckedLevel(logInfo.getLogConsoleLevel());
        // root must let through everything either appender accepts
        String rootLevel = LEVELS.get(Math.min(LEVELS.indexOf(fileLevel), LEVELS.indexOf(consoleLevel)));

        String logDir = logInfo.getLogDir();
        if (!logDir.isBlank() && !logDir.endsWith(File.separator))
            logDir += File.separator;

        System.setProperty("logDir", logDir);
        System.setProperty("logFileName", logInfo.getLogFileName());
        System.setProperty("logRootLevel", rootLevel);
        System.setProperty("logFileLevel", fileLevel);
        System.setProperty("logConsoleLevel", consoleLevel);

        Logger logger = LogManager.getLogger(LogInitializer.class);
        logger.info("Bridge logging started, file [{}] at level [{}], console at level [{}]",
                logDir + logInfo.getLogFileName(), fileLevel, consoleLevel);
    }

    // Unknown levels fall back to info, reported on stderr since log4j is not configured yet
    public static String getCheckedLevel(String level) {
        String normalized = level.toLowerCase(Locale.ROOT);
        if (LEVELS.contains(normalized))
            return normalized;
        System.err.println(String.format("Log level `%s` is not valid, using `%s`", level, DEFAULT_LEVEL));
        return DEFAULT_LEVEL;
    }
}
