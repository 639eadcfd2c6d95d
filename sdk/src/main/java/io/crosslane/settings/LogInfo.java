package io.crosslane.settings;

public final class LogInfo {
    private final String logDir;
    private final String logFileName;
    private final String logFileLevel;
    private final String logConsoleLevel;

    public LogInfo(String logDir, String logFileName, String logFileLevel, String logConsoleLevel) {
        this.logDir = logDir;
        this.logFileName = logFileName;
        this.logFileLevel = logFileLevel;
        this.logConsoleLevel = logConsoleLevel;
    }

    public String getLogDir() {
        return logDir;
    }

    public String getLogFileName() {
        return logFileName;
    }

    public String getLogFileLevel() {
        return logFileLevel;
    }

    public String getLogConsoleLevel() {
        return logConsoleLevel;
    }
}
