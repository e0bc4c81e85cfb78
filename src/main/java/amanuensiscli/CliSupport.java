package amanuensiscli;

import amanuensis.AmanuensisConfig;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

final class CliSupport {

    private CliSupport() {
    }

    /**
     * Loads the configuration and sets up logging from it.
     */
    static AmanuensisConfig loadConfig(File configFile, boolean verbose) throws IOException {
        Path path = configFile != null ? configFile.toPath() : Paths.get(AmanuensisConfig.DEFAULT_FILE);
        AmanuensisConfig config = AmanuensisConfig.load(path);
        String logFile = config.settings.logFile;
        AmanuensisLogging.configure(config.settings.loggingLevel,
                logFile == null || logFile.trim().isEmpty() ? null : Paths.get(logFile), verbose);
        return config;
    }
}
