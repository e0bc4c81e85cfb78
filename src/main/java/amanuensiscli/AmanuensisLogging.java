package amanuensiscli;

import amanuensis.AmanuensisLevels;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Console and rotating-file logging for command line runs.
 */
final class AmanuensisLogging {

    static final int FILE_LIMIT_BYTES = 10 * 1024 * 1024;
    static final int FILE_COUNT = 5;

    private static final DateTimeFormatter TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private AmanuensisLogging() {
    }

    /**
     * Replaces the root handlers with a console handler (WARNING, or FINE when
     * verbose) and, when {@code logFile} is set, a rotating file handler at the
     * configured level.
     */
    static void configure(String levelName, Path logFile, boolean verbose) {
        Level level = AmanuensisLevels.parse(levelName);
        if (level == null) {
            level = Level.WARNING;
        }
        Logger root = Logger.getLogger("");
        for (Handler h : root.getHandlers()) {
            root.removeHandler(h);
            h.close();
        }

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(verbose ? Level.FINE : Level.WARNING);
        console.setFormatter(new LineFormatter());
        root.addHandler(console);

        if (logFile != null) {
            try {
                Path dir = logFile.toAbsolutePath().getParent();
                if (dir != null) {
                    Files.createDirectories(dir);
                }
                FileHandler file = new FileHandler(logFile.toString(), FILE_LIMIT_BYTES, FILE_COUNT, true);
                file.setLevel(level);
                file.setFormatter(new LineFormatter());
                root.addHandler(file);
            } catch (IOException e) {
                root.log(Level.WARNING, "Cannot open log file " + logFile + ", logging to console only", e);
            }
        }

        Level rootLevel = verbose && Level.FINE.intValue() < level.intValue() ? Level.FINE : level;
        root.setLevel(rootLevel);
    }

    static final class LineFormatter extends Formatter {
        @Override
        public String format(LogRecord record) {
            StringBuilder sb = new StringBuilder();
            sb.append(TIME.format(Instant.ofEpochMilli(record.getMillis())))
                    .append(" - ").append(record.getLoggerName())
                    .append(" - ").append(record.getLevel().getName())
                    .append(" - ").append(formatMessage(record))
                    .append(System.lineSeparator());
            if (record.getThrown() != null) {
                StringWriter sw = new StringWriter();
                record.getThrown().printStackTrace(new PrintWriter(sw));
                sb.append(sw);
            }
            return sb.toString();
        }
    }
}
