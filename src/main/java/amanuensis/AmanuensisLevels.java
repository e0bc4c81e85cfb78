package amanuensis;

import java.util.Locale;
import java.util.logging.Level;

/**
 * Maps the level names used in configuration files onto {@code java.util.logging} levels.
 */
public final class AmanuensisLevels {

    private AmanuensisLevels() {
    }

    /**
     * @param name DEBUG, INFO, WARNING, ERROR or CRITICAL (or a JUL level name)
     * @return the level, or {@code null} if the name is unknown
     */
    public static Level parse(String name) {
        if (name == null) return null;
        switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "DEBUG":
                return Level.FINE;
            case "INFO":
                return Level.INFO;
            case "WARN":
            case "WARNING":
                return Level.WARNING;
            case "ERROR":
            case "CRITICAL":
                return Level.SEVERE;
            default:
                try {
                    return Level.parse(name.trim().toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException e) {
                    return null;
                }
        }
    }
}
