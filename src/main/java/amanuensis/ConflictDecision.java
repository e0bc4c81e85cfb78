package amanuensis;

import java.util.Locale;

/**
 * What to do with one conflict.
 */
public enum ConflictDecision {
    /** Copy the machine value into the user map. */
    MACHINE,
    /** Copy the user value into the machine map. */
    USER,
    /** Leave both maps alone; the conflict comes back next run. */
    SKIP;

    /**
     * Parses the one-letter answers {@code m}, {@code u} and {@code s}.
     *
     * @return the decision, or {@code null} for anything else
     */
    public static ConflictDecision fromStr(String value) {
        if (value == null) return null;
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "m":
            case "machine":
                return MACHINE;
            case "u":
            case "user":
                return USER;
            case "s":
            case "skip":
                return SKIP;
            default:
                return null;
        }
    }
}
