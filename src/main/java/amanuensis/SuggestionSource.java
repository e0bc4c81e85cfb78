package amanuensis;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Origin of an expansion candidate. Declaration order is the tie-break
 * priority between candidates of equal confidence.
 */
public enum SuggestionSource {
    DICTIONARY("dictionary", 0.9),
    PATTERN("pattern", 0.5),
    WORDNET("wordnet", 0.6),
    LANGUAGE_MODEL("language_model", 0.8),
    CUSTOM("custom", 1.0),
    MANUAL("manual", 1.0);

    private final String tag;
    private final double defaultConfidence;

    SuggestionSource(String tag, double defaultConfidence) {
        this.tag = tag;
        this.defaultConfidence = defaultConfidence;
    }

    /**
     * Lower-case tag written to dataset records and JSON files.
     *
     * @return the source tag, e.g. {@code "language_model"}
     */
    @JsonValue
    public String asStr() {
        return tag;
    }

    /**
     * Fixed confidence weight of this tier (the pattern tier uses the upper
     * bound; its second alternative is one step lower).
     *
     * @return confidence in [0, 1]
     */
    public double defaultConfidence() {
        return defaultConfidence;
    }

    /**
     * Parses a tag case-insensitively.
     *
     * @param value tag or enum name
     * @return the matching source, or {@code null} if unknown
     */
    public static SuggestionSource tryParse(String value) {
        if (value == null) return null;
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (SuggestionSource s : values()) {
            if (s.tag.equals(v) || s.name().toLowerCase(Locale.ROOT).equals(v)) {
                return s;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return tag;
    }
}
