package amanuensis;

import java.util.Objects;

/**
 * Answer of a {@link DecisionSource} for one occurrence.
 */
public final class Decision {

    public enum Kind {
        /** Write {@link #getExpansion()} back and record it. */
        ACCEPT,
        /** Leave the occurrence as it is. */
        SKIP,
        /** Log the passage for manual follow-up. */
        DIFFICULT,
        /** Stop asking; finish the current document and flush. */
        QUIT
    }

    private static final Decision SKIP = new Decision(Kind.SKIP, null, null, 0.0);
    private static final Decision DIFFICULT = new Decision(Kind.DIFFICULT, null, null, 0.0);
    private static final Decision QUIT = new Decision(Kind.QUIT, null, null, 0.0);

    private final Kind kind;
    private final String expansion;
    private final SuggestionSource source;
    private final double confidence;

    private Decision(Kind kind, String expansion, SuggestionSource source, double confidence) {
        this.kind = kind;
        this.expansion = expansion;
        this.source = source;
        this.confidence = confidence;
    }

    public static Decision accept(Suggestion suggestion) {
        Objects.requireNonNull(suggestion, "suggestion");
        return new Decision(Kind.ACCEPT, suggestion.getExpansion(), suggestion.getSource(), suggestion.getConfidence());
    }

    /**
     * An expansion typed by the user rather than picked from the list.
     */
    public static Decision custom(String expansion) {
        if (expansion == null || expansion.trim().isEmpty()) {
            throw new IllegalArgumentException("custom expansion must not be empty");
        }
        return new Decision(Kind.ACCEPT, expansion.trim(), SuggestionSource.CUSTOM,
                SuggestionSource.CUSTOM.defaultConfidence());
    }

    public static Decision skip() {
        return SKIP;
    }

    public static Decision difficult() {
        return DIFFICULT;
    }

    public static Decision quit() {
        return QUIT;
    }

    public Kind getKind() {
        return kind;
    }

    public String getExpansion() {
        return expansion;
    }

    public SuggestionSource getSource() {
        return source;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public String toString() {
        return kind == Kind.ACCEPT ? "ACCEPT(" + expansion + ", " + source + ")" : kind.name();
    }
}
