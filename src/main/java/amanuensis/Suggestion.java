package amanuensis;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One ranked expansion candidate for a canonical key.
 */
public final class Suggestion {

    /**
     * Confidence descending, then source priority.
     */
    public static final Comparator<Suggestion> RANKING =
            Comparator.comparingDouble(Suggestion::getConfidence).reversed()
                    .thenComparing(Suggestion::getSource);

    private final String expansion;
    private final double confidence;
    private final SuggestionSource source;

    public Suggestion(String expansion, double confidence, SuggestionSource source) {
        if (expansion == null || expansion.isEmpty()) {
            throw new IllegalArgumentException("expansion must not be empty");
        }
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence out of range: " + confidence);
        }
        this.expansion = expansion;
        this.confidence = confidence;
        this.source = Objects.requireNonNull(source, "source");
    }

    @JsonProperty("expansion")
    public String getExpansion() {
        return expansion;
    }

    @JsonProperty("confidence")
    public double getConfidence() {
        return confidence;
    }

    @JsonProperty("source")
    public SuggestionSource getSource() {
        return source;
    }

    /**
     * Deduplicates by expansion text (keeping the better-ranked candidate) and
     * sorts the result by {@link #RANKING}. Input order decides between
     * duplicates of identical rank.
     *
     * @param suggestions candidates in discovery order
     * @return a new, ranked list
     */
    public static List<Suggestion> rank(List<Suggestion> suggestions) {
        Map<String, Suggestion> best = new LinkedHashMap<>();
        for (Suggestion s : suggestions) {
            Suggestion previous = best.get(s.expansion);
            if (previous == null || RANKING.compare(s, previous) < 0) {
                best.put(s.expansion, s);
            }
        }
        List<Suggestion> ranked = new ArrayList<>(best.values());
        ranked.sort(RANKING);
        return ranked;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Suggestion)) return false;
        Suggestion that = (Suggestion) o;
        return Double.compare(that.confidence, confidence) == 0
                && expansion.equals(that.expansion)
                && source == that.source;
    }

    @Override
    public int hashCode() {
        return Objects.hash(expansion, confidence, source);
    }

    @Override
    public String toString() {
        return String.format(java.util.Locale.ROOT, "%s (%.2f, %s)", expansion, confidence, source);
    }
}
