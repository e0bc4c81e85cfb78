package amanuensis;

import teihelper.AbbreviationOccurrence;

import java.util.List;

/**
 * Batch chooser: accepts the best-ranked suggestion if it reaches a minimum
 * confidence, otherwise skips.
 */
public class HighestConfidenceDecisionSource implements DecisionSource {

    private final double minConfidence;

    public HighestConfidenceDecisionSource() {
        this(0.0);
    }

    public HighestConfidenceDecisionSource(double minConfidence) {
        this.minConfidence = minConfidence;
    }

    @Override
    public Decision requestDecision(AbbreviationOccurrence occurrence, List<Suggestion> suggestions) {
        if (suggestions.isEmpty()) {
            return Decision.skip();
        }
        Suggestion best = suggestions.get(0);
        return best.getConfidence() >= minConfidence ? Decision.accept(best) : Decision.skip();
    }
}
