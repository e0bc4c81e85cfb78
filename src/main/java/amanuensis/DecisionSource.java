package amanuensis;

import teihelper.AbbreviationOccurrence;

import java.util.List;

/**
 * Chooses what happens to an occurrence given its ranked suggestions.
 *
 * <p>Called synchronously, once per occurrence. Interactive implementations may
 * block; only the document being processed waits.</p>
 */
public interface DecisionSource {

    Decision requestDecision(AbbreviationOccurrence occurrence, List<Suggestion> suggestions);

    /**
     * Whether a person answers. Accepted expansions from an interactive source
     * go to the user map, all others to the machine map.
     */
    default boolean isInteractive() {
        return false;
    }
}
