package amanuensis;

/**
 * Decides conflicts found by {@link ConflictResolver}.
 */
@FunctionalInterface
public interface ConflictDecisionSource {
    ConflictDecision decide(ConflictRecord conflict);
}
