package amanuensis;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Finds and settles disagreements between the machine and user solution maps.
 *
 * <p>Ambiguous keys are never reported and never changed: automation is not
 * allowed to settle them.</p>
 */
public class ConflictResolver {
    private static final Logger LOGGER = Logger.getLogger(ConflictResolver.class.getName());

    private final SolutionStore store;
    private final Set<String> ambiguousKeys;

    public ConflictResolver(SolutionStore store, Set<String> ambiguousKeys) {
        this.store = store;
        this.ambiguousKeys = ambiguousKeys == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(ambiguousKeys));
    }

    /**
     * @return every non-ambiguous key present in both maps with different values, in user-map order
     */
    public List<ConflictRecord> detectConflicts() {
        Map<String, List<String>> machine = store.machineSnapshot();
        Map<String, List<String>> user = store.userSnapshot();
        List<ConflictRecord> conflicts = new ArrayList<>();
        for (Map.Entry<String, List<String>> e : user.entrySet()) {
            String key = e.getKey();
            if (ambiguousKeys.contains(key)) continue;
            List<String> m = machine.get(key);
            // order within a value list carries no meaning
            if (m != null && !new HashSet<>(m).equals(new HashSet<>(e.getValue()))) {
                conflicts.add(new ConflictRecord(key, m, e.getValue()));
            }
        }
        return conflicts;
    }

    public boolean resolve(ConflictRecord conflict, ConflictDecision decision) {
        return resolve(conflict.key, conflict.machineValue, conflict.userValue, decision);
    }

    /**
     * Applies one decision to the in-memory maps. Nothing is written to disk;
     * see {@link SolutionStore#persist()}.
     *
     * @return {@code true} if a map changed
     */
    public boolean resolve(String key, List<String> machineValue, List<String> userValue, ConflictDecision decision) {
        if (ambiguousKeys.contains(key)) {
            LOGGER.info("Refusing to resolve ambiguous key " + key);
            return false;
        }
        if (decision == null) {
            return false;
        }
        switch (decision) {
            case MACHINE:
                store.setUser(key, machineValue);
                return true;
            case USER:
                store.setMachine(key, userValue);
                return true;
            case SKIP:
            default:
                return false;
        }
    }

    /**
     * Asks {@code source} about every conflict, applies the answers and persists
     * both maps once at the end.
     *
     * @return number of conflicts resolved (not skipped)
     * @throws IOException if the maps cannot be saved
     */
    public int resolveAll(ConflictDecisionSource source) throws IOException {
        int resolved = 0;
        for (ConflictRecord conflict : detectConflicts()) {
            if (resolve(conflict, source.decide(conflict))) {
                resolved++;
            }
        }
        store.persist();
        LOGGER.info("Resolved " + resolved + " conflicts");
        return resolved;
    }
}
