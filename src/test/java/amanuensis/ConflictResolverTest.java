package amanuensis;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConflictResolverTest {

    @TempDir
    Path temp;

    private SolutionStore store;
    private ConflictResolver resolver;

    @BeforeEach
    void setUp() throws IOException {
        store = SolutionStore.load(temp.resolve("machine.json"), temp.resolve("user.json"));
        store.addMachine("p$", "par");
        store.addUser("p$", "per");
        store.addMachine("ye", "the");
        store.addUser("ye", "the");
        store.addMachine("the$", "them");
        store.addUser("the$", "then");
        store.addUser("wch", "which");
        resolver = new ConflictResolver(store, new HashSet<>(Collections.singletonList("the$")));
    }

    @Test
    void detectsOnlyRealDisagreements() {
        List<ConflictRecord> conflicts = resolver.detectConflicts();

        assertEquals(1, conflicts.size());
        assertEquals("p$", conflicts.get(0).key);
        assertEquals(Collections.singletonList("par"), conflicts.get(0).machineValue);
        assertEquals(Collections.singletonList("per"), conflicts.get(0).userValue);
    }

    @Test
    void sameExpansionsInAnotherOrderAreNoConflict() {
        store.addMachine("q$", "que");
        store.addMachine("q$", "quam");
        store.addUser("q$", "quam");
        store.addUser("q$", "que");

        List<ConflictRecord> conflicts = resolver.detectConflicts();

        assertEquals(1, conflicts.size());
        assertEquals("p$", conflicts.get(0).key);
    }

    @Test
    void machineDecisionOverwritesUser() {
        assertTrue(resolver.resolve(resolver.detectConflicts().get(0), ConflictDecision.MACHINE));

        assertEquals(Collections.singletonList("par"), store.userValue("p$"));
        assertTrue(resolver.detectConflicts().isEmpty());
    }

    @Test
    void userDecisionOverwritesMachine() {
        assertTrue(resolver.resolve(resolver.detectConflicts().get(0), ConflictDecision.USER));

        assertEquals(Collections.singletonList("per"), store.machineValue("p$"));
    }

    @Test
    void ambiguousKeysAreNeverTouched() {
        assertFalse(resolver.resolve("the$", Collections.singletonList("them"),
                Collections.singletonList("then"), ConflictDecision.MACHINE));

        assertEquals(Collections.singletonList("then"), store.userValue("the$"));
    }

    @Test
    void resolveAllPersists() throws IOException {
        int resolved = resolver.resolveAll(conflict -> ConflictDecision.USER);

        assertEquals(1, resolved);
        SolutionStore reloaded = SolutionStore.load(store.machinePath(), store.userPath());
        assertEquals(Collections.singletonList("per"), reloaded.machineValue("p$"));
        assertEquals(Arrays.asList("them"), reloaded.machineValue("the$"));
    }

    @Test
    void skipChangesNothing() throws IOException {
        assertEquals(0, resolver.resolveAll(conflict -> ConflictDecision.SKIP));
        assertEquals(1, resolver.detectConflicts().size());
    }

    @Test
    void decisionParsing() {
        assertEquals(ConflictDecision.MACHINE, ConflictDecision.fromStr("m"));
        assertEquals(ConflictDecision.USER, ConflictDecision.fromStr("User"));
        assertEquals(ConflictDecision.SKIP, ConflictDecision.fromStr("s"));
        assertNull(ConflictDecision.fromStr("x"));
    }
}
