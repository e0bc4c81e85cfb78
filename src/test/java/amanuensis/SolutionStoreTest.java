package amanuensis;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class SolutionStoreTest {

    @TempDir
    Path temp;

    @Test
    void missingFilesAreCreatedEmpty() throws IOException {
        Path machine = temp.resolve("data/machine_solution.json");
        Path user = temp.resolve("data/user_solution.json");

        SolutionStore store = SolutionStore.load(machine, user);

        assertTrue(store.machineSnapshot().isEmpty());
        assertTrue(Files.exists(machine));
        assertTrue(Files.exists(user));
        assertEquals("{ }", new String(Files.readAllBytes(user), StandardCharsets.UTF_8).trim());
    }

    @Test
    void readsStringAndListValues() throws IOException {
        Path machine = temp.resolve("machine.json");
        Files.write(machine, "{\"co$\": \"con\", \"p$\": [\"per\", \"par\"]}".getBytes(StandardCharsets.UTF_8));

        SolutionStore store = SolutionStore.load(machine, temp.resolve("user.json"));

        assertEquals(Collections.singletonList("con"), store.machineValue("co$"));
        assertEquals(Arrays.asList("per", "par"), store.machineValue("p$"));
        assertTrue(store.userValue("co$").isEmpty());
    }

    @Test
    void persistedValuesSurviveReload() throws IOException {
        Path machine = temp.resolve("machine.json");
        Path user = temp.resolve("user.json");
        SolutionStore store = SolutionStore.load(machine, user);
        store.addMachine("co$", "con");
        store.addMachine("co$", "con");
        store.addUser("p$", "per");
        store.addUser("p$", "par");
        store.persist();

        SolutionStore reloaded = SolutionStore.load(machine, user);

        assertEquals(Collections.singletonList("con"), reloaded.machineValue("co$"));
        assertEquals(Arrays.asList("per", "par"), reloaded.userValue("p$"));
        assertTrue(new String(Files.readAllBytes(machine), StandardCharsets.UTF_8).contains("\"co$\" : \"con\""));
    }

    @Test
    void setWithEmptyValueRemovesKey() throws IOException {
        SolutionStore store = SolutionStore.load(temp.resolve("m.json"), temp.resolve("u.json"));
        store.setUser("ye", Collections.singletonList("the"));
        store.setUser("ye", Collections.emptyList());

        assertFalse(store.userSnapshot().containsKey("ye"));
    }

    @Test
    void rejectsMarkupKeys() throws IOException {
        SolutionStore store = SolutionStore.load(temp.resolve("m.json"), temp.resolve("u.json"));

        assertThrows(IllegalArgumentException.class, () -> store.addMachine("co<g/>", "con"));
        assertThrows(IllegalArgumentException.class, () -> store.addUser("", "x"));
    }

    @Test
    void invalidJsonFailsLoading() throws IOException {
        Path machine = temp.resolve("machine.json");
        Files.write(machine, "[1, 2]".getBytes(StandardCharsets.UTF_8));

        assertThrows(IOException.class, () -> SolutionStore.load(machine, temp.resolve("user.json")));
    }

    @Test
    void failedPersistIsReportedAndLeavesNoTempFiles() throws IOException {
        Path machine = temp.resolve("machine.json");
        Path user = temp.resolve("user.json");
        SolutionStore store = SolutionStore.load(machine, user);
        Files.delete(machine);
        Files.createDirectories(machine.resolve("occupied"));
        store.addMachine("co$", "con");

        assertFalse(store.persistQuietly());
        try (java.util.stream.Stream<Path> files = Files.list(temp)) {
            assertTrue(files.noneMatch(f -> f.getFileName().toString().endsWith(".tmp")));
        }
    }
}
