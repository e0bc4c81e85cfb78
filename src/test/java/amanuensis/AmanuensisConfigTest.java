package amanuensis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.*;

class AmanuensisConfigTest {

    @TempDir
    Path temp;

    private Path write(String toml) throws IOException {
        Path file = temp.resolve("config.toml");
        Files.write(file, toml.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    @DisplayName("A missing file yields the defaults")
    void defaults() throws IOException {
        AmanuensisConfig config = AmanuensisConfig.load(temp.resolve("absent.toml"));

        assertEquals(50, config.xml.contextWindowSize);
        assertFalse(config.xml.useChoiceTags);
        assertTrue(config.xml.addXmlIds);
        assertEquals(Arrays.asList("char:cmbAbbrStroke", "char:abque"), config.xml.markerRefs);
        assertEquals(1, config.settings.workers);
        assertEquals(Paths.get("data/user_solution.json"), config.userSolutionPath());
        assertTrue(config.ambiguousKeys().contains("the$"));
        assertNull(config.wordnetPath());
    }

    @Test
    void readsSectionsAndKeepsDefaultsForTheRest() throws IOException {
        AmanuensisConfig config = AmanuensisConfig.load(write(String.join("\n",
                "[paths]",
                "input_path = \"corpus\"",
                "",
                "[xml_processing]",
                "context_window_size = 20",
                "use_choice_tags = true",
                "",
                "[settings]",
                "workers = 4",
                "logging_level = \"DEBUG\"",
                "",
                "[ambiguity]",
                "ambiguous_aws = [\"q$\"]",
                "",
                "[unknown_section]",
                "anything = 1",
                "")));

        assertEquals(Paths.get("corpus"), config.inputPath());
        assertEquals(Paths.get("data/output"), config.outputPath());
        assertEquals(20, config.xml.contextWindowSize);
        assertTrue(config.xml.useChoiceTags);
        assertEquals(4, config.settings.workers);
        assertEquals("abbr", config.xml.abbrElement);
        assertEquals(1, config.ambiguousKeys().size());
        assertTrue(config.ambiguousKeys().contains("q$"));
    }

    @Test
    void rejectsInvalidValues() throws IOException {
        Path negativeWindow = write("[xml_processing]\ncontext_window_size = -1\n");
        assertThrows(IllegalArgumentException.class, () -> AmanuensisConfig.load(negativeWindow));

        Path badLevel = write("[settings]\nlogging_level = \"LOUD\"\n");
        assertThrows(IllegalArgumentException.class, () -> AmanuensisConfig.load(badLevel));

        Path badElement = write("[xml_processing]\nabbr_element = \"a b\"\n");
        assertThrows(IllegalArgumentException.class, () -> AmanuensisConfig.load(badElement));
    }

    @Test
    void malformedTomlFails() throws IOException {
        Path broken = write("[settings\nworkers = \n");

        assertThrows(IOException.class, () -> AmanuensisConfig.load(broken));
    }

    @Test
    void levelNames() {
        assertEquals(Level.FINE, AmanuensisLevels.parse("debug"));
        assertEquals(Level.WARNING, AmanuensisLevels.parse("WARN"));
        assertEquals(Level.SEVERE, AmanuensisLevels.parse("CRITICAL"));
        assertEquals(Level.FINEST, AmanuensisLevels.parse("FINEST"));
        assertNull(AmanuensisLevels.parse("LOUD"));
    }
}
