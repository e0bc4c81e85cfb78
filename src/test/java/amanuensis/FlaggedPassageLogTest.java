package amanuensis;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FlaggedPassageLogTest {

    @TempDir
    Path temp;

    private static Map<String, Object> entry(String file, int line) {
        Map<String, Object> e = new LinkedHashMap<>();
        e.put("file", file);
        e.put("line", line);
        e.put("column", 1);
        e.put("context", "before [ye] after");
        return e;
    }

    @Test
    void appendsAcrossInstances() throws IOException {
        Path path = temp.resolve("difficult_passages.json");
        assertTrue(new FlaggedPassageLog(path).append(entry("a.xml", 3)));

        FlaggedPassageLog reopened = new FlaggedPassageLog(path);
        assertTrue(reopened.append(entry("b.xml", 7)));

        assertEquals(2, reopened.size());
        JsonNode json = AtomicJsonWriter.mapper().readTree(path.toFile());
        assertEquals("a.xml", json.get(0).get("file").asText());
        assertEquals(7, json.get(1).get("line").asInt());
    }

    @Test
    void unreadableFileIsMovedAside() throws IOException {
        Path path = temp.resolve("unresolved_aw.json");
        Files.write(path, "{ not json".getBytes(StandardCharsets.UTF_8));

        FlaggedPassageLog log = new FlaggedPassageLog(path);
        assertTrue(log.append(entry("c.xml", 1)));

        assertEquals(1, log.size());
        assertEquals("{ not json",
                new String(Files.readAllBytes(temp.resolve("unresolved_aw.json.corrupt")), StandardCharsets.UTF_8));
    }

    @Test
    void emptyFileStartsAnEmptyList() throws IOException {
        Path path = temp.resolve("empty.json");
        Files.createFile(path);

        assertEquals(0, new FlaggedPassageLog(path).size());
    }
}
