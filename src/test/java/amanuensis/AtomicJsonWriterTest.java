package amanuensis;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class AtomicJsonWriterTest {

    @TempDir
    Path temp;

    public static class Exploding {
        public String getValue() {
            throw new IllegalStateException("serialization interrupted");
        }
    }

    @Test
    void createsParentDirectories() throws IOException {
        Path target = temp.resolve("a/b/out.json");

        AtomicJsonWriter.write(target, Collections.singletonMap("ye", "the"));

        assertTrue(new String(Files.readAllBytes(target), StandardCharsets.UTF_8).contains("\"ye\" : \"the\""));
    }

    @Test
    void failedSerializationKeepsOldContent() throws IOException {
        Path target = temp.resolve("out.json");
        AtomicJsonWriter.write(target, Collections.singletonMap("ye", "the"));
        byte[] before = Files.readAllBytes(target);

        assertThrows(IOException.class, () -> AtomicJsonWriter.write(target, new Exploding()));

        assertArrayEquals(before, Files.readAllBytes(target));
        try (Stream<Path> files = Files.list(temp)) {
            assertEquals(1, files.count());
        }
    }
}
