package amanuensis;

import com.fasterxml.jackson.core.type.TypeReference;
import teihelper.AbbreviationOccurrence;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Append-only JSON array of passages that need a person to look at them:
 * difficult passages and unresolved abbreviations.
 *
 * <p>Each append rewrites the whole file atomically.</p>
 */
public class FlaggedPassageLog {
    private static final Logger LOGGER = Logger.getLogger(FlaggedPassageLog.class.getName());

    private static final TypeReference<List<Map<String, Object>>> ENTRIES = new TypeReference<List<Map<String, Object>>>() {
    };

    private final Path path;
    private List<Map<String, Object>> entries;

    public FlaggedPassageLog(Path path) {
        this.path = path;
    }

    public Path path() {
        return path;
    }

    /**
     * Entry of {@code difficult_passages.json}: file, line, column and context.
     */
    public static Map<String, Object> difficultEntry(AbbreviationOccurrence occ) {
        Map<String, Object> e = new LinkedHashMap<>();
        e.put("file", occ.getFileName());
        e.put("line", occ.getLine());
        e.put("column", occ.getColumn());
        e.put("context", occ.getContextBefore() + " [" + occ.getSurfaceText() + "] " + occ.getContextAfter());
        return e;
    }

    /**
     * Entry of the unresolved-abbreviations file.
     */
    public static Map<String, Object> unresolvedEntry(AbbreviationOccurrence occ) {
        Map<String, Object> e = new LinkedHashMap<>();
        e.put("file", occ.getFileName());
        e.put("line", occ.getLine());
        e.put("column", occ.getColumn());
        e.put("abbreviation", occ.getRawText());
        e.put("key", occ.getKey());
        e.put("xpath", occ.getXpath());
        e.put("context_before", occ.getContextBefore());
        e.put("context_after", occ.getContextAfter());
        return e;
    }

    /**
     * Appends one entry and saves.
     *
     * @return {@code false} if the file could not be written; the entry stays
     * in memory and is written with the next successful append
     */
    public synchronized boolean append(Map<String, Object> entry) {
        if (entries == null) {
            entries = readExisting();
        }
        entries.add(entry);
        try {
            AtomicJsonWriter.write(path, entries);
            return true;
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Failed to write " + path, e);
            return false;
        }
    }

    public synchronized int size() {
        if (entries == null) {
            entries = readExisting();
        }
        return entries.size();
    }

    private List<Map<String, Object>> readExisting() {
        if (!Files.isRegularFile(path)) {
            return new ArrayList<>();
        }
        try (InputStream in = Files.newInputStream(path)) {
            if (Files.size(path) == 0) {
                return new ArrayList<>();
            }
            List<Map<String, Object>> existing = AtomicJsonWriter.mapper().readValue(in, ENTRIES);
            return existing == null ? new ArrayList<>() : new ArrayList<>(existing);
        } catch (IOException e) {
            Path aside = path.resolveSibling(path.getFileName() + ".corrupt");
            LOGGER.log(Level.WARNING, "Unreadable " + path + ", moving it to " + aside + " and starting a new list", e);
            try {
                Files.move(path, aside, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException moveError) {
                LOGGER.log(Level.WARNING, "Could not move " + path + " aside", moveError);
            }
            return new ArrayList<>();
        }
    }
}
