package amanuensis;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Known abbreviation keys and their expansions, used by the dictionary tier.
 *
 * <p>Keys are canonical ({@code $}-marked). Lookups try the key as given and
 * then case-insensitively.</p>
 */
public class AbbreviationDictionary {
    private static final Logger LOGGER = Logger.getLogger(AbbreviationDictionary.class.getName());

    static final String RESOURCE = "/data/abbreviation_dictionary.json";

    private final Map<String, List<String>> entries;
    private final Map<String, List<String>> lowerCased;

    /**
     * Creates a dictionary from an in-memory map.
     *
     * @param entries canonical key to one or more expansions
     */
    public AbbreviationDictionary(Map<String, List<String>> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        Map<String, List<String>> lower = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : this.entries.entrySet()) {
            lower.putIfAbsent(e.getKey().toLowerCase(Locale.ROOT), e.getValue());
        }
        this.lowerCased = Collections.unmodifiableMap(lower);
    }

    /**
     * Lazily loaded bundled dictionary.
     */
    private static final class Holder {
        private static final AbbreviationDictionary DEFAULT = loadBundled();
    }

    /**
     * Returns the dictionary bundled with the application.
     *
     * @return shared default dictionary
     */
    public static AbbreviationDictionary bundled() {
        return Holder.DEFAULT;
    }

    /**
     * Loads a dictionary, trying in order:
     * <ol>
     *   <li>the JSON file at {@code path}, when it exists;</li>
     *   <li>the bundled {@code data/abbreviation_dictionary.json} resource.</li>
     * </ol>
     *
     * @param path dictionary file, may be {@code null}
     * @return the loaded dictionary
     */
    public static AbbreviationDictionary load(Path path) {
        if (path != null && Files.isRegularFile(path)) {
            try (InputStream in = Files.newInputStream(path)) {
                AbbreviationDictionary dict = new AbbreviationDictionary(JsonMaps.read(in));
                LOGGER.info("Loaded " + dict.size() + " dictionary entries from " + path);
                return dict;
            } catch (IOException e) {
                LOGGER.log(Level.WARNING, "Unreadable abbreviation dictionary " + path + ", using bundled one", e);
            }
        }
        return bundled();
    }

    private static AbbreviationDictionary loadBundled() {
        try (InputStream in = AbbreviationDictionary.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing resource: " + RESOURCE);
            }
            return new AbbreviationDictionary(JsonMaps.read(in));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load bundled dictionary " + RESOURCE, e);
        }
    }

    /**
     * Looks up a key, exactly first and then ignoring case.
     *
     * @param key canonical key
     * @return expansions in dictionary order, empty if unknown
     */
    public List<String> lookup(String key) {
        List<String> hit = entries.get(key);
        if (hit == null) {
            hit = lowerCased.get(key.toLowerCase(Locale.ROOT));
        }
        return hit == null ? Collections.emptyList() : hit;
    }

    public Map<String, List<String>> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }
}
