package amanuensis;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The two persistent key to expansion maps: machine solutions (filled by
 * automatic choices) and user solutions (confirmed by a person).
 *
 * <p>Both files are flat JSON objects whose values are a string or a list of
 * strings. Every {@link #persist()} rewrites both files atomically, so a reader
 * sees either the old or the new map. The store is thread-safe within one
 * process; two processes writing the same files must not run at once.</p>
 */
public class SolutionStore {
    private static final Logger LOGGER = Logger.getLogger(SolutionStore.class.getName());

    private final Path machinePath;
    private final Path userPath;
    private final Map<String, List<String>> machine;
    private final Map<String, List<String>> user;

    private SolutionStore(Path machinePath, Path userPath,
                          Map<String, List<String>> machine, Map<String, List<String>> user) {
        this.machinePath = machinePath;
        this.userPath = userPath;
        this.machine = machine;
        this.user = user;
    }

    /**
     * Loads both maps. A missing or empty file yields an empty map, which is
     * written out immediately so that later loads see a valid file.
     *
     * @throws IOException if a file exists but cannot be read or is not a JSON object
     */
    public static SolutionStore load(Path machinePath, Path userPath) throws IOException {
        Map<String, List<String>> machine = readOrCreate(machinePath);
        Map<String, List<String>> user = readOrCreate(userPath);
        LOGGER.info("Loaded " + machine.size() + " machine and " + user.size() + " user solutions");
        return new SolutionStore(machinePath, userPath, machine, user);
    }

    public static SolutionStore load(AmanuensisConfig config) throws IOException {
        return load(config.machineSolutionPath(), config.userSolutionPath());
    }

    private static Map<String, List<String>> readOrCreate(Path path) throws IOException {
        if (Files.exists(path)) {
            Map<String, List<String>> map;
            try (InputStream in = Files.newInputStream(path)) {
                map = JsonMaps.read(in);
            }
            if (Files.size(path) > 0) {
                return map;
            }
        }
        Map<String, List<String>> empty = new LinkedHashMap<>();
        AtomicJsonWriter.write(path, empty);
        LOGGER.info("Created empty solution file " + path);
        return empty;
    }

    public Path machinePath() {
        return machinePath;
    }

    public Path userPath() {
        return userPath;
    }

    public synchronized List<String> machineValue(String key) {
        return copyOf(machine.get(key));
    }

    public synchronized List<String> userValue(String key) {
        return copyOf(user.get(key));
    }

    public synchronized Map<String, List<String>> machineSnapshot() {
        return snapshot(machine);
    }

    public synchronized Map<String, List<String>> userSnapshot() {
        return snapshot(user);
    }

    /**
     * Records an automatically chosen expansion. A key may collect several expansions.
     */
    public synchronized void addMachine(String key, String expansion) {
        add(machine, key, expansion);
    }

    /**
     * Records an expansion confirmed by a person.
     */
    public synchronized void addUser(String key, String expansion) {
        add(user, key, expansion);
    }

    public synchronized void setMachine(String key, List<String> value) {
        set(machine, key, value);
    }

    public synchronized void setUser(String key, List<String> value) {
        set(user, key, value);
    }

    /**
     * Writes both maps atomically.
     *
     * @throws IOException if either file cannot be written; the file on disk
     *                     then still holds its previous content
     */
    public void persist() throws IOException {
        Map<String, Object> machineJson;
        Map<String, Object> userJson;
        synchronized (this) {
            machineJson = JsonMaps.toJson(machine);
            userJson = JsonMaps.toJson(user);
        }
        AtomicJsonWriter.write(machinePath, machineJson);
        AtomicJsonWriter.write(userPath, userJson);
    }

    /**
     * Same as {@link #persist()} but logs instead of throwing.
     *
     * @return {@code false} if writing failed
     */
    public boolean persistQuietly() {
        try {
            persist();
            return true;
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Failed to save solutions to " + machinePath + " / " + userPath, e);
            return false;
        }
    }

    private static void add(Map<String, List<String>> map, String key, String expansion) {
        checkKey(key);
        if (expansion == null || expansion.trim().isEmpty()) {
            throw new IllegalArgumentException("expansion must not be empty");
        }
        List<String> values = map.computeIfAbsent(key, k -> new ArrayList<>());
        if (!values.contains(expansion)) {
            values.add(expansion);
        }
    }

    private static void set(Map<String, List<String>> map, String key, List<String> value) {
        checkKey(key);
        if (value == null || value.isEmpty()) {
            map.remove(key);
        } else {
            map.put(key, new ArrayList<>(value));
        }
    }

    private static void checkKey(String key) {
        if (key == null || key.isEmpty() || key.indexOf('<') >= 0) {
            throw new IllegalArgumentException("Not a canonical key: " + key);
        }
    }

    private static List<String> copyOf(List<String> values) {
        return values == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(values));
    }

    private static Map<String, List<String>> snapshot(Map<String, List<String>> map) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(k, Collections.unmodifiableList(new ArrayList<>(v))));
        return Collections.unmodifiableMap(copy);
    }
}
