package amanuensis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Application configuration, read from a TOML file.
 *
 * <p>Every option has a default, so an absent file or section is valid.
 * Sections mirror the file layout:</p>
 * <pre>
 * [paths]                      input_path, output_path
 * [data]                       machine_solution_path, user_solution_path, ...
 * [xml_processing]             tei_namespace, abbr_element, context_window_size, ...
 * [settings]                   skip_expanded, normalize_abbreviations, use_wordnet, ...
 * [ambiguity]                  ambiguous_aws
 * [language_model_integration] enabled, provider, model
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AmanuensisConfig {
    private static final Logger LOGGER = Logger.getLogger(AmanuensisConfig.class.getName());

    public static final String DEFAULT_FILE = "config.toml";

    @JsonProperty("paths")
    public PathsSection paths = new PathsSection();

    @JsonProperty("data")
    public DataSection data = new DataSection();

    @JsonProperty("xml_processing")
    public XmlProcessing xml = new XmlProcessing();

    @JsonProperty("settings")
    public Settings settings = new Settings();

    @JsonProperty("ambiguity")
    public Ambiguity ambiguity = new Ambiguity();

    @JsonProperty("language_model_integration")
    public LanguageModelIntegration languageModel = new LanguageModelIntegration();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PathsSection {
        @JsonProperty("input_path")
        public String inputPath = "data/input";

        @JsonProperty("output_path")
        public String outputPath = "data/output";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DataSection {
        @JsonProperty("machine_solution_path")
        public String machineSolutionPath = "data/machine_solution.json";

        @JsonProperty("user_solution_path")
        public String userSolutionPath = "data/user_solution.json";

        @JsonProperty("difficult_passages_path")
        public String difficultPassagesPath = "data/difficult_passages.json";

        @JsonProperty("unresolved_aws_path")
        public String unresolvedPath = "data/unresolved_aw.json";

        @JsonProperty("abbreviation_dictionary_path")
        public String dictionaryPath = "data/abbreviation_dictionary.json";

        @JsonProperty("dataset_dir")
        public String datasetDir = "data/datasets";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class XmlProcessing {
        @JsonProperty("tei_namespace")
        public String teiNamespace = "http://www.tei-c.org/ns/1.0";

        /**
         * Local names, matched regardless of namespace prefix.
         */
        @JsonProperty("abbr_element")
        public String abbrElement = "abbr";

        @JsonProperty("expan_element")
        public String expanElement = "expan";

        @JsonProperty("choice_element")
        public String choiceElement = "choice";

        @JsonProperty("marker_refs")
        public List<String> markerRefs = new ArrayList<>(Arrays.asList("char:cmbAbbrStroke", "char:abque"));

        @JsonProperty("context_window_size")
        public int contextWindowSize = 50;

        @JsonProperty("include_ancestor_context")
        public boolean includeAncestorContext = true;

        @JsonProperty("use_choice_tags")
        public boolean useChoiceTags = false;

        @JsonProperty("add_xml_ids")
        public boolean addXmlIds = true;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Settings {
        @JsonProperty("skip_expanded")
        public boolean skipExpanded = false;

        @JsonProperty("normalize_abbreviations")
        public boolean normalizeAbbreviations = true;

        @JsonProperty("use_wordnet")
        public boolean useWordnet = true;

        /**
         * WordNet {@code dict} directory; the tier is off when unset.
         */
        @JsonProperty("wordnet_path")
        public String wordnetPath;

        /**
         * Maximum suggestions shown per occurrence, 0 for all.
         */
        @JsonProperty("suggestion_count")
        public int suggestionCount = 0;

        @JsonProperty("workers")
        public int workers = 1;

        @JsonProperty("logging_level")
        public String loggingLevel = "WARNING";

        @JsonProperty("log_file")
        public String logFile = "logs/amanuensis.log";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Ambiguity {
        @JsonProperty("ambiguous_aws")
        public List<String> ambiguousKeys = new ArrayList<>(Arrays.asList("the$", "ope$", "Roma$"));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LanguageModelIntegration {
        @JsonProperty("enabled")
        public boolean enabled = false;

        @JsonProperty("provider")
        public String provider;

        @JsonProperty("model")
        public String model;
    }

    /**
     * Configuration with every option at its default.
     *
     * @return a new default configuration
     */
    public static AmanuensisConfig defaults() {
        return new AmanuensisConfig();
    }

    /**
     * Reads and validates a TOML configuration file. A missing file yields the defaults.
     *
     * @param file configuration file
     * @return the loaded configuration
     * @throws IOException              if the file exists but cannot be read or parsed
     * @throws IllegalArgumentException if an option has an invalid value
     */
    public static AmanuensisConfig load(Path file) throws IOException {
        if (file == null || !Files.exists(file)) {
            LOGGER.info("No configuration file at " + file + ", using defaults");
            return defaults().validate();
        }
        TomlMapper mapper = new TomlMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);
        AmanuensisConfig config = mapper.readValue(file.toFile(), AmanuensisConfig.class);
        return config.validate();
    }

    /**
     * Checks option values.
     *
     * @return this configuration
     * @throws IllegalArgumentException on the first invalid value
     */
    public AmanuensisConfig validate() {
        if (xml.contextWindowSize < 0) {
            throw new IllegalArgumentException("context_window_size must be >= 0, got " + xml.contextWindowSize);
        }
        if (settings.workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1, got " + settings.workers);
        }
        if (settings.suggestionCount < 0) {
            throw new IllegalArgumentException("suggestion_count must be >= 0, got " + settings.suggestionCount);
        }
        requireName("abbr_element", xml.abbrElement);
        requireName("expan_element", xml.expanElement);
        requireName("choice_element", xml.choiceElement);
        if (AmanuensisLevels.parse(settings.loggingLevel) == null) {
            throw new IllegalArgumentException("Unknown logging_level: " + settings.loggingLevel);
        }
        return this;
    }

    private static void requireName(String option, String value) {
        if (value == null || !value.matches("[A-Za-z_][\\w.-]*")) {
            throw new IllegalArgumentException(option + " must be an element name, got " + value);
        }
    }

    public Set<String> ambiguousKeys() {
        return new LinkedHashSet<>(ambiguity.ambiguousKeys == null ? List.of() : ambiguity.ambiguousKeys);
    }

    public Path inputPath() {
        return Paths.get(paths.inputPath);
    }

    public Path outputPath() {
        return Paths.get(paths.outputPath);
    }

    public Path machineSolutionPath() {
        return Paths.get(data.machineSolutionPath);
    }

    public Path userSolutionPath() {
        return Paths.get(data.userSolutionPath);
    }

    public Path difficultPassagesPath() {
        return Paths.get(data.difficultPassagesPath);
    }

    public Path unresolvedPath() {
        return Paths.get(data.unresolvedPath);
    }

    public Path dictionaryPath() {
        return data.dictionaryPath == null ? null : Paths.get(data.dictionaryPath);
    }

    public Path datasetDir() {
        return Paths.get(data.datasetDir);
    }

    public Path wordnetPath() {
        return settings.wordnetPath == null || settings.wordnetPath.trim().isEmpty()
                ? null : Paths.get(settings.wordnetPath);
    }
}
