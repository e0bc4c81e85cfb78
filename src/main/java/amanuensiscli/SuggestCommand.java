package amanuensiscli;

import amanuensis.AmanuensisConfig;
import amanuensis.SolutionStore;
import amanuensis.Suggestion;
import amanuensis.SuggestionResolver;
import amanuensis.UnicodeNormalizer;
import picocli.CommandLine.*;

import java.io.File;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Subcommand printing ranked suggestions for abbreviations.
 */
@Command(name = "suggest", description = "\033[1;34mShow ranked expansion suggestions\033[0m", mixinStandardHelpOptions = true)
public class SuggestCommand implements Runnable {

    @Option(names = {"-c", "--config"}, paramLabel = "<file>", description = "Configuration file (default: config.toml)")
    private File configFile;

    @Option(names = {"--stats"}, description = "Print suggestion statistics at the end")
    private boolean stats;

    @Parameters(paramLabel = "<abbreviation>", arity = "1..*", description = "Canonical keys or raw forms (e.g. co$cerning, ratiō)")
    private List<String> abbreviations;

    private static final Logger LOGGER = Logger.getLogger(SuggestCommand.class.getName());
    private static final String BLUE = "\033[1;34m";
    private static final String RESET = "\033[0m";

    @Override
    public void run() {
        try {
            AmanuensisConfig config = CliSupport.loadConfig(configFile, false);
            SolutionStore store = SolutionStore.load(config);
            SuggestionResolver resolver = SuggestionResolver.fromConfig(config, store);
            UnicodeNormalizer normalizer = new UnicodeNormalizer();

            for (String raw : abbreviations) {
                String key = normalizer.normalize(raw);
                System.out.println(BLUE + key + RESET);
                List<Suggestion> suggestions = resolver.suggest(key);
                if (suggestions.isEmpty()) {
                    System.out.println("  (no suggestions)");
                }
                for (int i = 0; i < suggestions.size(); i++) {
                    System.out.println("  " + (i + 1) + ". " + suggestions.get(i));
                }
            }
            if (stats) {
                System.out.println(resolver.statistics());
            }
        } catch (Exception ex) {
            LOGGER.log(Level.SEVERE, "Error while generating suggestions", ex);
            System.err.println("❌ Exception occurred: " + ex.getMessage());
            System.exit(1);
        }
    }
}
