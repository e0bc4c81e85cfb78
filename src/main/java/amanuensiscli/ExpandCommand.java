package amanuensiscli;

import amanuensis.AmanuensisConfig;
import amanuensis.DecisionSource;
import amanuensis.ExpansionSession;
import amanuensis.HighestConfidenceDecisionSource;
import amanuensis.SolutionStore;
import amanuensis.SuggestionResolver;
import picocli.CommandLine.*;

import java.io.BufferedReader;
import java.io.File;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Subcommand expanding abbreviations in TEI documents.
 */
@Command(name = "expand", description = "\033[1;34mExpand abbreviations in TEI documents\033[0m", mixinStandardHelpOptions = true)
public class ExpandCommand implements Runnable {

    @Option(names = {"-c", "--config"}, paramLabel = "<file>", description = "Configuration file (default: config.toml)")
    private File configFile;

    @Option(names = {"-i", "--input"}, paramLabel = "<path>", description = "Input TEI file or directory (overrides paths.input_path)")
    private File input;

    @Option(names = {"-o", "--output"}, paramLabel = "<dir>", description = "Output directory (overrides paths.output_path)")
    private File output;

    @Option(names = {"-a", "--auto"}, description = "Accept the highest-confidence suggestion without asking")
    private boolean auto;

    @Option(names = {"--min-confidence"}, paramLabel = "<0..1>", defaultValue = "0.0",
            description = "Minimum confidence for automatic acceptance (default: 0.0)")
    private double minConfidence;

    @Option(names = {"-w", "--workers"}, paramLabel = "<n>", description = "Parallel workers in --auto mode (overrides settings.workers)")
    private Integer workers;

    @Option(names = {"-v", "--verbose"}, description = "Verbose console logging")
    private boolean verbose;

    private static final Logger LOGGER = Logger.getLogger(ExpandCommand.class.getName());

    @Override
    public void run() {
        try {
            AmanuensisConfig config = CliSupport.loadConfig(configFile, verbose);
            if (workers != null) {
                config.settings.workers = workers;
                config.validate();
            }
            Path in = input != null ? input.toPath() : config.inputPath();
            Path out = output != null ? output.toPath() : config.outputPath();
            if (!Files.exists(in)) {
                System.err.println("❌ Input not found: " + in.toAbsolutePath());
                System.exit(1);
            }

            SolutionStore store = SolutionStore.load(config);
            SuggestionResolver resolver = SuggestionResolver.fromConfig(config, store);
            DecisionSource decisions = auto
                    ? new HighestConfidenceDecisionSource(minConfidence)
                    : new TerminalDecisionSource(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);

            ExpansionSession session = new ExpansionSession(config, store, resolver, decisions);
            Thread flushOnExit = new Thread(session::flush, "amanuensis-flush");
            Runtime.getRuntime().addShutdownHook(flushOnExit);

            ConsoleProgressBar bar = new ConsoleProgressBar(40);
            ExpansionSession.Summary summary = session.run(in, out, auto ? bar::update : null);
            Runtime.getRuntime().removeShutdownHook(flushOnExit);

            System.err.println("✅ " + summary);
            System.err.println("ℹ️ Documents: " + session.processorStats());
            System.err.println("ℹ️ Suggestions: " + resolver.statistics());
            if (session.datasetFile() != null) {
                System.err.println("📁 Dataset saved to: " + session.datasetFile().toAbsolutePath());
            }
            System.err.println("📁 Output saved to: " + out.toAbsolutePath());
            if (summary.documentsFailed > 0) {
                System.exit(1);
            }
        } catch (IllegalArgumentException ex) {
            System.err.println("❌ Invalid configuration: " + ex.getMessage());
            System.exit(2);
        } catch (Exception ex) {
            LOGGER.log(Level.SEVERE, "Error during expansion", ex);
            System.err.println("❌ Exception occurred: " + ex.getMessage());
            System.exit(1);
        }
    }
}
