package amanuensiscli;

import amanuensis.AmanuensisConfig;
import amanuensis.ConflictRecord;
import amanuensis.ConflictResolver;
import amanuensis.SolutionStore;
import picocli.CommandLine.*;

import java.io.BufferedReader;
import java.io.File;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Subcommand reconciling the machine and user solution files.
 */
@Command(name = "conflicts", description = "\033[1;34mResolve conflicts between machine and user solutions\033[0m", mixinStandardHelpOptions = true)
public class ConflictsCommand implements Runnable {

    @Option(names = {"-c", "--config"}, paramLabel = "<file>", description = "Configuration file (default: config.toml)")
    private File configFile;

    @Option(names = {"-l", "--list"}, description = "Only list conflicts")
    private boolean listOnly;

    private static final Logger LOGGER = Logger.getLogger(ConflictsCommand.class.getName());

    @Override
    public void run() {
        try {
            AmanuensisConfig config = CliSupport.loadConfig(configFile, false);
            SolutionStore store = SolutionStore.load(config);
            ConflictResolver resolver = new ConflictResolver(store, config.ambiguousKeys());

            List<ConflictRecord> conflicts = resolver.detectConflicts();
            if (conflicts.isEmpty()) {
                System.err.println("✅ No conflicts between " + store.machinePath() + " and " + store.userPath());
                return;
            }
            if (listOnly) {
                conflicts.forEach(c -> System.out.println(c));
                System.err.println("ℹ️ " + conflicts.size() + " conflict(s)");
                return;
            }

            int resolved = resolver.resolveAll(new TerminalConflictDecisionSource(
                    new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out));
            System.err.println("✅ Resolved " + resolved + " of " + conflicts.size() + " conflict(s)");
        } catch (Exception ex) {
            LOGGER.log(Level.SEVERE, "Error during conflict resolution", ex);
            System.err.println("❌ Exception occurred: " + ex.getMessage());
            System.exit(1);
        }
    }
}
