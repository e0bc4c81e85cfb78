package amanuensiscli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "amanuensis",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "\033[1;34mAbbreviation expansion for early-modern TEI documents\033[0m",
        subcommands = {
                ExpandCommand.class,
                SuggestCommand.class,
                ConflictsCommand.class,
                NormalizeCommand.class
        }
)
public class Main implements Runnable {

    @Override
    public void run() {
        // Called when no subcommand is provided
        System.out.println("Use --help or a subcommand (expand / suggest / conflicts / normalize)");
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
