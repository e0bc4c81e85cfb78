package amanuensiscli;

import amanuensis.UnicodeNormalizer;
import picocli.CommandLine.*;

import java.util.List;

/**
 * Subcommand printing canonical keys, handy for checking dictionary entries.
 */
@Command(name = "normalize", description = "\033[1;34mPrint canonical keys for raw abbreviations\033[0m", mixinStandardHelpOptions = true)
public class NormalizeCommand implements Runnable {

    @Parameters(paramLabel = "<text>", arity = "1..*", description = "Raw forms, inline markup allowed")
    private List<String> texts;

    @Spec
    private picocli.CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        UnicodeNormalizer normalizer = new UnicodeNormalizer();
        for (String text : texts) {
            spec.commandLine().getOut().println(text + "\t" + normalizer.normalize(text));
        }
    }
}
