package amanuensiscli;

import amanuensis.Decision;
import amanuensis.DecisionSource;
import amanuensis.Suggestion;
import amanuensis.SuggestionResolver;
import teihelper.AbbreviationOccurrence;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;

/**
 * Asks the person at the terminal. Answers: a suggestion number (Enter picks
 * the first), {@code c} to type an expansion, {@code s} to skip, {@code d} to
 * flag the passage as difficult, {@code q} to quit. End of input quits.
 */
class TerminalDecisionSource implements DecisionSource {
    private static final String BLUE = "\033[1;34m";
    private static final String RESET = "\033[0m";

    private final BufferedReader in;
    private final PrintStream out;

    TerminalDecisionSource(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public boolean isInteractive() {
        return true;
    }

    @Override
    public Decision requestDecision(AbbreviationOccurrence occ, List<Suggestion> suggestions) {
        out.println();
        out.println(BLUE + occ.getFileName() + ":" + occ.getLine() + RESET + "  key " + occ.getKey());
        out.println("  ..." + occ.getContextBefore() + " [" + occ.getSurfaceText() + "] " + occ.getContextAfter() + "...");
        for (int i = 0; i < suggestions.size(); i++) {
            out.println("  " + (i + 1) + ". " + suggestions.get(i));
        }
        if (suggestions.isEmpty()) {
            out.println("  (no suggestions)");
        }

        while (true) {
            out.print("Choose [1-" + suggestions.size() + "], c=custom, s=skip, d=difficult, q=quit: ");
            String answer = readLine();
            if (answer == null) {
                return Decision.quit();
            }
            answer = answer.trim().toLowerCase(Locale.ROOT);
            if (answer.isEmpty()) {
                return suggestions.isEmpty() ? Decision.skip() : Decision.accept(suggestions.get(0));
            }
            switch (answer) {
                case "s":
                    return Decision.skip();
                case "d":
                    return Decision.difficult();
                case "q":
                    return Decision.quit();
                case "c":
                    Decision custom = askCustom(occ.getKey());
                    if (custom != null) return custom;
                    continue;
                default:
                    break;
            }
            if (answer.matches("\\d{1,4}")) {
                int n = Integer.parseInt(answer);
                if (n >= 1 && n <= suggestions.size()) {
                    return Decision.accept(suggestions.get(n - 1));
                }
            }
            out.println("❌ Invalid choice: " + answer);
        }
    }

    private Decision askCustom(String key) {
        out.print("Expansion: ");
        String text = readLine();
        if (text == null || text.trim().isEmpty()) {
            return null;
        }
        if (!SuggestionResolver.isPlausible(key, text)) {
            out.print("ℹ️ '" + text.trim() + "' looks unlike " + key + ". Keep it? [y/N]: ");
            String confirm = readLine();
            if (confirm == null || !confirm.trim().toLowerCase(Locale.ROOT).startsWith("y")) {
                return null;
            }
        }
        return Decision.custom(text);
    }

    private String readLine() {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
