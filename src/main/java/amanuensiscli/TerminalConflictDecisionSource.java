package amanuensiscli;

import amanuensis.ConflictDecision;
import amanuensis.ConflictDecisionSource;
import amanuensis.ConflictRecord;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;

/**
 * Asks which side of a conflict wins: {@code m}achine, {@code u}ser or {@code s}kip.
 * End of input skips.
 */
class TerminalConflictDecisionSource implements ConflictDecisionSource {

    private final BufferedReader in;
    private final PrintStream out;

    TerminalConflictDecisionSource(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public ConflictDecision decide(ConflictRecord conflict) {
        out.println();
        out.println("Conflict for " + conflict.key);
        out.println("  machine: " + String.join(" | ", conflict.machineValue));
        out.println("  user:    " + String.join(" | ", conflict.userValue));
        while (true) {
            out.print("Keep [m]achine, [u]ser or [s]kip: ");
            String answer;
            try {
                answer = in.readLine();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            if (answer == null) {
                return ConflictDecision.SKIP;
            }
            ConflictDecision decision = ConflictDecision.fromStr(answer);
            if (decision != null) {
                return decision;
            }
            out.println("❌ Invalid choice: " + answer.trim());
        }
    }
}
