package amanuensiscli;

import amanuensis.ConflictDecision;
import amanuensis.ConflictRecord;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class TerminalConflictDecisionSourceTest {

    private final ConflictRecord conflict = new ConflictRecord("p$",
            Collections.singletonList("par"), Collections.singletonList("per"));
    private final ByteArrayOutputStream console = new ByteArrayOutputStream();

    private ConflictDecision answer(String input) {
        return new TerminalConflictDecisionSource(new BufferedReader(new StringReader(input)),
                new PrintStream(console, true)).decide(conflict);
    }

    @Test
    void letterOrWordSelectsTheSide() {
        assertEquals(ConflictDecision.MACHINE, answer("m\n"));
        assertEquals(ConflictDecision.USER, answer("user\n"));
    }

    @Test
    void invalidAnswerIsAskedAgain() {
        assertEquals(ConflictDecision.SKIP, answer("x\ns\n"));
        assertTrue(new String(console.toByteArray(), StandardCharsets.UTF_8).contains("Invalid choice: x"));
    }

    @Test
    void endOfInputSkips() {
        assertEquals(ConflictDecision.SKIP, answer(""));
    }
}
