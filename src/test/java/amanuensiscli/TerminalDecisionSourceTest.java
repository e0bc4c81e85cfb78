package amanuensiscli;

import amanuensis.Decision;
import amanuensis.Suggestion;
import amanuensis.SuggestionSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import teihelper.AbbreviationOccurrence;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TerminalDecisionSourceTest {

    private final List<Suggestion> suggestions = Arrays.asList(
            new Suggestion("concerning", 0.5, SuggestionSource.PATTERN),
            new Suggestion("comcerning", 0.4, SuggestionSource.PATTERN));

    private AbbreviationOccurrence occurrence;
    private ByteArrayOutputStream console;

    @BeforeEach
    void setUp() {
        occurrence = mock(AbbreviationOccurrence.class);
        when(occurrence.getKey()).thenReturn("co$cerning");
        when(occurrence.getFileName()).thenReturn("letter.xml");
        when(occurrence.getSurfaceText()).thenReturn("cocerning");
        when(occurrence.getContextBefore()).thenReturn("A letter");
        when(occurrence.getContextAfter()).thenReturn("the gardens");
        console = new ByteArrayOutputStream();
    }

    private Decision answer(String input, List<Suggestion> offered) {
        TerminalDecisionSource source = new TerminalDecisionSource(
                new BufferedReader(new StringReader(input)), new PrintStream(console, true));
        return source.requestDecision(occurrence, offered);
    }

    private String printed() {
        return new String(console.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    void numberPicksThatSuggestion() {
        Decision d = answer("2\n", suggestions);

        assertEquals(Decision.Kind.ACCEPT, d.getKind());
        assertEquals("comcerning", d.getExpansion());
        assertTrue(printed().contains("[cocerning]"));
    }

    @Test
    void enterPicksTheFirstOrSkipsWhenThereIsNone() {
        assertEquals("concerning", answer("\n", suggestions).getExpansion());
        assertEquals(Decision.Kind.SKIP, answer("\n", Collections.emptyList()).getKind());
    }

    @Test
    void invalidAnswersAreAskedAgain() {
        Decision d = answer("9\nzz\nd\n", suggestions);

        assertEquals(Decision.Kind.DIFFICULT, d.getKind());
        assertTrue(printed().contains("Invalid choice: 9"));
        assertTrue(printed().contains("Invalid choice: zz"));
    }

    @Test
    void customExpansion() {
        Decision d = answer("c\nconcerning\n", suggestions);

        assertEquals(SuggestionSource.CUSTOM, d.getSource());
        assertEquals("concerning", d.getExpansion());
    }

    @Test
    void implausibleCustomNeedsConfirmation() {
        Decision rejected = answer("c\nbanana\nn\ns\n", suggestions);
        assertEquals(Decision.Kind.SKIP, rejected.getKind());

        Decision kept = answer("c\nbanana\ny\n", suggestions);
        assertEquals("banana", kept.getExpansion());
    }

    @Test
    void endOfInputQuits() {
        assertEquals(Decision.Kind.QUIT, answer("", suggestions).getKind());
        assertEquals(Decision.Kind.QUIT, answer("q\n", suggestions).getKind());
    }
}
