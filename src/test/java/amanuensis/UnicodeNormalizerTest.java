package amanuensis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class UnicodeNormalizerTest {

    private final UnicodeNormalizer normalizer = new UnicodeNormalizer();

    @Test
    @DisplayName("Stroke markup, combining macron, precomposed vowel and literal $ converge on one key")
    void encodingsConverge() {
        String markup = "Eleophyllu<g ref=\"char:cmbAbbrStroke\">\u0304</g>";
        String combining = "Eleophyllu\u0304";
        String precomposed = "Eleophyll\u016B";
        String literal = "Eleophyllu$";

        assertEquals("Eleophyllu$", normalizer.normalize(markup));
        assertEquals("Eleophyllu$", normalizer.normalize(combining));
        assertEquals("Eleophyllu$", normalizer.normalize(precomposed));
        assertEquals("Eleophyllu$", normalizer.normalize(literal));
    }

    @Test
    void strokeMarkupInsideAmAndWithPrefix() {
        assertEquals("co$cerning", normalizer.normalize(
                "co<am><tei:g ref=\"char:cmbAbbrStroke\"/></am>cerning"));
        assertEquals("co$cerning", normalizer.normalize("co<g ref='char:cmbAbbrStroke'/>cerning"));
    }

    @Test
    void strokeWithoutBaseLetterBecomesBareMarker() {
        assertEquals("$cerning", normalizer.normalize("<g ref=\"char:cmbAbbrStroke\"/>cerning"));
    }

    @Test
    void suspensionMarkupBecomesQ() {
        assertEquals("populusq$", normalizer.normalize("populus<g ref=\"char:abque\"/>"));
    }

    @Test
    void precomposedTildeAndUpperCase() {
        assertEquals("ratio$", normalizer.normalize("rati\u00F5"));
        assertEquals("ca$", normalizer.normalize("c\u00E3"));
        assertEquals("A$nus", normalizer.normalize("\u0100nus"));
        assertEquals("ma$ner", normalizer.normalize("ma\u00F1er"));
    }

    @Test
    void independentMarkersAreEachNormalized() {
        assertEquals("co$ce$t", normalizer.normalize("co\u0304ce\u0304t"));
        assertEquals("a$b$", normalizer.normalize("a<g ref=\"char:cmbAbbrStroke\"/>b<g ref=\"char:cmbAbbrStroke\"/>"));
    }

    @Test
    void trailingPeriodAbbreviation() {
        assertEquals("Ill$mo", normalizer.normalize("Ill.mo"));
        assertEquals("etc.", normalizer.normalize("etc."));
    }

    @Test
    void residualMarkupAndWhitespaceAreRemoved() {
        assertEquals("ye", normalizer.normalize("  <hi rend=\"sup\">y</hi>e \n"));
        assertEquals("a&b", normalizer.normalize("a&amp;b<lb/>"));
        assertEquals("a&amp;b", normalizer.normalize("a&amp;b"));
        assertEquals("", normalizer.normalize(null));
    }

    @Test
    void escapedMarkupIsDecodedOnce() {
        String once = normalizer.normalize("<hi>a &amp;lt; b</hi>");

        assertEquals("a &lt; b", once);
        assertEquals("a &lt; b", normalizer.normalize(once));
        assertEquals("R&amp;gt", normalizer.normalize("R&amp;gt"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Eleophyllu<g ref=\"char:cmbAbbrStroke\">\u0304</g>",
            "co\u0304cerning",
            "rati\u00F5",
            "Ill.mo",
            "populus<g ref=\"char:abque\"/>",
            "a &lt;b&gt; c",
            "a &amp;lt; b",
            "&amp;amp;",
            "R&amp;gt",
            "a &amp;lt; b<lb/>",
            "<hi>&amp;amp;</hi>",
            "plain text",
            "Eleophyllu$"
    })
    void normalizeIsIdempotent(String raw) {
        String once = normalizer.normalize(raw);
        assertEquals(once, normalizer.normalize(once));
    }

    @Test
    void countersTrackRules() {
        UnicodeNormalizer counting = new UnicodeNormalizer();
        counting.normalize("co\u0304cerning");
        counting.normalize("rati\u00F5");
        counting.normalize("plain");

        assertEquals(1L, counting.counts().get(UnicodeNormalizer.Rule.COMBINING_MACRON));
        assertEquals(1L, counting.counts().get(UnicodeNormalizer.Rule.PRECOMPOSED));
        assertEquals(0L, counting.counts().get(UnicodeNormalizer.Rule.STROKE_MARKUP));
    }

    @Test
    void markerCount() {
        assertEquals(2, UnicodeNormalizer.markerCount("co$ce$t"));
        assertEquals(0, UnicodeNormalizer.markerCount("ye"));
    }
}
