package teihelper;

import org.jsoup.nodes.Element;

/**
 * How an abbreviation is encoded, decided once when the occurrence is found.
 */
public enum MarkerKind {
    /** {@code <abbr>} element. */
    EXPLICIT_ABBR,
    /** {@code <g ref="char:cmbAbbrStroke">}, a combining macron or stroke. */
    COMBINING_MACRON,
    /** {@code <g ref="char:abque">}, the -que suspension. */
    SUSPENSION,
    /** Any other abbreviation mark ({@code <am>} without a known glyph, other configured refs). */
    OTHER_MARK;

    static final String STROKE_REF = "char:cmbAbbrStroke";
    static final String ABQUE_REF = "char:abque";

    static MarkerKind ofGlyph(Element g) {
        String ref = g.attr("ref");
        if (STROKE_REF.equals(ref)) return COMBINING_MACRON;
        if (ABQUE_REF.equals(ref)) return SUSPENSION;
        return OTHER_MARK;
    }
}
