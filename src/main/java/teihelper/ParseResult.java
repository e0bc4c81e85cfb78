package teihelper;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of {@link TeiDocumentProcessor#parse(java.nio.file.Path)}.
 * A failed parse has no document and no occurrences.
 */
public final class ParseResult {
    public final List<AbbreviationOccurrence> occurrences;
    public final TeiDocument document;

    ParseResult(List<AbbreviationOccurrence> occurrences, TeiDocument document) {
        this.occurrences = Collections.unmodifiableList(occurrences);
        this.document = document;
    }

    static ParseResult failed() {
        return new ParseResult(Collections.emptyList(), null);
    }

    public boolean isParsed() {
        return document != null;
    }
}
