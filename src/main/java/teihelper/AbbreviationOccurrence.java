package teihelper;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jsoup.nodes.Element;

import java.nio.file.Path;

/**
 * One abbreviation found in one document.
 *
 * <p>The record is immutable. Its context is captured once at discovery and is
 * not refreshed after expansions are written into the tree. The element and
 * parent references point into the owning {@link TeiDocument} and are only
 * meaningful while that document is alive.</p>
 */
public final class AbbreviationOccurrence {

    private final String rawText;
    private final String surfaceText;
    private final String key;
    private final MarkerKind kind;
    private final Element element;
    private final Element parent;
    private final TeiDocument document;
    private final Path file;
    private final String xpath;
    private final int line;
    private final int column;
    private final Context context;
    private final DocumentMetadata metadata;
    private final boolean alreadyExpanded;

    AbbreviationOccurrence(String rawText, String surfaceText, String key, MarkerKind kind,
                           Element element, Element parent, TeiDocument document, String xpath,
                           int line, int column, Context context, DocumentMetadata metadata,
                           boolean alreadyExpanded) {
        this.rawText = rawText;
        this.surfaceText = surfaceText;
        this.key = key;
        this.kind = kind;
        this.element = element;
        this.parent = parent;
        this.document = document;
        this.file = document == null ? null : document.source();
        this.xpath = xpath;
        this.line = line;
        this.column = column;
        this.context = context == null ? Context.EMPTY : context;
        this.metadata = metadata == null ? DocumentMetadata.EMPTY : metadata;
        this.alreadyExpanded = alreadyExpanded;
    }

    /**
     * Verbatim source text, possibly with inline markup.
     */
    @JsonProperty("abbreviation")
    public String getRawText() {
        return rawText;
    }

    /**
     * Visible text of the abbreviation as it reads in the flattened document.
     */
    @JsonIgnore
    public String getSurfaceText() {
        return surfaceText;
    }

    /**
     * Canonical key used for every lookup.
     */
    @JsonProperty("key")
    public String getKey() {
        return key;
    }

    @JsonProperty("kind")
    public MarkerKind getKind() {
        return kind;
    }

    /**
     * The live tree node. Only the processor edits the tree, so the node is
     * not handed out beyond this package.
     */
    Element getElement() {
        return element;
    }

    Element getParent() {
        return parent;
    }

    /**
     * The document this occurrence was found in.
     */
    @JsonIgnore
    public TeiDocument getDocument() {
        return document;
    }

    @JsonIgnore
    public Path getFile() {
        return file;
    }

    @JsonProperty("file")
    public String getFileName() {
        return file == null ? null : file.toString();
    }

    @JsonProperty("xpath")
    public String getXpath() {
        return xpath;
    }

    /**
     * Approximate source line, 0 when unknown.
     */
    @JsonProperty("line")
    public int getLine() {
        return line;
    }

    @JsonProperty("column")
    public int getColumn() {
        return column;
    }

    @JsonIgnore
    public Context getContext() {
        return context;
    }

    @JsonProperty("context_before")
    public String getContextBefore() {
        return context.before;
    }

    @JsonProperty("context_after")
    public String getContextAfter() {
        return context.after;
    }

    @JsonIgnore
    public DocumentMetadata getMetadata() {
        return metadata;
    }

    @JsonProperty("already_expanded")
    public boolean isAlreadyExpanded() {
        return alreadyExpanded;
    }

    @Override
    public String toString() {
        return key + " @ " + file + ":" + line;
    }
}
