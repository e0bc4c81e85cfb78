package teihelper;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Bibliographic data from the TEI header, shared read-only by every
 * occurrence of one document.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DocumentMetadata {

    public static final DocumentMetadata EMPTY = new DocumentMetadata(null, null, null, null, null, null);

    private final String title;
    private final String author;
    private final String date;
    private final String language;
    private final String source;
    private final String genre;

    public DocumentMetadata(String title, String author, String date, String language, String source, String genre) {
        this.title = title;
        this.author = author;
        this.date = date;
        this.language = language;
        this.source = source;
        this.genre = genre;
    }

    /**
     * Reads the {@code teiHeader} below {@code root}. Missing fields stay {@code null}.
     */
    static DocumentMetadata fromHeader(Element root) {
        if (root == null) return EMPTY;
        Element header = TeiNames.is(root, "teiHeader") ? root : TeiNames.first(root, "teiHeader");
        if (header == null) return EMPTY;

        String title = text(TeiNames.first(header, "titleStmt", "title"));
        String author = text(TeiNames.first(header, "titleStmt", "author"));

        String date = text(TeiNames.first(header, "publicationStmt", "date"));
        if (date == null) {
            Element d = TeiNames.first(header, "sourceDesc", "date");
            if (d != null) {
                date = d.hasAttr("when") ? d.attr("when") : text(d);
            }
        }

        String language = null;
        Element lang = TeiNames.first(header, "profileDesc", "langUsage", "language");
        if (lang != null && lang.hasAttr("ident")) {
            language = lang.attr("ident");
        }

        String source = text(TeiNames.first(header, "sourceDesc", "bibl"));

        String genre = null;
        Element textClass = TeiNames.first(header, "textClass");
        if (textClass != null) {
            List<String> terms = new ArrayList<>();
            for (Element term : TeiNames.descendants(textClass, "term")) {
                String t = text(term);
                if (t != null) terms.add(t);
                if (terms.size() == 3) break;
            }
            genre = terms.isEmpty() ? null : String.join(", ", terms);
        }

        return new DocumentMetadata(title, author, date, language, source, genre);
    }

    private static String text(Element e) {
        if (e == null) return null;
        String t = e.text().trim();
        return t.isEmpty() ? null : t;
    }

    @JsonProperty("title")
    public String getTitle() {
        return title;
    }

    @JsonProperty("author")
    public String getAuthor() {
        return author;
    }

    @JsonProperty("date")
    public String getDate() {
        return date;
    }

    @JsonProperty("language")
    public String getLanguage() {
        return language;
    }

    @JsonProperty("source")
    public String getSource() {
        return source;
    }

    @JsonProperty("genre")
    public String getGenre() {
        return genre;
    }

    @Override
    public String toString() {
        return "DocumentMetadata{title=" + title + ", author=" + author + ", date=" + date + "}";
    }
}
