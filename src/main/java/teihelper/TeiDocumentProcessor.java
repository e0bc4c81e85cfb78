package teihelper;

import amanuensis.AmanuensisConfig;
import amanuensis.UnicodeNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.Range;
import org.jsoup.parser.Parser;

import javax.xml.stream.XMLStreamException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Finds abbreviations in TEI documents and writes expansions back.
 *
 * <p>Per document the lifecycle is: {@link #parse(Path)} builds the tree and
 * the occurrences, {@link #addExpansion(AbbreviationOccurrence, String)} edits
 * the tree once per accepted expansion, and {@link #save(TeiDocument, Path)}
 * writes it out. None of these methods throws; failures are logged and
 * reported through the return value.</p>
 *
 * <p>Two kinds of markup are collected:</p>
 * <ul>
 *     <li>explicit {@code <abbr>} elements;</li>
 *     <li>abbreviation marks ({@code <g ref="char:cmbAbbrStroke">}, {@code <g ref="char:abque">},
 *     bare {@code <am>}) outside any {@code <expan>} and {@code <abbr>}. For these the
 *     occurrence covers the whole word around the mark.</li>
 * </ul>
 *
 * <p>An instance is meant for one worker thread; counters are thread-safe.</p>
 */
public class TeiDocumentProcessor {
    private static final Logger LOGGER = Logger.getLogger(TeiDocumentProcessor.class.getName());

    private final String teiNamespace;
    private final String abbrName;
    private final String expanName;
    private final String choiceName;
    private final Set<String> markerRefs;
    private final Set<String> phraseElements;
    private final boolean useChoiceTags;
    private final boolean addIds;
    private final boolean skipExpanded;
    private final boolean normalize;

    private final UnicodeNormalizer normalizer;
    private final ContextExtractor extractor;
    private final ProcessorStats stats = new ProcessorStats();

    public TeiDocumentProcessor(AmanuensisConfig config) {
        this(config, new UnicodeNormalizer());
    }

    public TeiDocumentProcessor(AmanuensisConfig config, UnicodeNormalizer normalizer) {
        this.teiNamespace = config.xml.teiNamespace;
        this.abbrName = config.xml.abbrElement;
        this.expanName = config.xml.expanElement;
        this.choiceName = config.xml.choiceElement;
        this.markerRefs = new HashSet<>(config.xml.markerRefs);
        this.phraseElements = new HashSet<>(TeiDocument.PHRASE_ELEMENTS);
        this.phraseElements.addAll(Arrays.asList(abbrName, expanName, choiceName));
        this.useChoiceTags = config.xml.useChoiceTags;
        this.addIds = config.xml.addXmlIds;
        this.skipExpanded = config.settings.skipExpanded;
        this.normalize = config.settings.normalizeAbbreviations;
        this.normalizer = normalizer;
        this.extractor = new ContextExtractor(config.xml.contextWindowSize, config.xml.includeAncestorContext);
    }

    public ProcessorStats stats() {
        return stats;
    }

    // ---------------------------- parse ----------------------------

    /**
     * Parses a document and collects its abbreviation occurrences. The
     * character set comes from a byte order mark or the encoding named in the
     * XML declaration, UTF-8 when neither is present.
     *
     * @param path TEI file
     * @return the occurrences and the tree; an empty, failed result when the
     * file cannot be read or is not well-formed XML
     */
    public ParseResult parse(Path path) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Cannot read " + path, e);
            return ParseResult.failed();
        }

        try {
            XmlWellFormedness.check(bytes);
        } catch (XMLStreamException e) {
            stats.malformed.incrementAndGet();
            LOGGER.log(Level.WARNING, "Malformed XML in " + path + ": " + e.getMessage());
            return ParseResult.failed();
        }

        try {
            Parser parser = Parser.xmlParser().setTrackPosition(true);
            Document doc = Jsoup.parse(new ByteArrayInputStream(bytes), null, "", parser);
            TeiDocument tree = new TeiDocument(doc, path, phraseElements);

            List<AbbreviationOccurrence> occurrences = collect(tree);
            stats.documentsProcessed.incrementAndGet();
            LOGGER.fine(() -> "Found " + occurrences.size() + " abbreviations in " + path);
            return new ParseResult(occurrences, tree);
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Failed to process " + path, e);
            return ParseResult.failed();
        }
    }

    private List<AbbreviationOccurrence> collect(TeiDocument tree) {
        List<AbbreviationOccurrence> out = new ArrayList<>();
        Element root = tree.root();
        if (root == null) {
            return out;
        }
        String ns = root.attr("xmlns");
        if (teiNamespace != null && !ns.isEmpty() && !ns.equals(teiNamespace)) {
            LOGGER.warning(tree.source() + " declares namespace " + ns + ", not " + teiNamespace
                    + "; elements are matched by local name anyway");
        }
        DocumentMetadata metadata = DocumentMetadata.fromHeader(root);

        for (Element e : root.getAllElements()) {
            AbbreviationOccurrence occ = null;
            if (TeiNames.is(e, abbrName)) {
                occ = explicitAbbreviation(e, tree, metadata);
            } else if (TeiNames.is(e, "g") && markerRefs.contains(e.attr("ref")) && isFreeMark(e)) {
                occ = mark(e, MarkerKind.ofGlyph(e), tree, metadata);
            } else if (TeiNames.is(e, "am") && isFreeMark(e) && !containsMarkerGlyph(e)) {
                occ = mark(e, MarkerKind.OTHER_MARK, tree, metadata);
            }
            if (occ != null) {
                out.add(occ);
                stats.abbreviationsFound.incrementAndGet();
            }
        }
        return out;
    }

    private AbbreviationOccurrence explicitAbbreviation(Element abbr, TeiDocument tree, DocumentMetadata metadata) {
        String surface = ContextExtractor.visibleText(abbr);
        if (surface.isEmpty() && abbr.children().isEmpty()) {
            return null;
        }
        boolean expanded = isAlreadyExpanded(abbr);
        if (expanded) {
            stats.alreadyExpanded.incrementAndGet();
            if (skipExpanded) return null;
        }

        // without child elements the content is plain text, entities decoded
        String raw = abbr.children().isEmpty() ? abbr.wholeText().trim() : TeiDocument.innerXml(abbr).trim();
        String key = canonicalKey(raw);
        if (key.isEmpty()) {
            return null;
        }
        Context context = extractor.extract(abbr, surface, 0, key, tree);
        return occurrence(raw, surface, key, MarkerKind.EXPLICIT_ABBR, abbr, tree, context, metadata, expanded);
    }

    private AbbreviationOccurrence mark(Element mark, MarkerKind kind, TeiDocument tree, DocumentMetadata metadata) {
        // a glyph wrapped in <am> is anchored on the <am>
        Element anchor = TeiNames.is(mark.parent(), "am") ? mark.parent() : mark;

        boolean expanded = isAlreadyExpanded(anchor);
        if (expanded) {
            stats.alreadyExpanded.incrementAndGet();
            if (skipExpanded) return null;
        }

        String prefix = ContextExtractor.wordPrefix(anchor);
        String suffix = ContextExtractor.wordSuffix(anchor);
        String raw = prefix + anchor.outerHtml() + suffix;
        String surface = prefix + ContextExtractor.visibleText(anchor) + suffix;
        String key = canonicalKey(raw);
        if (key.isEmpty()) {
            return null;
        }
        Context context = extractor.extract(anchor, surface, prefix.length(), key, tree);
        return occurrence(raw, surface, key, kind, anchor, tree, context, metadata, expanded);
    }

    private AbbreviationOccurrence occurrence(String raw, String surface, String key, MarkerKind kind,
                                              Element element, TeiDocument tree, Context context,
                                              DocumentMetadata metadata, boolean expanded) {
        Range range = element.sourceRange();
        int line = Math.max(0, range.start().lineNumber());
        int column = Math.max(0, range.start().columnNumber());
        return new AbbreviationOccurrence(raw, surface, key, kind, element, element.parent(), tree,
                xpathOf(element), line, column, context, metadata, expanded);
    }

    private String canonicalKey(String raw) {
        if (!normalize) {
            return normalizer.plainText(raw);
        }
        String key = normalizer.normalize(raw);
        if (!key.equals(normalizer.plainText(raw))) {
            stats.normalized.incrementAndGet();
        }
        return key;
    }

    private boolean isFreeMark(Element e) {
        return !TeiNames.hasAncestor(e, expanName) && !TeiNames.hasAncestor(e, abbrName);
    }

    private boolean containsMarkerGlyph(Element am) {
        for (Element g : TeiNames.descendants(am, "g")) {
            if (markerRefs.contains(g.attr("ref"))) return true;
        }
        return false;
    }

    /**
     * An abbreviation counts as expanded when it already sits in a choice with
     * an expansion, or is directly followed by an expansion element.
     */
    boolean isAlreadyExpanded(Element abbr) {
        Element parent = abbr.parent();
        if (TeiNames.is(parent, choiceName)) {
            for (Element sibling : parent.children()) {
                if (sibling != abbr && TeiNames.is(sibling, expanName)) return true;
            }
        }
        return TeiNames.is(abbr.nextElementSibling(), expanName);
    }

    static String xpathOf(Element e) {
        List<String> steps = new ArrayList<>();
        for (Element cur = e; cur != null && !(cur instanceof Document); cur = cur.parent()) {
            int position = 1;
            for (Element s = cur.previousElementSibling(); s != null; s = s.previousElementSibling()) {
                if (s.tagName().equals(cur.tagName())) position++;
            }
            steps.add(0, TeiNames.localName(cur) + "[" + position + "]");
        }
        return "/" + String.join("/", steps);
    }

    // ---------------------------- write-back ----------------------------

    /**
     * Writes an expansion for an occurrence. The markup depends on the kind of
     * occurrence:
     * <ul>
     *     <li>{@link MarkerKind#SUSPENSION} and {@link MarkerKind#OTHER_MARK}: the mark,
     *     wrapped in {@code <am>} if it is a bare {@code <g>}, moves into
     *     {@code <choice><abbr>..</abbr><expan><am>copy</am><ex>expansion</ex></expan></choice>}
     *     at its old position. A mark already inside such an {@code <abbr>} gets its
     *     {@code <expan>} rebuilt;</li>
     *     <li>{@link MarkerKind#COMBINING_MACRON}: an {@code <expan>} right after the mark;</li>
     *     <li>{@link MarkerKind#EXPLICIT_ABBR}: inside a {@code <choice>} its {@code <expan>}
     *     is updated or created; with choice tags enabled the abbreviation is wrapped in a
     *     new {@code <choice>}; otherwise an {@code <expan>} goes right after it.</li>
     * </ul>
     * Updating an existing {@code <expan>} that holds an {@code <ex>} rewrites only
     * the {@code <ex>}. The abbreviation itself is never removed from the document.
     *
     * @param occurrence occurrence from {@link #parse(Path)}
     * @param expansion  expansion text
     * @return {@code false} if the abbreviation has no parent or is no longer
     * among its parent's children; the tree is then left unchanged
     */
    public boolean addExpansion(AbbreviationOccurrence occurrence, String expansion) {
        if (occurrence == null || expansion == null || expansion.trim().isEmpty()) {
            return false;
        }
        TeiDocument tree = occurrence.getDocument();
        Element abbr = occurrence.getElement();
        if (tree == null || abbr == null) {
            return false;
        }

        try {
            Element parent = tree.findParent(abbr);
            if (parent == null || parent instanceof Document) {
                LOGGER.warning("No parent for abbreviation '" + occurrence.getKey() + "' in "
                        + occurrence.getFile() + " line " + occurrence.getLine());
                return false;
            }
            int index = tree.indexOf(parent, abbr);
            if (index < 0) {
                LOGGER.warning("Abbreviation '" + occurrence.getKey() + "' not found among siblings in "
                        + occurrence.getFile() + " line " + occurrence.getLine());
                return false;
            }

            switch (occurrence.getKind()) {
                case SUSPENSION:
                case OTHER_MARK:
                    addMarkExpansion(tree, abbr, parent, expansion);
                    break;
                case COMBINING_MACRON:
                    addSiblingExpansion(tree, abbr, parent, index, expansion);
                    break;
                default:
                    addAbbreviationExpansion(tree, abbr, parent, index, expansion);
                    break;
            }
            stats.expansionsAdded.incrementAndGet();
            return true;
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Failed to add expansion for '" + occurrence.getKey() + "' in "
                    + occurrence.getFile(), e);
            return false;
        }
    }

    private void addAbbreviationExpansion(TeiDocument tree, Element abbr, Element parent, int index, String expansion) {
        if (TeiNames.is(parent, choiceName)) {
            Element existing = firstChild(parent, expanName);
            if (existing != null) {
                setExpansionText(existing, expansion);
            } else {
                tree.insertAt(parent, index + 1, newExpansion(abbr, expansion));
            }
        } else if (useChoiceTags) {
            Element choice = new Element(TeiNames.prefix(abbr) + choiceName);
            tree.replaceChild(parent, abbr, choice);
            tree.insertAt(choice, 0, abbr);
            tree.insertAt(choice, 1, newExpansion(abbr, expansion));
        } else {
            addSiblingExpansion(tree, abbr, parent, index, expansion);
        }
    }

    private void addSiblingExpansion(TeiDocument tree, Element abbr, Element parent, int index, String expansion) {
        Node next = abbr.nextSibling();
        if (next instanceof Element && TeiNames.is((Element) next, expanName)) {
            setExpansionText((Element) next, expansion);
        } else {
            tree.insertAt(parent, index + 1, newExpansion(abbr, expansion));
        }
    }

    private void addMarkExpansion(TeiDocument tree, Element mark, Element parent, String expansion) {
        String prefix = TeiNames.prefix(mark);
        Element am;
        if (TeiNames.is(mark, "am")) {
            am = mark;
        } else if (TeiNames.is(parent, "am")) {
            am = parent;
        } else {
            am = new Element(prefix + "am");
            tree.replaceChild(parent, mark, am);
            am.appendChild(mark);
        }

        Element amParent = tree.findParent(am);
        if (TeiNames.is(amParent, abbrName)) {
            Element choice = tree.findParent(amParent);
            if (TeiNames.is(choice, choiceName)) {
                Element expan = firstChild(choice, expanName);
                if (expan == null) {
                    expan = newExpansion(amParent, null);
                    tree.insertAt(choice, tree.indexOf(choice, amParent) + 1, expan);
                } else {
                    expan.empty();
                }
                fillMarkExpansion(expan, am, expansion);
            } else {
                Element wrapper = new Element(prefix + choiceName);
                tree.replaceChild(choice, amParent, wrapper);
                wrapper.appendChild(amParent);
                wrapper.appendChild(fillMarkExpansion(newExpansion(amParent, null), am, expansion));
            }
            return;
        }

        Element abbr = new Element(prefix + abbrName);
        Element choice = new Element(prefix + choiceName);
        tree.replaceChild(amParent, am, choice);
        choice.appendChild(abbr);
        abbr.appendChild(am);
        choice.appendChild(fillMarkExpansion(newExpansion(abbr, null), am, expansion));
    }

    private Element fillMarkExpansion(Element expan, Element am, String expansion) {
        Element copy = am.clone();
        for (Element e : copy.getAllElements()) {
            e.removeAttr("xml:id");
        }
        expan.appendChild(copy);
        expan.appendChild(new Element(TeiNames.prefix(am) + "ex").text(expansion));
        return expan;
    }

    private static void setExpansionText(Element expan, String expansion) {
        Element ex = firstChild(expan, "ex");
        if (ex != null) {
            ex.text(expansion);
        } else {
            expan.text(expansion);
        }
    }

    private Element newExpansion(Element abbr, String text) {
        Element expan = new Element(TeiNames.prefix(abbr) + expanName);
        if (addIds) {
            expan.attr("xml:id", "expan_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8));
        }
        String abbrId = abbr.attr("xml:id");
        if (!abbrId.isEmpty()) {
            expan.attr("corresp", "#" + abbrId);
        }
        if (text != null) {
            expan.appendText(text);
        }
        return expan;
    }

    private static Element firstChild(Element parent, String localName) {
        for (Element child : parent.children()) {
            if (TeiNames.is(child, localName)) return child;
        }
        return null;
    }

    // ---------------------------- save ----------------------------

    /**
     * Writes the document as UTF-8 with a matching XML declaration and
     * re-indented element-only content, creating missing directories.
     *
     * @return {@code false} if writing failed
     */
    public boolean save(TeiDocument tree, Path path) {
        if (tree == null || path == null) {
            return false;
        }
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(path, tree.toXml().getBytes(StandardCharsets.UTF_8));
            return true;
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Failed to save " + path, e);
            return false;
        }
    }
}
