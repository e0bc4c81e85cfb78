package teihelper;

import org.jsoup.nodes.CDataNode;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Entities;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.nodes.XmlDeclaration;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A parsed TEI document.
 *
 * <p>Expansion write-back only needs to find a parent, list its children,
 * insert at an index and replace a child; this wrapper exposes exactly those
 * operations over the underlying jsoup tree.</p>
 */
public final class TeiDocument {

    private static final String INDENT = "  ";

    /**
     * Phrase-level elements whose children are never re-indented, even when
     * they hold only elements: whitespace there would become part of a word.
     */
    static final Set<String> PHRASE_ELEMENTS = new HashSet<>(Arrays.asList(
            "abbr", "expan", "choice", "am", "ex", "g", "hi", "w", "seg"));

    private final Document document;
    private final Path source;
    private final Set<String> phraseElements;

    TeiDocument(Document document, Path source) {
        this(document, source, PHRASE_ELEMENTS);
    }

    TeiDocument(Document document, Path source, Set<String> phraseElements) {
        this.document = document;
        this.source = source;
        this.phraseElements = phraseElements;
        document.outputSettings()
                .syntax(Document.OutputSettings.Syntax.xml)
                .escapeMode(Entities.EscapeMode.xhtml)
                .charset(StandardCharsets.UTF_8)
                .prettyPrint(false);
    }

    public Path source() {
        return source;
    }

    /**
     * @return the document element, or {@code null} for an empty document
     */
    public Element root() {
        return document.children().first();
    }

    public Element findParent(Node node) {
        return node == null ? null : (Element) node.parentNode();
    }

    /**
     * @return read-only view of the child nodes, text nodes included
     */
    public List<Node> childrenOf(Element parent) {
        return parent.childNodes();
    }

    /**
     * Index of {@code child} among {@code parent}'s child nodes, by identity.
     *
     * @return the index, or -1 if {@code child} is not a child of {@code parent}
     */
    public int indexOf(Element parent, Node child) {
        List<Node> children = childrenOf(parent);
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) return i;
        }
        return -1;
    }

    public void insertAt(Element parent, int index, Node child) {
        parent.insertChildren(index, child);
    }

    /**
     * @return {@code false} if {@code oldChild} is not a child of {@code parent}
     */
    public boolean replaceChild(Element parent, Node oldChild, Node replacement) {
        if (indexOf(parent, oldChild) < 0) {
            return false;
        }
        oldChild.replaceWith(replacement);
        return true;
    }

    /**
     * Serializes a copy of the document for writing as UTF-8.
     *
     * <p>The XML declaration is added, or its encoding rewritten, so that it
     * names UTF-8. Element-only content is re-indented by nesting depth;
     * mixed content, phrase-level elements and anything under
     * {@code xml:space="preserve"} keep their whitespace as parsed.</p>
     */
    String toXml() {
        Document out = document.clone();
        Node first = out.childNodeSize() > 0 ? out.childNode(0) : null;
        XmlDeclaration decl = new XmlDeclaration("xml", false);
        if (first instanceof XmlDeclaration && ((XmlDeclaration) first).name().equals("xml")) {
            String version = first.attr("version");
            decl.attr("version", version.isEmpty() ? "1.0" : version);
            decl.attr("encoding", "UTF-8");
            if (first.hasAttr("standalone")) {
                decl.attr("standalone", first.attr("standalone"));
            }
            first.replaceWith(decl);
        } else {
            decl.attr("version", "1.0");
            decl.attr("encoding", "UTF-8");
            out.prependChild(decl);
        }
        if (!(out.childNodeSize() > 1 && out.childNode(1) instanceof TextNode)) {
            out.insertChildren(1, new TextNode("\n"));
        }

        Element root = out.children().first();
        if (root != null) {
            indent(root, 0);
        }
        return out.outerHtml();
    }

    private void indent(Element element, int depth) {
        if (!isElementOnly(element)
                || phraseElements.contains(TeiNames.localName(element))
                || "preserve".equals(element.attr("xml:space"))) {
            return;
        }
        List<Node> content = new ArrayList<>();
        for (Node child : new ArrayList<>(element.childNodes())) {
            if (isBlankText(child)) {
                child.remove();
            } else {
                content.add(child);
            }
        }
        String inner = "\n" + INDENT.repeat(depth + 1);
        for (Node child : content) {
            child.before(new TextNode(inner));
        }
        element.appendChild(new TextNode("\n" + INDENT.repeat(depth)));
        for (Node child : content) {
            if (child instanceof Element) {
                indent((Element) child, depth + 1);
            }
        }
    }

    /**
     * True when the element has child elements and nothing else but comments,
     * processing instructions and whitespace.
     */
    static boolean isElementOnly(Element element) {
        if (element.childrenSize() == 0) {
            return false;
        }
        for (Node child : element.childNodes()) {
            if (!(child instanceof Element || child instanceof Comment
                    || child instanceof XmlDeclaration || isBlankText(child))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isBlankText(Node node) {
        return node instanceof TextNode && !(node instanceof CDataNode) && ((TextNode) node).isBlank();
    }

    /**
     * Inner markup of an element, as written in the source, without pretty printing.
     */
    static String innerXml(Element e) {
        return e.html();
    }
}
