package teihelper;

import amanuensis.UnicodeNormalizer;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Extracts the text before and after an abbreviation.
 *
 * <p>The scope is the nearest block-level ancestor. Its text is flattened
 * depth first with whitespace coalesced, and the abbreviation is located by
 * the offset of its own element in that text, so two identical abbreviations
 * in one block each get their own context. If that fails, the visible text is
 * searched for, then the canonical key in the normalized block text, and
 * finally the neighbouring sibling nodes are used.</p>
 */
public class ContextExtractor {
    private static final Logger LOGGER = Logger.getLogger(ContextExtractor.class.getName());

    static final Set<String> BLOCK_ELEMENTS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "div", "p", "lg", "l", "ab", "head", "list", "item", "table", "row", "cell",
            "quote", "figure", "note", "milestone", "pb", "cb", "lb")));

    private static final int MAX_ANCESTOR_LEVELS = 3;
    private static final int MAX_SIBLINGS = 3;

    private final int window;
    private final boolean includeAncestors;
    private final UnicodeNormalizer normalizer = new UnicodeNormalizer();

    public ContextExtractor(int window, boolean includeAncestors) {
        if (window < 0) {
            throw new IllegalArgumentException("window must be >= 0");
        }
        this.window = window;
        this.includeAncestors = includeAncestors;
    }

    /**
     * Recomputes the context of an occurrence against its document.
     *
     * @return context, {@link Context#EMPTY} on any failure
     */
    public Context extract(AbbreviationOccurrence occurrence, TeiDocument tree) {
        Element element = occurrence.getElement();
        if (element == null) {
            return Context.EMPTY;
        }
        int prefix = occurrence.getKind() == MarkerKind.EXPLICIT_ABBR ? 0 : wordPrefix(element).length();
        return extract(element, occurrence.getSurfaceText(), prefix, occurrence.getKey(), tree);
    }

    /**
     * @param target  abbreviation or marker element
     * @param surface visible text of the whole abbreviation
     * @param prefix  number of surface characters preceding {@code target}
     * @param key     canonical key, used for the normalized-text fallback
     */
    Context extract(Element target, String surface, int prefix, String key, TeiDocument tree) {
        try {
            Element parent = tree.findParent(target);
            if (parent == null || parent instanceof Document) {
                return Context.EMPTY;
            }
            Element block = blockFor(parent);

            int[] offset = {-1};
            String flat = flatten(block, target, offset);

            if (!surface.isEmpty()) {
                int start = offset[0] >= 0 ? offset[0] - prefix : -1;
                if (start < 0 || !flat.startsWith(surface, start)) {
                    start = nearestIndex(flat, surface, Math.max(0, start));
                }
                if (start >= 0) {
                    return slice(flat, start, start + surface.length());
                }
            }

            if (key != null && !key.isEmpty()) {
                String normalized = normalizer.normalize(flat);
                int k = normalized.indexOf(key);
                if (k >= 0) {
                    return slice(normalized, k, k + key.length());
                }
            }

            return fromSiblings(target);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Context extraction failed for " + surface, e);
            return Context.EMPTY;
        }
    }

    Element blockFor(Element parent) {
        if (isBlock(parent) || !includeAncestors) {
            return parent;
        }
        Element current = parent;
        for (int i = 0; i < MAX_ANCESTOR_LEVELS; i++) {
            current = current.parent();
            if (current == null || current instanceof Document) {
                break;
            }
            if (isBlock(current)) {
                return current;
            }
        }
        return parent;
    }

    static boolean isBlock(Element e) {
        return BLOCK_ELEMENTS.contains(TeiNames.localName(e).toLowerCase(Locale.ROOT));
    }

    private Context slice(String text, int start, int end) {
        String before = text.substring(0, start).trim();
        String after = text.substring(Math.min(end, text.length())).trim();
        return new Context(tail(before), head(after));
    }

    private Context fromSiblings(Node target) {
        List<String> before = new ArrayList<>();
        for (Node n = target.previousSibling(); n != null && before.size() < MAX_SIBLINGS; n = n.previousSibling()) {
            String t = flatten(n, null, null).trim();
            if (!t.isEmpty()) before.add(0, t);
        }
        List<String> after = new ArrayList<>();
        for (Node n = target.nextSibling(); n != null && after.size() < MAX_SIBLINGS; n = n.nextSibling()) {
            String t = flatten(n, null, null).trim();
            if (!t.isEmpty()) after.add(t);
        }
        return new Context(tail(String.join(" ", before)), head(String.join(" ", after)));
    }

    private String tail(String s) {
        return s.length() <= window ? s : s.substring(s.length() - window);
    }

    private String head(String s) {
        return s.length() <= window ? s : s.substring(0, window);
    }

    private static int nearestIndex(String text, String needle, int from) {
        int idx = text.indexOf(needle, Math.max(0, from - needle.length()));
        return idx >= 0 ? idx : text.indexOf(needle);
    }

    /**
     * Flattens the text under {@code root}. When {@code target} is given, its
     * start offset in the result is stored in {@code offset[0]}.
     */
    static String flatten(Node root, Node target, int[] offset) {
        StringBuilder sb = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node == target && offset != null) {
                    offset[0] = sb.length();
                }
                if (node instanceof TextNode) {
                    appendNormalizedText(sb, ((TextNode) node).getWholeText());
                } else if (node != root && node instanceof Element && isBlock((Element) node)) {
                    ensureSpace(sb);
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node != root && node instanceof Element && isBlock((Element) node)) {
                    ensureSpace(sb);
                }
            }
        }, root);
        return sb.toString();
    }

    /**
     * Visible text of an element, whitespace coalesced and trimmed.
     */
    static String visibleText(Node node) {
        return flatten(node, null, null).trim();
    }

    /**
     * Letters written immediately before {@code marker} in the same word.
     */
    static String wordPrefix(Node marker) {
        Node prev = marker.previousSibling();
        if (!(prev instanceof TextNode)) return "";
        String t = ((TextNode) prev).getWholeText();
        int i = t.length();
        while (i > 0 && Character.isLetter(t.charAt(i - 1))) i--;
        return t.substring(i);
    }

    /**
     * Letters written immediately after {@code marker} in the same word.
     */
    static String wordSuffix(Node marker) {
        Node next = marker.nextSibling();
        if (!(next instanceof TextNode)) return "";
        String t = ((TextNode) next).getWholeText();
        int i = 0;
        while (i < t.length() && Character.isLetter(t.charAt(i))) i++;
        return t.substring(0, i);
    }

    private static void ensureSpace(StringBuilder sb) {
        if (sb.length() > 0 && sb.charAt(sb.length() - 1) != ' ') {
            sb.append(' ');
        }
    }

    private static void appendNormalizedText(StringBuilder sb, String t) {
        for (int i = 0; i < t.length(); i++) {
            char c = t.charAt(i);
            if (Character.isWhitespace(c) || c == '\u00A0') {
                if (sb.length() == 0) continue;
                if (sb.charAt(sb.length() - 1) == ' ') continue;
                sb.append(' ');
            } else if (c != '\u00AD') {
                sb.append(c);
            }
        }
    }
}
