package teihelper;

import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Namespace-agnostic element name helpers. The XML parser keeps prefixes in
 * tag names ({@code tei:abbr}); TEI documents usually use the default namespace
 * ({@code abbr}). Both must match.
 */
public final class TeiNames {

    private TeiNames() {
    }

    public static String localName(Element e) {
        String name = e.tagName();
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }

    static String prefix(Element e) {
        String name = e.tagName();
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(0, colon + 1) : "";
    }

    public static boolean is(Element e, String localName) {
        return e != null && localName.equalsIgnoreCase(localName(e));
    }

    static boolean hasAncestor(Element e, String localName) {
        for (Element p = e.parent(); p != null; p = p.parent()) {
            if (is(p, localName)) return true;
        }
        return false;
    }

    static List<Element> descendants(Element root, String localName) {
        List<Element> out = new ArrayList<>();
        for (Element e : root.getAllElements()) {
            if (e != root && is(e, localName)) out.add(e);
        }
        return out;
    }

    /**
     * Follows a path of local names, taking the first match at each step
     * among all descendants.
     */
    static Element first(Element root, String... path) {
        Element current = root;
        for (String step : path) {
            Element next = null;
            for (Element e : current.getAllElements()) {
                if (e != current && is(e, step)) {
                    next = e;
                    break;
                }
            }
            if (next == null) return null;
            current = next;
        }
        return current;
    }
}
