package amanuensis;

import org.jsoup.parser.Parser;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the many encodings of an abbreviation mark into one canonical key.
 *
 * <p>The canonical marker {@code $} stands where the scribe or printer wrote an
 * abbreviation sign. Every variant of the same abbreviation (TEI stroke markup,
 * a combining macron, a precomposed vowel, literal {@code $} text) must converge
 * on the same key, because the key is the only lookup handle used by the
 * suggestion tiers and the solution stores.</p>
 *
 * <p>Rules are applied in priority order:</p>
 * <ol>
 *     <li>{@link Rule#STROKE_MARKUP}: inline stroke markup after a base letter, {@code u<g ref="char:cmbAbbrStroke"/>} to {@code u$}
 *     (suspension markup, {@code char:abque}, becomes {@code q$})</li>
 *     <li>{@link Rule#COMBINING_MACRON}: a letter followed by U+0304 to {@code <letter>$}</li>
 *     <li>{@link Rule#PRECOMPOSED}: ā ã ē ẽ ī ĩ ō õ ū ũ ñ to {@code <base>$}</li>
 *     <li>{@link Rule#PERIOD_SUFFIX}: trailing two-letter period abbreviation, {@code Ill.mo} to {@code Ill$mo}</li>
 * </ol>
 *
 * <p>The output never contains markup and never matches any rule again, so
 * {@code normalize(normalize(x)).equals(normalize(x))} always holds.
 * Instances are thread-safe; the only state is a set of rule counters.</p>
 */
public class UnicodeNormalizer {

    /**
     * Canonical abbreviation marker.
     */
    public static final char MARKER = '$';

    /**
     * Normalization rules, in priority order.
     */
    public enum Rule {
        STROKE_MARKUP,
        SUSPENSION_MARKUP,
        COMBINING_MACRON,
        PRECOMPOSED,
        PERIOD_SUFFIX
    }

    private static final String PREFIX = "(?:[\\w.-]+:)?";
    private static final String AM_OPEN = "(?:<" + PREFIX + "am\\b[^>]*>\\s*)?";
    private static final String AM_CLOSE = "(?:\\s*</" + PREFIX + "am>)?";

    private static final Pattern STROKE_MARKUP = Pattern.compile(
            "(\\p{L})?" + AM_OPEN
                    + "<" + PREFIX + "g\\b[^>]*?\\bref\\s*=\\s*[\"']char:cmbAbbrStroke[\"'][^>]*?(?:/>|>[^<]*</" + PREFIX + "g>)"
                    + AM_CLOSE);

    private static final Pattern SUSPENSION_MARKUP = Pattern.compile(
            AM_OPEN
                    + "<" + PREFIX + "g\\b[^>]*?\\bref\\s*=\\s*[\"']char:abque[\"'][^>]*?(?:/>|>[^<]*</" + PREFIX + "g>)"
                    + AM_CLOSE);

    private static final Pattern MARKUP = Pattern.compile("<[^>]*>");
    private static final Pattern COMBINING_MACRON = Pattern.compile("(\\p{L})\u0304");
    private static final Pattern PERIOD_SUFFIX = Pattern.compile("(?<=\\p{L})\\.(\\p{Ll}{2})$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Map<Character, Character> PRECOMPOSED = new HashMap<>();

    static {
        String composed = "āãēẽīĩōõūũñĀÃĒẼĪĨŌÕŪŨÑ";
        String base = "aaeeiioouunAAEEIIOOUUN";
        for (int i = 0; i < composed.length(); i++) {
            PRECOMPOSED.put(composed.charAt(i), base.charAt(i));
        }
    }

    private final Map<Rule, AtomicLong> counters = new EnumMap<>(Rule.class);

    /**
     * Creates a normalizer with all rule counters at zero.
     */
    public UnicodeNormalizer() {
        for (Rule rule : Rule.values()) {
            counters.put(rule, new AtomicLong());
        }
    }

    /**
     * Normalizes raw surface text into its canonical {@code $}-marked key.
     * Text holding at least one tag is read as serialized XML, so its entity
     * references are decoded; text without tags is taken literally.
     *
     * @param raw raw text; {@code null} is treated as empty
     * @return canonical key, never {@code null}
     */
    public String normalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }

        String s = replaceStrokeMarkup(raw);
        s = replaceAll(SUSPENSION_MARKUP, s, Rule.SUSPENSION_MARKUP, m -> "q" + MARKER);
        s = stripMarkup(s);
        s = replaceAll(COMBINING_MACRON, s, Rule.COMBINING_MACRON, m -> m.group(1) + MARKER);
        s = replacePrecomposed(s);
        s = WHITESPACE.matcher(s).replaceAll(" ").trim();
        s = replaceAll(PERIOD_SUFFIX, s, Rule.PERIOD_SUFFIX, m -> MARKER + m.group(1));
        return s;
    }

    /**
     * Removes markup and collapses whitespace without applying any marker rule.
     * Used when abbreviation normalization is switched off.
     *
     * @param raw raw text
     * @return plain text
     */
    public String plainText(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        return WHITESPACE.matcher(stripMarkup(raw)).replaceAll(" ").trim();
    }

    /**
     * Returns the number of times each rule fired since construction.
     *
     * @return read-only snapshot of the counters
     */
    public Map<Rule, Long> counts() {
        Map<Rule, Long> snapshot = new EnumMap<>(Rule.class);
        counters.forEach((rule, count) -> snapshot.put(rule, count.get()));
        return Collections.unmodifiableMap(snapshot);
    }

    /**
     * Counts the canonical markers in a key.
     *
     * @param key canonical key
     * @return number of {@code $} characters
     */
    public static int markerCount(String key) {
        int n = 0;
        for (int i = 0; i < key.length(); i++) {
            if (key.charAt(i) == MARKER) n++;
        }
        return n;
    }

    private String replaceStrokeMarkup(String s) {
        return replaceAll(STROKE_MARKUP, s, Rule.STROKE_MARKUP,
                m -> m.group(1) != null ? m.group(1) + MARKER : String.valueOf(MARKER));
    }

    private String replacePrecomposed(String s) {
        StringBuilder sb = null;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            Character base = PRECOMPOSED.get(c);
            if (base == null) {
                if (sb != null) sb.append(c);
                continue;
            }
            if (sb == null) {
                sb = new StringBuilder(s.length() + 4);
                sb.append(s, 0, i);
            }
            sb.append(base.charValue()).append(MARKER);
            counters.get(Rule.PRECOMPOSED).incrementAndGet();
        }
        return sb == null ? s : sb.toString();
    }

    /**
     * Input without a tag is already plain text and is returned as is, so an
     * ampersand sequence that survived one pass is never decoded again.
     */
    private static String stripMarkup(String s) {
        if (s.indexOf('<') < 0) {
            return s;
        }
        String text = MARKUP.matcher(s).replaceAll("");
        text = Parser.unescapeEntities(text, false);
        // unescaped angle brackets would be read as markup on a second pass
        return text.replace("<", "").replace(">", "");
    }

    private String replaceAll(Pattern pattern, String s, Rule rule,
                              java.util.function.Function<Matcher, String> replacement) {
        Matcher m = pattern.matcher(s);
        if (!m.find()) {
            return s;
        }
        StringBuilder sb = new StringBuilder(s.length());
        AtomicLong counter = counters.get(rule);
        do {
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement.apply(m)));
            counter.incrementAndGet();
        } while (m.find());
        m.appendTail(sb);
        return sb.toString();
    }
}
