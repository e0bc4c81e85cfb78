package amanuensis;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex templates for well-known abbreviation conventions.
 *
 * <p>Each matching template emits its alternatives in order; the first carries
 * {@link #PRIMARY_CONFIDENCE}, later ones {@link #SECONDARY_CONFIDENCE}.</p>
 */
public final class PatternRules {

    public static final double PRIMARY_CONFIDENCE = 0.5;
    public static final double SECONDARY_CONFIDENCE = 0.4;

    private static final int FLAGS = Pattern.UNICODE_CHARACTER_CLASS;

    private static final List<Template> TEMPLATES = Collections.unmodifiableList(Arrays.asList(
            // medial nasal: co$cerning
            new Template("^(\\w+)\\$(\\w+)$", "$1n$2", "$1m$2"),
            // final nasal vowels: ratio$, gratia$, vide$
            new Template("^(\\w+)o\\$$", "$1on", "$1om"),
            new Template("^(\\w+)a\\$$", "$1an", "$1am"),
            new Template("^(\\w+)e\\$$", "$1en", "$1em"),
            // Latin suspensions
            new Template("^(\\w*)q\\$$", "$1que"),
            new Template("^(\\w+)b;$", "$1bus"),
            new Template("^(\\w+)q;$", "$1que"),
            new Template("^(\\w+)p;$", "$1pre"),
            // any other final mark, -um before -un
            new Template("^(\\w+)\\$$", "$1m", "$1n")
    ));

    private PatternRules() {
    }

    /**
     * Applies every template to {@code key}.
     *
     * @param key canonical key
     * @return candidates in template order, possibly with duplicates
     */
    public static List<Suggestion> apply(String key) {
        List<Suggestion> out = new ArrayList<>();
        for (Template t : TEMPLATES) {
            Matcher m = t.pattern.matcher(key);
            if (!m.matches()) {
                continue;
            }
            for (int i = 0; i < t.replacements.length; i++) {
                String expansion = m.replaceFirst(t.replacements[i]);
                m.reset();
                out.add(new Suggestion(expansion,
                        i == 0 ? PRIMARY_CONFIDENCE : SECONDARY_CONFIDENCE,
                        SuggestionSource.PATTERN));
            }
        }
        return out;
    }

    private static final class Template {
        final Pattern pattern;
        final String[] replacements;

        Template(String regex, String... replacements) {
            this.pattern = Pattern.compile(regex, FLAGS);
            this.replacements = replacements;
        }
    }
}
