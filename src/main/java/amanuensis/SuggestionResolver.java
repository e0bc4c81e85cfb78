package amanuensis;

import teihelper.AbbreviationOccurrence;
import teihelper.DocumentMetadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Produces ranked expansion candidates for a canonical key.
 *
 * <p>The tiers are additive: stored solutions, the abbreviation dictionary,
 * the pattern templates, WordNet and an optional language model all contribute,
 * and a hit in one tier never suppresses another. The combined list is
 * deduplicated by expansion text and sorted by {@link Suggestion#RANKING}.</p>
 *
 * <p>Resolution only reads shared state and may run on several threads.</p>
 */
public class SuggestionResolver {
    private static final Logger LOGGER = Logger.getLogger(SuggestionResolver.class.getName());

    static final int CLOSEST_KEY_MAX_DISTANCE = 3;
    static final int CLOSEST_KEY_MIN_LENGTH = 4;

    private final AbbreviationDictionary dictionary;
    private final SolutionStore store;
    private final WordNetLexicon wordNet;
    private final LanguageModelSource languageModel;
    private int maxSuggestions;

    private final AtomicLong totalSuggestions = new AtomicLong();
    private final AtomicLong dictionaryMatches = new AtomicLong();
    private final AtomicLong patternMatches = new AtomicLong();
    private final AtomicLong wordnetSuggestions = new AtomicLong();
    private final AtomicLong lmSuggestions = new AtomicLong();
    private final AtomicLong failedAbbreviations = new AtomicLong();

    /**
     * @param dictionary    abbreviation dictionary, required
     * @param store         solution store consulted before the dictionary, may be {@code null}
     * @param wordNet       WordNet lexicon, may be {@code null} (tier off)
     * @param languageModel language model, may be {@code null} (tier off)
     */
    public SuggestionResolver(AbbreviationDictionary dictionary, SolutionStore store,
                              WordNetLexicon wordNet, LanguageModelSource languageModel) {
        this.dictionary = dictionary;
        this.store = store;
        this.wordNet = wordNet == null ? WordNetLexicon.unavailable() : wordNet;
        this.languageModel = languageModel == null ? LanguageModelSource.unavailable() : languageModel;
    }

    /**
     * Builds a resolver from configuration: the configured dictionary file (or the
     * bundled one) and WordNet when enabled and installed. No language model is
     * attached; callers may pass their own through the constructor.
     */
    public static SuggestionResolver fromConfig(AmanuensisConfig config, SolutionStore store) {
        WordNetLexicon lexicon = config.settings.useWordnet
                ? JwiWordNetLexicon.open(config.wordnetPath())
                : WordNetLexicon.unavailable();
        SuggestionResolver resolver = new SuggestionResolver(
                AbbreviationDictionary.load(config.dictionaryPath()), store, lexicon, null);
        resolver.setMaxSuggestions(config.settings.suggestionCount);
        if (config.languageModel.enabled) {
            LOGGER.warning("language_model_integration is enabled (provider " + config.languageModel.provider
                    + ") but no language model source is attached; that tier stays off");
        }
        return resolver;
    }

    /**
     * @param maxSuggestions list size limit, 0 for no limit
     */
    public void setMaxSuggestions(int maxSuggestions) {
        this.maxSuggestions = Math.max(0, maxSuggestions);
    }

    public List<Suggestion> suggest(String key) {
        return suggest(key, "", "", null);
    }

    public List<Suggestion> suggest(AbbreviationOccurrence occurrence) {
        return suggest(occurrence.getKey(), occurrence.getContextBefore(), occurrence.getContextAfter(),
                occurrence.getMetadata());
    }

    /**
     * Runs every tier for {@code key}.
     *
     * @return ranked candidates, empty when no tier knows the key
     */
    public List<Suggestion> suggest(String key, String contextBefore, String contextAfter, DocumentMetadata metadata) {
        if (key == null || key.trim().isEmpty()) {
            failedAbbreviations.incrementAndGet();
            return Collections.emptyList();
        }

        List<Suggestion> candidates = new ArrayList<>();
        boolean known = addStored(key, candidates);

        List<String> hits = dictionary.lookup(key);
        if (!hits.isEmpty()) {
            dictionaryMatches.incrementAndGet();
            known = true;
            for (String h : hits) {
                candidates.add(new Suggestion(h, SuggestionSource.DICTIONARY.defaultConfidence(), SuggestionSource.DICTIONARY));
            }
        }

        List<Suggestion> patterns = PatternRules.apply(key);
        if (!patterns.isEmpty()) {
            patternMatches.incrementAndGet();
            candidates.addAll(patterns);
        }

        if (!known) {
            addClosestKnown(key, candidates);
        }

        addWordNet(key, candidates);
        addLanguageModel(key, contextBefore, contextAfter, metadata, candidates);

        List<Suggestion> ranked = Suggestion.rank(candidates);
        if (maxSuggestions > 0 && ranked.size() > maxSuggestions) {
            ranked = new ArrayList<>(ranked.subList(0, maxSuggestions));
        }
        if (ranked.isEmpty()) {
            failedAbbreviations.incrementAndGet();
            LOGGER.fine(() -> "No suggestions for " + key);
        }
        totalSuggestions.addAndGet(ranked.size());
        return ranked;
    }

    private boolean addStored(String key, List<Suggestion> out) {
        if (store == null) return false;
        boolean found = false;
        for (String v : store.userValue(key)) {
            out.add(new Suggestion(v, SuggestionSource.MANUAL.defaultConfidence(), SuggestionSource.MANUAL));
            found = true;
        }
        for (String v : store.machineValue(key)) {
            out.add(new Suggestion(v, SuggestionSource.DICTIONARY.defaultConfidence(), SuggestionSource.DICTIONARY));
            found = true;
        }
        return found;
    }

    private void addClosestKnown(String key, List<Suggestion> out) {
        if (key.length() < CLOSEST_KEY_MIN_LENGTH) return;
        String closest = closestKnownKey(key);
        if (closest == null) return;
        List<String> expansions = dictionary.lookup(closest);
        if (expansions.isEmpty() && store != null) {
            expansions = store.userValue(closest);
        }
        if (!expansions.isEmpty()) {
            out.add(new Suggestion(expansions.get(0), PatternRules.SECONDARY_CONFIDENCE, SuggestionSource.PATTERN));
        }
    }

    private void addWordNet(String key, List<Suggestion> out) {
        if (!wordNet.isAvailable() || UnicodeNormalizer.markerCount(key) != 1) return;
        for (String letter : new String[]{"n", "m"}) {
            String candidate = key.replace("$", letter);
            if (wordNet.contains(candidate)) {
                out.add(new Suggestion(candidate, SuggestionSource.WORDNET.defaultConfidence(), SuggestionSource.WORDNET));
                wordnetSuggestions.incrementAndGet();
            }
        }
    }

    private void addLanguageModel(String key, String before, String after, DocumentMetadata metadata,
                                  List<Suggestion> out) {
        if (!languageModel.isAvailable()) return;
        try {
            for (String expansion : languageModel.expand(key, before, after, metadata)) {
                if (expansion == null || expansion.trim().isEmpty()) continue;
                out.add(new Suggestion(expansion.trim(), SuggestionSource.LANGUAGE_MODEL.defaultConfidence(),
                        SuggestionSource.LANGUAGE_MODEL));
                lmSuggestions.incrementAndGet();
            }
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Language model failed for " + key + ", continuing without it", e);
        }
    }

    /**
     * Finds the dictionary or user-confirmed key nearest to {@code key}.
     *
     * @return the nearest key within {@value #CLOSEST_KEY_MAX_DISTANCE} edits, or {@code null}
     */
    public String closestKnownKey(String key) {
        Set<String> known = new HashSet<>(dictionary.entries().keySet());
        if (store != null) {
            known.addAll(store.userSnapshot().keySet());
        }
        known.remove(key);

        String best = null;
        int bestDistance = CLOSEST_KEY_MAX_DISTANCE + 1;
        for (String candidate : known) {
            if (Math.abs(candidate.length() - key.length()) >= bestDistance) continue;
            int d = levenshtein(key.toLowerCase(Locale.ROOT), candidate.toLowerCase(Locale.ROOT));
            if (d < bestDistance || (d == bestDistance && best != null && candidate.compareTo(best) < 0)) {
                best = candidate;
                bestDistance = d;
            }
        }
        return bestDistance <= CLOSEST_KEY_MAX_DISTANCE ? best : null;
    }

    /**
     * Rough check that a typed expansion could come from {@code key}: apart from
     * letters it adds, it may differ in at most one edit per marker plus one.
     */
    public static boolean isPlausible(String key, String expansion) {
        if (expansion == null || expansion.trim().isEmpty()) return false;
        String stripped = key.replace("$", "").toLowerCase(Locale.ROOT);
        String exp = expansion.trim().toLowerCase(Locale.ROOT);
        int allowed = UnicodeNormalizer.markerCount(key) + 1 + Math.max(0, exp.length() - stripped.length());
        return levenshtein(stripped, exp) <= allowed;
    }

    static int levenshtein(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) prev[j] = j;
        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }

    /**
     * @return counters since construction, keyed by statistic name
     */
    public Map<String, Long> statistics() {
        Map<String, Long> m = new LinkedHashMap<>();
        m.put("total_suggestions", totalSuggestions.get());
        m.put("dictionary_matches", dictionaryMatches.get());
        m.put("pattern_matches", patternMatches.get());
        m.put("wordnet_suggestions", wordnetSuggestions.get());
        m.put("lm_suggestions", lmSuggestions.get());
        m.put("failed_abbreviations", failedAbbreviations.get());
        return Collections.unmodifiableMap(m);
    }
}
