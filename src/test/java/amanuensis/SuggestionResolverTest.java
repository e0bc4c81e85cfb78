package amanuensis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SuggestionResolverTest {

    private static AbbreviationDictionary dictionary(String key, String... values) {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put(key, Arrays.asList(values));
        return new AbbreviationDictionary(m);
    }

    private static List<String> expansions(List<Suggestion> suggestions) {
        return suggestions.stream().map(Suggestion::getExpansion).collect(Collectors.toList());
    }

    private static WordNetLexicon lexicon(String... words) {
        Set<String> known = new HashSet<>(Arrays.asList(words));
        return new WordNetLexicon() {
            @Override
            public boolean contains(String word) {
                return known.contains(word);
            }

            @Override
            public boolean isAvailable() {
                return true;
            }
        };
    }

    @Test
    @DisplayName("co$cerning is expanded by the medial-marker pattern")
    void medialMarkerPattern() {
        SuggestionResolver resolver = new SuggestionResolver(dictionary("co$", "con"), null, null, null);

        List<Suggestion> suggestions = resolver.suggest("co$cerning");

        assertEquals("concerning", suggestions.get(0).getExpansion());
        assertEquals(SuggestionSource.PATTERN, suggestions.get(0).getSource());
        assertEquals(0.5, suggestions.get(0).getConfidence());
        assertTrue(expansions(suggestions).contains("comcerning"));
        for (int i = 1; i < suggestions.size(); i++) {
            assertTrue(suggestions.get(i - 1).getConfidence() >= suggestions.get(i).getConfidence());
        }
    }

    @Test
    void tiersAreAdditive() {
        SuggestionResolver resolver = new SuggestionResolver(dictionary("ratio$", "ratione"), null,
                lexicon("ration"), null);

        List<Suggestion> suggestions = resolver.suggest("ratio$");

        assertEquals(Arrays.asList("ratione", "ration", "ratiom"), expansions(suggestions));
        assertEquals(SuggestionSource.DICTIONARY, suggestions.get(0).getSource());
        assertEquals(SuggestionSource.WORDNET, suggestions.get(1).getSource());
        assertEquals(0.6, suggestions.get(1).getConfidence());
    }

    @Test
    void dictionaryLookupFallsBackToCaseInsensitive() {
        SuggestionResolver resolver = new SuggestionResolver(dictionary("ye", "the"), null, null, null);

        assertEquals("the", resolver.suggest("Ye").get(0).getExpansion());
    }

    @Test
    void latinSuspensions() {
        SuggestionResolver resolver = new SuggestionResolver(new AbbreviationDictionary(Collections.emptyMap()),
                null, null, null);

        assertEquals("populusque", resolver.suggest("populusq$").get(0).getExpansion());
        assertEquals("omnibus", resolver.suggest("omnib;").get(0).getExpansion());
        assertEquals("gratian", resolver.suggest("gratia$").get(0).getExpansion());
    }

    @Test
    void wordNetOnlyForSingleMarkers() {
        WordNetLexicon wordNet = mock(WordNetLexicon.class);
        when(wordNet.isAvailable()).thenReturn(true);
        SuggestionResolver resolver = new SuggestionResolver(new AbbreviationDictionary(Collections.emptyMap()),
                null, wordNet, null);

        resolver.suggest("co$te$tion");

        verify(wordNet, never()).contains(anyString());
    }

    @Test
    void unavailableLanguageModelIsNeverCalled() {
        LanguageModelSource lm = mock(LanguageModelSource.class);
        when(lm.isAvailable()).thenReturn(false);
        SuggestionResolver resolver = new SuggestionResolver(dictionary("y$", "yt"), null, null, lm);

        assertEquals("yt", resolver.suggest("y$").get(0).getExpansion());
        verify(lm, never()).expand(anyString(), anyString(), anyString(), any());
    }

    @Test
    void languageModelContributesAndFailuresAreContained() {
        LanguageModelSource lm = mock(LanguageModelSource.class);
        when(lm.isAvailable()).thenReturn(true);
        when(lm.expand(eq("wch"), anyString(), anyString(), any())).thenReturn(Collections.singletonList("which"));
        when(lm.expand(eq("boom$"), anyString(), anyString(), any())).thenThrow(new IllegalStateException("quota"));
        SuggestionResolver resolver = new SuggestionResolver(new AbbreviationDictionary(Collections.emptyMap()),
                null, null, lm);

        List<Suggestion> wch = resolver.suggest("wch");
        assertEquals(new Suggestion("which", 0.8, SuggestionSource.LANGUAGE_MODEL), wch.get(0));

        assertFalse(resolver.suggest("boom$").isEmpty());
        assertEquals(1L, resolver.statistics().get("lm_suggestions"));
    }

    @Test
    void unknownKeyCountsAsFailure() {
        SuggestionResolver resolver = new SuggestionResolver(new AbbreviationDictionary(Collections.emptyMap()),
                null, null, null);

        assertTrue(resolver.suggest("xyz").isEmpty());
        assertEquals(1L, resolver.statistics().get("failed_abbreviations"));
    }

    @Test
    void storedSolutionsRankFirst(@TempDir Path temp) throws Exception {
        SolutionStore store = SolutionStore.load(temp.resolve("machine.json"), temp.resolve("user.json"));
        store.addUser("p$", "per");
        store.addMachine("p$", "par");
        SuggestionResolver resolver = new SuggestionResolver(new AbbreviationDictionary(Collections.emptyMap()),
                store, null, null);

        List<Suggestion> suggestions = resolver.suggest("p$");

        assertEquals(new Suggestion("per", 1.0, SuggestionSource.MANUAL), suggestions.get(0));
        assertEquals(new Suggestion("par", 0.9, SuggestionSource.DICTIONARY), suggestions.get(1));
    }

    @Test
    void closestKnownKeyWithinThreeEdits() {
        SuggestionResolver resolver = new SuggestionResolver(dictionary("wch", "which"), null, null, null);

        assertEquals("wch", resolver.closestKnownKey("wchh"));
        assertNull(resolver.closestKnownKey("abcdefgh"));
        assertTrue(expansions(resolver.suggest("wchh")).contains("which"));
    }

    @Test
    void plausibility() {
        assertTrue(SuggestionResolver.isPlausible("co$cerning", "concerning"));
        assertTrue(SuggestionResolver.isPlausible("mr", "master"));
        assertFalse(SuggestionResolver.isPlausible("co$cerning", "banana"));
        assertFalse(SuggestionResolver.isPlausible("ye", " "));
    }

    @Test
    void maxSuggestionsTruncates() {
        SuggestionResolver resolver = new SuggestionResolver(dictionary("co$", "con"), null, null, null);
        resolver.setMaxSuggestions(1);

        assertEquals(1, resolver.suggest("co$").size());
    }

    @Test
    void bundledDictionaryHasDefaults() {
        AbbreviationDictionary bundled = AbbreviationDictionary.bundled();

        assertEquals(Arrays.asList("per", "par"), bundled.lookup("p$"));
        assertEquals(Collections.singletonList("the"), bundled.lookup("ye"));
    }
}
