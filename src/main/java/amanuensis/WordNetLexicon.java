package amanuensis;

/**
 * Word list consulted by the WordNet tier.
 */
public interface WordNetLexicon {

    /**
     * @param word surface form, any case
     * @return {@code true} if the lexicon knows the word or one of its stems
     */
    boolean contains(String word);

    boolean isAvailable();

    /**
     * Lexicon used when no WordNet installation is configured.
     *
     * @return a lexicon that knows no words
     */
    static WordNetLexicon unavailable() {
        return new WordNetLexicon() {
            @Override
            public boolean contains(String word) {
                return false;
            }

            @Override
            public boolean isAvailable() {
                return false;
            }
        };
    }
}
