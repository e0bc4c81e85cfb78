package amanuensis;

import edu.mit.jwi.Dictionary;
import edu.mit.jwi.IDictionary;
import edu.mit.jwi.item.IIndexWord;
import edu.mit.jwi.item.POS;
import edu.mit.jwi.morph.WordnetStemmer;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link WordNetLexicon} backed by a local WordNet dictionary directory read with JWI.
 */
public class JwiWordNetLexicon implements WordNetLexicon, Closeable {
    private static final Logger LOGGER = Logger.getLogger(JwiWordNetLexicon.class.getName());

    private final IDictionary dictionary;
    private final WordnetStemmer stemmer;

    private JwiWordNetLexicon(IDictionary dictionary) {
        this.dictionary = dictionary;
        this.stemmer = new WordnetStemmer(dictionary);
    }

    /**
     * Opens the WordNet database found in {@code dictDir} (the directory holding
     * {@code index.noun}, {@code data.noun}, ...).
     *
     * @param dictDir WordNet {@code dict} directory, may be {@code null}
     * @return an open lexicon, or {@link WordNetLexicon#unavailable()} if the
     * directory is missing or cannot be opened
     */
    public static WordNetLexicon open(Path dictDir) {
        if (dictDir == null || !Files.isDirectory(dictDir)) {
            LOGGER.fine("No WordNet directory configured, WordNet tier disabled");
            return WordNetLexicon.unavailable();
        }
        IDictionary dict = new Dictionary(dictDir.toFile());
        try {
            dict.open();
            return new JwiWordNetLexicon(dict);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Cannot open WordNet at " + dictDir + ", WordNet tier disabled", e);
            return WordNetLexicon.unavailable();
        }
    }

    @Override
    public boolean contains(String word) {
        String lemma = word.toLowerCase(Locale.ROOT);
        for (POS pos : POS.values()) {
            IIndexWord idx = dictionary.getIndexWord(lemma, pos);
            if (idx != null) {
                return true;
            }
            try {
                List<String> stems = stemmer.findStems(lemma, pos);
                for (String stem : stems) {
                    if (dictionary.getIndexWord(stem, pos) != null) {
                        return true;
                    }
                }
            } catch (IllegalArgumentException e) {
                // JWI rejects forms it cannot stem, e.g. with digits
                LOGGER.log(Level.FINEST, "Cannot stem " + lemma, e);
            }
        }
        return false;
    }

    @Override
    public boolean isAvailable() {
        return dictionary.isOpen();
    }

    @Override
    public void close() {
        dictionary.close();
    }
}
