package amanuensis;

import teihelper.DocumentMetadata;

import java.util.Collections;
import java.util.List;

/**
 * External language model asked for expansions of a key in context.
 *
 * <p>Implementations talk to a provider of their choice. A source that is
 * unavailable (no credential, no client library) must report so through
 * {@link #isAvailable()} and contribute nothing; the suggestion cascade never
 * waits on it.</p>
 */
public interface LanguageModelSource {

    boolean isAvailable();

    /**
     * @param key           canonical key
     * @param contextBefore text before the abbreviation, may be empty
     * @param contextAfter  text after the abbreviation, may be empty
     * @param metadata      document metadata, may be {@code null}
     * @return candidate expansions, best first
     */
    List<String> expand(String key, String contextBefore, String contextAfter, DocumentMetadata metadata);

    static LanguageModelSource unavailable() {
        return new LanguageModelSource() {
            @Override
            public boolean isAvailable() {
                return false;
            }

            @Override
            public List<String> expand(String key, String contextBefore, String contextAfter,
                                       DocumentMetadata metadata) {
                return Collections.emptyList();
            }
        };
    }
}
