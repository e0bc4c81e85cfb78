package teihelper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters of one {@link TeiDocumentProcessor}.
 */
public final class ProcessorStats {
    final AtomicLong documentsProcessed = new AtomicLong();
    final AtomicLong abbreviationsFound = new AtomicLong();
    final AtomicLong alreadyExpanded = new AtomicLong();
    final AtomicLong malformed = new AtomicLong();
    final AtomicLong normalized = new AtomicLong();
    final AtomicLong expansionsAdded = new AtomicLong();

    ProcessorStats() {
    }

    public long documentsProcessed() {
        return documentsProcessed.get();
    }

    public long abbreviationsFound() {
        return abbreviationsFound.get();
    }

    public long alreadyExpanded() {
        return alreadyExpanded.get();
    }

    public long malformed() {
        return malformed.get();
    }

    public long normalized() {
        return normalized.get();
    }

    public long expansionsAdded() {
        return expansionsAdded.get();
    }

    public Map<String, Long> snapshot() {
        Map<String, Long> m = new LinkedHashMap<>();
        m.put("documents_processed", documentsProcessed());
        m.put("abbreviations_found", abbreviationsFound());
        m.put("already_expanded", alreadyExpanded());
        m.put("malformed", malformed());
        m.put("normalized", normalized());
        m.put("expansions_added", expansionsAdded());
        return Collections.unmodifiableMap(m);
    }

    @Override
    public String toString() {
        return snapshot().toString();
    }
}
