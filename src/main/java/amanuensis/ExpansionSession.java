package amanuensis;

import teihelper.AbbreviationOccurrence;
import teihelper.ParseResult;
import teihelper.TeiDocumentProcessor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs abbreviation expansion over a directory of TEI files.
 *
 * <p>For every occurrence the resolver's suggestions go to the
 * {@link DecisionSource}; accepted expansions are written into the document
 * and recorded in the {@link SolutionStore} and the dataset. Documents are
 * independent and are processed by a worker pool, each worker with its own
 * {@link TeiDocumentProcessor}; an interactive decision source gets a single
 * worker.</p>
 *
 * <p>{@link #flush()} saves everything accumulated so far and may be called
 * from a shutdown hook.</p>
 */
public class ExpansionSession {
    private static final Logger LOGGER = Logger.getLogger(ExpansionSession.class.getName());

    /**
     * Progress callback, {@code done} of {@code total} documents finished.
     */
    @FunctionalInterface
    public interface ProgressListener {
        void update(int done, int total);
    }

    /**
     * Totals of one run.
     */
    public static final class Summary {
        public final int documents;
        public final int documentsFailed;
        public final long occurrences;
        public final long accepted;
        public final long skipped;
        public final long difficult;
        public final long unresolved;
        public final boolean quit;

        Summary(int documents, int documentsFailed, long occurrences, long accepted, long skipped,
                long difficult, long unresolved, boolean quit) {
            this.documents = documents;
            this.documentsFailed = documentsFailed;
            this.occurrences = occurrences;
            this.accepted = accepted;
            this.skipped = skipped;
            this.difficult = difficult;
            this.unresolved = unresolved;
            this.quit = quit;
        }

        @Override
        public String toString() {
            return String.format("documents=%d failed=%d occurrences=%d accepted=%d skipped=%d difficult=%d unresolved=%d%s",
                    documents, documentsFailed, occurrences, accepted, skipped, difficult, unresolved,
                    quit ? " (stopped early)" : "");
        }
    }

    private final AmanuensisConfig config;
    private final SolutionStore store;
    private final SuggestionResolver resolver;
    private final DecisionSource decisions;
    private final FlaggedPassageLog difficultLog;
    private final FlaggedPassageLog unresolvedLog;
    private final Set<String> ambiguousKeys;

    private final List<DatasetRecord> records = Collections.synchronizedList(new ArrayList<>());
    private final List<TeiDocumentProcessor> processors = Collections.synchronizedList(new ArrayList<>());
    private final AtomicBoolean quit = new AtomicBoolean();
    private final AtomicLong occurrences = new AtomicLong();
    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong difficult = new AtomicLong();
    private final AtomicLong unresolved = new AtomicLong();
    private int recordsFlushed;
    private Path datasetFile;

    public ExpansionSession(AmanuensisConfig config, SolutionStore store, SuggestionResolver resolver,
                            DecisionSource decisions) {
        this.config = config;
        this.store = store;
        this.resolver = resolver;
        this.decisions = decisions;
        this.difficultLog = new FlaggedPassageLog(config.difficultPassagesPath());
        this.unresolvedLog = new FlaggedPassageLog(config.unresolvedPath());
        this.ambiguousKeys = config.ambiguousKeys();
    }

    /**
     * Lists the {@code .xml} files below {@code inputDir}, sorted, or just the file
     * when {@code input} is a file.
     */
    public static List<Path> collectInputs(Path input) throws IOException {
        if (Files.isRegularFile(input)) {
            return Collections.singletonList(input);
        }
        try (Stream<Path> walk = Files.walk(input)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(java.util.Locale.ROOT).endsWith(".xml"))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * Processes every document below {@code input}, writing results under
     * {@code outputDir} at the same relative paths, then flushes.
     *
     * @param listener progress callback, may be {@code null}
     * @throws IOException if the input cannot be listed
     */
    public Summary run(Path input, Path outputDir, ProgressListener listener) throws IOException {
        List<Path> files = collectInputs(input);
        Path base = Files.isRegularFile(input) ? input.toAbsolutePath().getParent() : input.toAbsolutePath();
        int workers = decisions.isInteractive() ? 1 : Math.max(1, config.settings.workers);
        LOGGER.info("Processing " + files.size() + " documents with " + workers + " worker(s)");

        ThreadLocal<TeiDocumentProcessor> processor = ThreadLocal.withInitial(() -> {
            TeiDocumentProcessor p = new TeiDocumentProcessor(config);
            processors.add(p);
            return p;
        });

        AtomicInteger done = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            List<Future<?>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(pool.submit(() -> {
                    if (!quit.get()) {
                        Path out = outputDir.resolve(base.relativize(file.toAbsolutePath()).toString());
                        if (!processFile(file, out, processor.get())) {
                            failed.incrementAndGet();
                        }
                    }
                    int n = done.incrementAndGet();
                    if (listener != null) listener.update(n, files.size());
                }));
            }
            for (Future<?> f : futures) {
                try {
                    f.get();
                } catch (ExecutionException e) {
                    failed.incrementAndGet();
                    LOGGER.log(Level.SEVERE, "Worker failed", e.getCause());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warning("Interrupted, flushing what has been collected");
        } finally {
            pool.shutdownNow();
            flush();
        }
        return new Summary(files.size(), failed.get(), occurrences.get(), accepted.get(), skipped.get(),
                difficult.get(), unresolved.get(), quit.get());
    }

    /**
     * Parses one document, asks for a decision on each occurrence and saves the result.
     *
     * @return {@code false} if the document could not be parsed or saved
     */
    public boolean processFile(Path file, Path outputFile, TeiDocumentProcessor processor) {
        ParseResult parsed = processor.parse(file);
        if (!parsed.isParsed()) {
            return false;
        }

        for (AbbreviationOccurrence occ : parsed.occurrences) {
            if (quit.get()) break;
            occurrences.incrementAndGet();
            handle(occ, processor);
        }

        boolean saved = processor.save(parsed.document, outputFile);
        store.persistQuietly();
        return saved;
    }

    private void handle(AbbreviationOccurrence occ, TeiDocumentProcessor processor) {
        if (ambiguousKeys.contains(occ.getKey()) && !decisions.isInteractive()) {
            difficult.incrementAndGet();
            difficultLog.append(FlaggedPassageLog.difficultEntry(occ));
            return;
        }

        List<Suggestion> suggestions = resolver.suggest(occ);
        Decision decision = decisions.requestDecision(occ, suggestions);
        switch (decision.getKind()) {
            case ACCEPT:
                if (processor.addExpansion(occ, decision.getExpansion())) {
                    record(occ, decision);
                } else {
                    unresolved.incrementAndGet();
                    unresolvedLog.append(FlaggedPassageLog.unresolvedEntry(occ));
                }
                break;
            case DIFFICULT:
                difficult.incrementAndGet();
                difficultLog.append(FlaggedPassageLog.difficultEntry(occ));
                break;
            case QUIT:
                quit.set(true);
                break;
            case SKIP:
            default:
                if (suggestions.isEmpty()) {
                    unresolved.incrementAndGet();
                    unresolvedLog.append(FlaggedPassageLog.unresolvedEntry(occ));
                } else {
                    skipped.incrementAndGet();
                }
                break;
        }
    }

    private void record(AbbreviationOccurrence occ, Decision decision) {
        accepted.incrementAndGet();
        if (decisions.isInteractive()) {
            store.addUser(occ.getKey(), decision.getExpansion());
        } else {
            store.addMachine(occ.getKey(), decision.getExpansion());
        }
        records.add(DatasetRecord.of(occ, decision));
    }

    /**
     * Saves the solution store and the dataset records collected so far.
     * Safe to call repeatedly and from a shutdown hook.
     */
    public synchronized void flush() {
        store.persistQuietly();
        List<DatasetRecord> snapshot;
        synchronized (records) {
            snapshot = new ArrayList<>(records);
        }
        if (snapshot.isEmpty() || snapshot.size() == recordsFlushed) {
            return;
        }
        try {
            if (datasetFile == null) {
                datasetFile = DatasetWriter.write(snapshot, config.datasetDir());
            } else {
                AtomicJsonWriter.write(datasetFile, snapshot);
            }
            recordsFlushed = snapshot.size();
            LOGGER.info("Wrote " + snapshot.size() + " dataset records to " + datasetFile);
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Failed to write dataset records", e);
        }
    }

    public boolean isQuit() {
        return quit.get();
    }

    public List<DatasetRecord> records() {
        synchronized (records) {
            return Collections.unmodifiableList(new ArrayList<>(records));
        }
    }

    public Path datasetFile() {
        return datasetFile;
    }

    public FlaggedPassageLog difficultLog() {
        return difficultLog;
    }

    public FlaggedPassageLog unresolvedLog() {
        return unresolvedLog;
    }

    /**
     * Counters of every processor used so far, summed by name.
     */
    public Map<String, Long> processorStats() {
        Map<String, Long> totals = new LinkedHashMap<>();
        synchronized (processors) {
            for (TeiDocumentProcessor p : processors) {
                p.stats().snapshot().forEach((name, value) -> totals.merge(name, value, Long::sum));
            }
        }
        return totals;
    }
}
