package com.modtools.idconflict.scan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modtools.idconflict.conflict.ConflictAccumulator;
import com.modtools.idconflict.conflict.ConflictClassifier;
import com.modtools.idconflict.model.ConflictRecord;
import com.modtools.idconflict.model.ResourceKey;
import com.modtools.idconflict.reader.ResourceIndexReader;

/**
 * Runs a conflict scan over a mods folder.
 *
 * Pipeline:
 * 1. locate candidate packages (inventory snapshot or directory walk)
 * 2. reuse cached key lists for files whose size and mtime are unchanged
 * 3. parse the rest, on the calling thread for small batches, otherwise on a bounded pool
 * 4. feed every result into a {@link ConflictAccumulator} from the calling thread only
 * 5. classify and sort the collisions, then persist the merged parse cache
 *
 * Cancellation is cooperative: the flag is checked between dispatches, between consumed results
 * and inside the reader. A cancelled scan returns no records and does not touch the cache.
 */
public class ScanOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ScanOrchestrator.class);

    private static final long POLL_INTERVAL_MS = 50;

    private final ResourceIndexReader reader;
    private final ConflictClassifier classifier;
    private final Supplier<ConflictAccumulator> accumulatorFactory;
    private final PackageFileLocator locator;
    private final ParseCacheStore cacheStore;

    private volatile AtomicBoolean activeCancel;

    public ScanOrchestrator(ParseCacheStore cacheStore) {
        this(new ResourceIndexReader(), new ConflictClassifier(), ConflictAccumulator::new,
                new PackageFileLocator(), cacheStore);
    }

    /**
     * @param cacheStore where the merged parse cache is written after a completed scan; null disables persistence
     */
    public ScanOrchestrator(ResourceIndexReader reader, ConflictClassifier classifier,
                            Supplier<ConflictAccumulator> accumulatorFactory, PackageFileLocator locator,
                            ParseCacheStore cacheStore) {
        this.reader = reader;
        this.classifier = classifier;
        this.accumulatorFactory = accumulatorFactory;
        this.locator = locator;
        this.cacheStore = cacheStore;
    }

    /**
     * Scans {@code root} using the cache loaded from the configured store.
     */
    public ScanOutcome scan(Path root, ScanOptions options, AtomicBoolean cancel, ScanProgressListener progress) {
        return scan(root, options, cancel, progress, new ScanDiagnostics());
    }

    /**
     * Same as {@link #scan(Path, ScanOptions, AtomicBoolean, ScanProgressListener)}, adding to
     * {@code diagnostics} notes the caller collected beforehand, such as inventory loading problems.
     */
    public ScanOutcome scan(Path root, ScanOptions options, AtomicBoolean cancel, ScanProgressListener progress,
                            ScanDiagnostics diagnostics) {
        ParseCache prior = cacheStore != null ? cacheStore.load(diagnostics) : ParseCache.empty();
        return run(root, options, cancel, progress, prior, diagnostics);
    }

    /**
     * Scans {@code root} reusing {@code priorCache}, which is treated as read-only.
     */
    public ScanOutcome scan(Path root, ScanOptions options, AtomicBoolean cancel, ScanProgressListener progress,
                            ParseCache priorCache) {
        return run(root, options, cancel, progress, priorCache != null ? priorCache : ParseCache.empty(),
                new ScanDiagnostics());
    }

    /**
     * Requests cancellation of the scan currently running on this orchestrator. A request made
     * while no scan is running is ignored and does not affect later scans; use the flag passed to
     * {@code scan} to cancel a scan before it starts.
     */
    public void cancel() {
        AtomicBoolean flag = activeCancel;
        if (flag != null) {
            log.info("Cancellation requested");
            flag.set(true);
        }
    }

    private ScanOutcome run(Path root, ScanOptions options, AtomicBoolean cancel, ScanProgressListener progress,
                            ParseCache prior, ScanDiagnostics diagnostics) {
        Path rootAbs = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(rootAbs)) {
            throw new IllegalArgumentException("Scan root is not a directory: " + rootAbs);
        }
        AtomicBoolean flag = cancel != null ? cancel : new AtomicBoolean(false);
        activeCancel = flag;
        long startNanos = System.nanoTime();

        try {
            List<Path> candidates = locator.locate(rootAbs, options, flag, diagnostics);
            log.debug("Starting scan root={} files={} recursive={} inventory={} fast={}",
                    rootAbs, candidates.size(), options.isRecursive(), options.isUseInventory(), options.isFastMode());

            ScanState state = new ScanState(candidates.size(), accumulatorFactory.get(),
                    progress != null ? progress : ScanProgressListener.NONE);

            List<PendingFile> uncached = new ArrayList<>();
            for (Path path : candidates) {
                if (flag.get()) {
                    break;
                }
                FileStamp stamp = stampOf(path);
                List<ResourceKey> cached = stamp != null ? prior.lookup(stamp.cacheKey()) : null;
                if (cached != null) {
                    state.cacheHits++;
                    state.consume(path, cached);
                } else {
                    uncached.add(new PendingFile(path, stamp));
                }
            }

            if (!flag.get()) {
                if (candidates.size() <= options.getSequentialThreshold()) {
                    parseSequentially(uncached, options, flag, state);
                } else {
                    parseInParallel(uncached, options, flag, state);
                }
            }

            if (flag.get()) {
                ScanStats stats = state.stats(elapsedSeconds(startNanos), true);
                log.info("Scan cancelled after {} of {} files", state.processed, state.total);
                return ScanOutcome.cancelled(stats, diagnostics);
            }

            List<ConflictRecord> records = classifier.buildRecords(state.accumulator.conflicts());
            persistCache(prior, state.staged, diagnostics);

            ScanStats stats = state.stats(elapsedSeconds(startNanos), false);
            log.info("Scan finished: {} conflicts, {}/{} files with entries, {} entries, {} cache hits, {}s",
                    records.size(), stats.getFilesParsedWithEntries(), stats.getFilesTotal(),
                    stats.getTotalEntriesFound(), stats.getCacheHits(), String.format("%.1f", stats.getElapsedSeconds()));
            return ScanOutcome.completed(records, stats, diagnostics);
        } finally {
            activeCancel = null;
        }
    }

    private void parseSequentially(List<PendingFile> files, ScanOptions options, AtomicBoolean cancel, ScanState state) {
        for (PendingFile file : files) {
            if (cancel.get()) {
                return;
            }
            List<ResourceKey> keys = reader.read(file.path, !options.isFastMode(), cancel);
            state.consumeParsed(file, keys);
        }
    }

    private void parseInParallel(List<PendingFile> files, ScanOptions options, AtomicBoolean cancel, ScanState state) {
        if (files.isEmpty()) {
            return;
        }
        int workers = options.resolvedWorkerCount();
        int maxInFlight = workers * 2;
        boolean allowTail = !options.isFastMode();

        ExecutorService pool = Executors.newFixedThreadPool(workers, new ParserThreadFactory());
        CompletionService<ParsedFile> completion = new ExecutorCompletionService<>(pool);
        Map<Future<ParsedFile>, PendingFile> submitted = new HashMap<>();
        int next = 0;
        int inFlight = 0;

        try {
            while (next < files.size() || inFlight > 0) {
                if (cancel.get()) {
                    break;
                }
                while (inFlight < maxInFlight && next < files.size() && !cancel.get()) {
                    PendingFile file = files.get(next++);
                    submitted.put(completion.submit(() -> new ParsedFile(file, reader.read(file.path, allowTail, cancel))), file);
                    inFlight++;
                }

                Future<ParsedFile> done = completion.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (done == null) {
                    continue;
                }
                inFlight--;
                if (cancel.get()) {
                    break;
                }
                PendingFile file = submitted.remove(done);
                ParsedFile parsed = resultOf(done, file);
                if (parsed != null) {
                    state.consumeParsed(parsed.file, parsed.keys);
                } else {
                    state.consume(file.path, List.of());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel.set(true);
        } finally {
            if (cancel.get()) {
                submitted.keySet().forEach(f -> f.cancel(false));
            }
            pool.shutdown();
        }
    }

    /**
     * @return the parsed result, or null when the worker failed; the file then counts as having no keys
     *         and is not cached
     */
    private static ParsedFile resultOf(Future<ParsedFile> done, PendingFile file) throws InterruptedException {
        try {
            return done.get();
        } catch (ExecutionException e) {
            log.warn("Parse task failed for {}", file.path, e.getCause());
            return null;
        }
    }

    private void persistCache(ParseCache prior, List<ParseCacheEntry> staged, ScanDiagnostics diagnostics) {
        if (cacheStore == null || staged.isEmpty()) {
            return;
        }
        try {
            cacheStore.save(prior.mergedWith(staged));
        } catch (IOException | RuntimeException e) {
            String message = "Unable to persist parse cache to " + cacheStore.getFile() + " (" + e.getMessage() + ")";
            log.warn(message);
            diagnostics.getWarnings().add(message);
        }
    }

    private static FileStamp stampOf(Path path) {
        try {
            return FileStamp.of(path);
        } catch (IOException e) {
            log.debug("Cannot stat {} ({})", path, e.toString());
            return null;
        }
    }

    private static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    private record PendingFile(Path path, FileStamp stamp) {}

    private record ParsedFile(PendingFile file, List<ResourceKey> keys) {}

    /**
     * Mutable scan bookkeeping, touched only by the orchestrating thread.
     */
    private static final class ScanState {
        final int total;
        final ConflictAccumulator accumulator;
        final ScanProgressListener progress;
        final List<ParseCacheEntry> staged = new ArrayList<>();

        int processed;
        int cacheHits;
        int filesWithEntries;
        long entriesFound;

        ScanState(int total, ConflictAccumulator accumulator, ScanProgressListener progress) {
            this.total = total;
            this.accumulator = accumulator;
            this.progress = progress;
        }

        void consumeParsed(PendingFile file, List<ResourceKey> keys) {
            if (file.stamp != null) {
                staged.add(file.stamp.withKeys(keys));
            }
            consume(file.path, keys);
        }

        void consume(Path path, List<ResourceKey> keys) {
            if (!keys.isEmpty()) {
                filesWithEntries++;
                entriesFound += keys.size();
                accumulator.add(path, keys);
            }
            processed++;
            progress.onProgress(processed, total);
        }

        ScanStats stats(double elapsed, boolean cancelled) {
            return ScanStats.builder()
                    .filesTotal(total)
                    .filesParsedWithEntries(filesWithEntries)
                    .totalEntriesFound(entriesFound)
                    .cacheHits(cacheHits)
                    .elapsedSeconds(elapsed)
                    .cancelled(cancelled)
                    .build();
        }
    }

    private static final class ParserThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "package-parser-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
