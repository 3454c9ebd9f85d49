package com.vcsight.ingestor.watch;

import com.vcsight.ingestor.classify.EnvironmentClassifier;
import com.vcsight.ingestor.config.IngestProperties;
import com.vcsight.ingestor.model.EnvironmentTag;
import com.vcsight.ingestor.service.JobService;
import com.vcsight.ingestor.service.JobService.EnqueueResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Turns files appearing under the watch directory into PENDING jobs.
 *
 * <ul>
 *   <li>One thread blocks on a {@link WatchService} registered on the
 *       watch directory and every subdirectory (new subdirectories are
 *       registered as they appear).</li>
 *   <li>A creation event for a supported extension starts a settle delay
 *       on a single scheduler thread. Another event for the same path
 *       restarts the delay, so a file still being written is picked up
 *       once.</li>
 *   <li>After the delay the size cap is checked, the path classified and
 *       the job enqueued. Enqueue is idempotent per active path.</li>
 *   <li>Once at startup, and again on event overflow, existing files with
 *       no job yet are enqueued. Files modified within the settle delay go
 *       through the same delay as a creation event.</li>
 * </ul>
 */
@Component
public class FileWatcher {

    private static final Logger log = LoggerFactory.getLogger(FileWatcher.class);

    private final IngestProperties      properties;
    private final EnvironmentClassifier classifier;
    private final JobService            jobService;
    private final Counter               enqueued;

    private final Map<WatchKey, Path> watchedDirs = new ConcurrentHashMap<>();
    private final Map<Path, ScheduledFuture<?>> settling = new ConcurrentHashMap<>();

    private ScheduledExecutorService scheduler;
    private WatchService watchService;
    private Thread watchThread;
    private volatile boolean running;

    public FileWatcher(IngestProperties properties,
                       EnvironmentClassifier classifier,
                       JobService jobService,
                       MeterRegistry meterRegistry) {
        this.properties = properties;
        this.classifier = classifier;
        this.jobService = jobService;
        this.enqueued   = meterRegistry.counter("vcsight.watcher.enqueued");
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isWatcherEnabled()) {
            log.info("File watcher disabled");
            return;
        }
        start();
    }

    public synchronized void start() {
        if (running) return;
        Path root = properties.getWatchDirectory();
        try {
            Files.createDirectories(root);
            watchService = root.getFileSystem().newWatchService();
            registerTree(root);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot watch " + root, e);
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "vcsight-watcher-settle");
            t.setDaemon(true);
            return t;
        });
        running = true;

        watchThread = new Thread(this::watchLoop, "vcsight-watcher");
        watchThread.setDaemon(true);
        watchThread.start();

        scheduler.schedule(this::scanExisting,
                properties.getInitialScanDelay().toMillis(), TimeUnit.MILLISECONDS);
        log.info("Watching {} (settle delay {}, startup scan in {})",
                root.toAbsolutePath(), properties.getSettleDelay(), properties.getInitialScanDelay());
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (!running) return;
        running = false;

        try {
            watchService.close();
        } catch (IOException e) {
            log.warn("Error closing watch service: {}", e.getMessage());
        }

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        settling.clear();
        watchedDirs.clear();
        log.info("File watcher stopped");
    }

    public boolean isRunning() {
        return running;
    }

    // ------------------------------------------------------------------
    // Event loop
    // ------------------------------------------------------------------

    private void watchLoop() {
        while (running) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }

            Path dir = watchedDirs.get(key);
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                    log.warn("Watch events overflowed; rescanning {}", properties.getWatchDirectory());
                    scheduler.execute(this::scanExisting);
                } else if (dir != null) {
                    onCreated(dir.resolve((Path) event.context()));
                }
            }
            if (!key.reset()) {
                watchedDirs.remove(key);
            }
        }
    }

    void onCreated(Path path) {
        if (Files.isDirectory(path)) {
            try {
                registerTree(path);
            } catch (IOException e) {
                log.warn("Cannot watch new directory {}: {}", path, e.getMessage());
            }
            // Files may have landed before the registration took effect.
            scheduler.execute(() -> scan(path));
        } else if (properties.isSupported(path)) {
            settle(path);
        } else {
            log.debug("Ignoring {}: unsupported extension", path.getFileName());
        }
    }

    /** (Re)start the settle delay for a path. */
    private void settle(Path path) {
        long delay = properties.getSettleDelay().toMillis();
        settling.compute(path, (p, previous) -> {
            if (previous != null) previous.cancel(false);
            return scheduler.schedule(() -> settled(p), delay, TimeUnit.MILLISECONDS);
        });
    }

    private void settled(Path path) {
        settling.remove(path);
        try {
            handle(path);
        } catch (RuntimeException e) {
            log.error("Could not enqueue {}: {}", path, e.getMessage(), e);
        }
    }

    private void registerTree(Path root) throws IOException {
        List<Path> dirs;
        try (Stream<Path> walk = Files.walk(root)) {
            dirs = walk.filter(Files::isDirectory).toList();
        }
        for (Path dir : dirs) {
            WatchKey key = dir.register(watchService, StandardWatchEventKinds.ENTRY_CREATE);
            watchedDirs.put(key, dir);
        }
    }

    // ------------------------------------------------------------------
    // Enqueue
    // ------------------------------------------------------------------

    /**
     * Apply the file checks, classify and enqueue.
     *
     * @return empty when the file was skipped (gone, unsupported, too large)
     */
    Optional<EnqueueResult> handle(Path file) {
        if (!Files.isRegularFile(file)) {
            log.debug("Skipping {}: no longer a regular file", file);
            return Optional.empty();
        }
        if (!properties.isSupported(file)) {
            return Optional.empty();
        }

        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            log.warn("Skipping {}: cannot read size ({})", file, e.getMessage());
            return Optional.empty();
        }
        if (size > properties.maxFileSizeBytes()) {
            log.warn("Skipping {}: {} bytes exceeds the {} MB limit", file, size, properties.getMaxFileSizeMb());
            return Optional.empty();
        }

        EnvironmentTag tag = classifier.classifyFile(file);
        EnqueueResult result = jobService.enqueue(file, tag);
        if (result.created()) {
            enqueued.increment();
        }
        return Optional.of(result);
    }

    /**
     * Enqueue every supported file under the watch directory that has no job yet.
     *
     * @return number of jobs created now; recently modified files are
     *         settled first and not counted
     */
    public int scanExisting() {
        return scan(properties.getWatchDirectory());
    }

    int scan(Path root) {
        if (!Files.isDirectory(root)) return 0;

        List<Path> candidates;
        try (Stream<Path> walk = Files.walk(root)) {
            candidates = walk.filter(Files::isRegularFile)
                    .filter(properties::isSupported)
                    .sorted()
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            log.warn("Scan of {} failed: {}", root, e.getMessage());
            return 0;
        }

        int created = 0;
        int deferred = 0;
        for (Path file : candidates) {
            try {
                if (jobService.isKnown(file)) continue;
                if (recentlyModified(file)) {
                    settle(file);
                    deferred++;
                } else if (handle(file).map(EnqueueResult::created).orElse(false)) {
                    created++;
                }
            } catch (RuntimeException e) {
                log.error("Could not enqueue {}: {}", file, e.getMessage(), e);
            }
        }
        log.info("Scan of {} enqueued {} of {} file(s), {} still settling", root, created, candidates.size(), deferred);
        return created;
    }

    /** Modified within the settle delay, or its age cannot be read. */
    private boolean recentlyModified(Path file) {
        try {
            long age = System.currentTimeMillis() - Files.getLastModifiedTime(file).toMillis();
            return age < properties.getSettleDelay().toMillis();
        } catch (IOException e) {
            log.debug("Cannot read modification time of {}: {}", file, e.getMessage());
            return true;
        }
    }
}
