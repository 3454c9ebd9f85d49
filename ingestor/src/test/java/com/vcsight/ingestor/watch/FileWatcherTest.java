package com.vcsight.ingestor.watch;

import com.vcsight.ingestor.classify.EnvironmentClassifier;
import com.vcsight.ingestor.config.IngestProperties;
import com.vcsight.ingestor.model.EnvironmentTag;
import com.vcsight.ingestor.model.Job;
import com.vcsight.ingestor.service.JobService;
import com.vcsight.ingestor.service.JobService.EnqueueResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * FileWatcher tests. The file checks and scans are driven directly; one
 * test runs the real WatchService against a temp directory.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class FileWatcherTest {

    @Mock JobService jobService;

    @TempDir Path watchDir;

    IngestProperties    properties;
    SimpleMeterRegistry meters;
    FileWatcher         watcher;

    @BeforeEach
    void setUp() {
        properties = new IngestProperties();
        properties.setWatchDirectory(watchDir);
        meters = new SimpleMeterRegistry();
        EnvironmentClassifier classifier = new EnvironmentClassifier(
                Map.of("prod-vcenter1", new EnvironmentTag("production-vc1", "client-a", null)));
        watcher = new FileWatcher(properties, classifier, jobService, meters);

        when(jobService.enqueue(any(), any())).thenAnswer(inv -> {
            Path file = inv.getArgument(0);
            return new EnqueueResult(new Job(file.getFileName().toString(), file.toString(), Instant.EPOCH), true);
        });
    }

    @AfterEach
    void tearDown() {
        watcher.shutdown();
    }

    // ------------------------------------------------------------------
    // handle()
    // ------------------------------------------------------------------

    @Test
    void handle_supportedFile_isClassifiedAndEnqueued() throws IOException {
        Path file = Files.createDirectories(watchDir.resolve("prod-vcenter1")).resolve("vms.json");
        Files.writeString(file, "{}");

        Optional<EnqueueResult> result = watcher.handle(file);

        assertThat(result).isPresent();
        verify(jobService).enqueue(eq(file), eq(new EnvironmentTag("production-vc1", "client-a", "unknown")));
        assertThat(meters.counter("vcsight.watcher.enqueued").count()).isEqualTo(1.0);
    }

    @Test
    void handle_unsupportedExtension_isIgnored() throws IOException {
        Path file = Files.writeString(watchDir.resolve("notes.txt"), "hello");

        assertThat(watcher.handle(file)).isEmpty();
        verifyNoInteractions(jobService);
    }

    @Test
    void handle_extensionCheckIsCaseInsensitive() throws IOException {
        Path file = Files.writeString(watchDir.resolve("INVENTORY.YML"), "vms: []");

        assertThat(watcher.handle(file)).isPresent();
    }

    @Test
    void handle_oversizedFile_isSkipped() throws IOException {
        properties.setMaxFileSizeMb(0);
        Path file = Files.writeString(watchDir.resolve("big.json"), "{}");

        assertThat(watcher.handle(file)).isEmpty();
        verifyNoInteractions(jobService);
    }

    @Test
    void handle_vanishedFile_isSkipped() {
        assertThat(watcher.handle(watchDir.resolve("gone.json"))).isEmpty();
        verifyNoInteractions(jobService);
    }

    @Test
    void handle_existingActiveJob_doesNotCountAsEnqueued() throws IOException {
        Path file = Files.writeString(watchDir.resolve("dup.json"), "{}");
        doReturn(new EnqueueResult(new Job("dup.json", file.toString(), Instant.EPOCH), false))
                .when(jobService).enqueue(any(), any());

        assertThat(watcher.handle(file)).isPresent();
        assertThat(meters.counter("vcsight.watcher.enqueued").count()).isZero();
    }

    @Test
    void handle_watchRootUnderEnvironmentLikeDirectory_doesNotTagFromIt() throws IOException {
        Path root = Files.createDirectories(watchDir.resolve("opt-devtools/ansible_outputs"));
        properties.setWatchDirectory(root);
        FileWatcher rooted = new FileWatcher(properties, new EnvironmentClassifier(properties), jobService, meters);
        Path file = Files.writeString(root.resolve("vms.json"), "{}");

        rooted.handle(file);

        verify(jobService).enqueue(eq(file), eq(EnvironmentTag.UNKNOWN));
    }

    // ------------------------------------------------------------------
    // scanExisting()
    // ------------------------------------------------------------------

    @Test
    void scanExisting_enqueuesOnlyUnknownSupportedFiles() throws IOException {
        Path known   = aged(Files.writeString(watchDir.resolve("known.json"), "{}"));
        Path fresh   = aged(Files.writeString(Files.createDirectories(watchDir.resolve("sub")).resolve("fresh.yaml"), "a: 1"));
        Files.writeString(watchDir.resolve("readme.md"), "#");
        when(jobService.isKnown(known)).thenReturn(true);
        when(jobService.isKnown(fresh)).thenReturn(false);

        int created = watcher.scanExisting();

        assertThat(created).isEqualTo(1);
        verify(jobService).enqueue(eq(fresh), any());
        verify(jobService, never()).enqueue(eq(known), any());
    }

    @Test
    void scanExisting_oversizedFilesAreSkipped() throws IOException {
        properties.setMaxFileSizeMb(0);
        aged(Files.writeString(watchDir.resolve("big.json"), "{}"));

        assertThat(watcher.scanExisting()).isZero();
        verify(jobService, never()).enqueue(any(), any());
    }

    @Test
    void scanExisting_recentlyModifiedFileWaitsForSettleDelay() throws IOException {
        properties.setSettleDelay(Duration.ofMillis(500));
        properties.setInitialScanDelay(Duration.ofHours(1));
        Path writing = Files.writeString(watchDir.resolve("writing.json"), "{\"vms\": [");
        watcher.start();

        assertThat(watcher.scanExisting()).isZero();
        verify(jobService, never()).enqueue(any(), any());

        verify(jobService, timeout(5000)).enqueue(eq(writing), any());
    }

    // ------------------------------------------------------------------
    // Live watch
    // ------------------------------------------------------------------

    @Test
    void start_newFileIsEnqueuedOnceAfterSettling() throws IOException {
        properties.setSettleDelay(Duration.ofMillis(300));
        properties.setInitialScanDelay(Duration.ofHours(1));
        watcher.start();
        assertThat(watcher.isRunning()).isTrue();

        Path file = watchDir.resolve("arrived.json");
        Files.writeString(file, "{\"vms\": []}");

        verify(jobService, timeout(5000)).enqueue(eq(file), any());
        verify(jobService, after(600).times(1)).enqueue(any(), any());
    }

    @Test
    void start_newSubdirectoryIsWatched() throws IOException {
        properties.setSettleDelay(Duration.ofMillis(100));
        properties.setInitialScanDelay(Duration.ofHours(1));
        watcher.start();

        Path file = Files.createDirectories(watchDir.resolve("client-x/dev")).resolve("vms.json");
        Files.writeString(file, "{}");

        // Either the directory scan or the file's own event may get there first.
        verify(jobService, timeout(5000).atLeastOnce()).enqueue(eq(file), any());
    }

    private static Path aged(Path file) throws IOException {
        Files.setLastModifiedTime(file, FileTime.from(Instant.now().minus(Duration.ofHours(1))));
        return file;
    }
}
