package com.vcsight.ingestor.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.vcsight.ingestor.ExportWriteException;
import com.vcsight.ingestor.ProcessingException;
import com.vcsight.ingestor.config.IngestProperties;
import com.vcsight.ingestor.export.ExportResult;
import com.vcsight.ingestor.export.InventoryExporter;
import com.vcsight.ingestor.extract.DocumentDecoder;
import com.vcsight.ingestor.extract.ExtractionResult;
import com.vcsight.ingestor.extract.InventoryExtractor;
import com.vcsight.ingestor.model.Job;
import com.vcsight.ingestor.model.JobStatus;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Runs one claimed job end to end:
 * decode → extract → record counts → export → complete → relocate source.
 *
 * Every failure ends in {@link JobService#fail}; nothing escapes to the
 * caller, so a batch keeps going after a bad file. The source file is
 * only moved after the job is COMPLETED, and a failed move does not undo
 * the completion.
 */
@Service
public class JobProcessor {

    private static final Logger log = LoggerFactory.getLogger(JobProcessor.class);

    static final DateTimeFormatter RELOCATION_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final JobService         jobService;
    private final DocumentDecoder    decoder;
    private final InventoryExtractor extractor;
    private final InventoryExporter  exporter;
    private final IngestProperties   properties;
    private final MeterRegistry      meterRegistry;
    private final Clock              clock;

    public JobProcessor(JobService jobService,
                        DocumentDecoder decoder,
                        InventoryExtractor extractor,
                        InventoryExporter exporter,
                        IngestProperties properties,
                        MeterRegistry meterRegistry,
                        Clock clock) {
        this.jobService    = jobService;
        this.decoder       = decoder;
        this.extractor     = extractor;
        this.exporter      = exporter;
        this.properties    = properties;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
    }

    /** @return the job's terminal status */
    public JobStatus process(Job job) {
        MDC.put("jobId", String.valueOf(job.getId()));
        Timer.Sample sample = Timer.start(meterRegistry);
        Job result;
        try {
            result = execute(job);
        } finally {
            MDC.remove("jobId");
        }

        String outcome = result.getStatus().name().toLowerCase(Locale.ROOT);
        sample.stop(meterRegistry.timer("vcsight.job.duration", "outcome", outcome));
        meterRegistry.counter("vcsight.job.outcomes", "outcome", outcome).increment();
        return result.getStatus();
    }

    private Job execute(Job job) {
        Path source = Path.of(job.getFilePath());
        Job completed;
        try {
            if (!Files.exists(source)) {
                throw new ProcessingException(ProcessingException.Kind.SOURCE_MISSING,
                        "File not found: " + source);
            }
            log.info("Processing {}", source);

            JsonNode document = decoder.decode(source);
            ExtractionResult extraction = extractor.extract(document);
            jobService.recordCounts(job, extraction.vms().size(), extraction.alarms().size());

            ExportResult export = exporter.export(extraction, job);
            completed = jobService.complete(job, export.artifactPaths(), export.tag());
        } catch (ExportWriteException e) {
            log.error("Export failed after {} artifact(s)", e.getPartialArtifacts().size(), e);
            return jobService.fail(job, e.getMessage(), e.getPartialArtifacts());
        } catch (ProcessingException e) {
            log.error("{} failure: {}", e.getKind(), e.getMessage());
            return jobService.fail(job, e.getMessage(), List.of());
        } catch (Exception e) {
            log.error("Unexpected error processing {}", source, e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return jobService.fail(job, message, List.of());
        }

        try {
            relocate(source);
        } catch (ProcessingException e) {
            log.warn("{} (job stays COMPLETED)", e.getMessage(), e.getCause());
        }
        return completed;
    }

    /** Move a processed source out of the watch directory, prefixed with the move time. */
    Path relocate(Path source) {
        Path targetDir = properties.getProcessedDirectory();
        Path target = targetDir.resolve(RELOCATION_STAMP.format(clock.instant()) + "_" + source.getFileName());
        try {
            Files.createDirectories(targetDir);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
            log.info("Moved {} to {}", source.getFileName(), target);
            return target;
        } catch (IOException e) {
            throw new ProcessingException(ProcessingException.Kind.RELOCATION,
                    "Could not move " + source + " to " + target + ": " + e.getMessage(), e);
        }
    }
}
