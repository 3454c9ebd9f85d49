package com.vcsight.ingestor.export;

import com.vcsight.ingestor.ExportWriteException;
import com.vcsight.ingestor.classify.EnvironmentClassifier;
import com.vcsight.ingestor.config.IngestProperties;
import com.vcsight.ingestor.extract.ExtractionResult;
import com.vcsight.ingestor.model.EnvironmentTag;
import com.vcsight.ingestor.model.Job;
import com.vcsight.ingestor.transform.AlarmRow;
import com.vcsight.ingestor.transform.InventoryTransformer;
import com.vcsight.ingestor.transform.TabularRow;
import com.vcsight.ingestor.transform.VmRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns one job's extraction into analytics artifacts.
 *
 * Pipeline: clean (via {@link InventoryTransformer}) → stamp the job's
 * environment tag → partition by environment → write every enabled
 * encoding per partition → write the summary report.
 *
 * Artifacts already written stay on disk when a later write fails; their
 * paths travel with the {@link ExportWriteException}.
 */
@Component
public class InventoryExporter {

    private static final Logger log = LoggerFactory.getLogger(InventoryExporter.class);

    static final String VM_KIND      = "vcenter_vms";
    static final String ALARM_KIND   = "vcenter_alarms";
    static final String SUMMARY_KIND = "processing_summary";
    static final String VM_SHEET     = "VM_Details";
    static final String ALARM_SHEET  = "VM_Alarms";

    private final IngestProperties      properties;
    private final InventoryTransformer  transformer;
    private final EnvironmentClassifier classifier;
    private final List<ArtifactWriter>  writers;
    private final SummaryReportWriter   summaryWriter;
    private final Clock                 clock;

    public InventoryExporter(IngestProperties properties,
                             InventoryTransformer transformer,
                             EnvironmentClassifier classifier,
                             List<ArtifactWriter> writers,
                             SummaryReportWriter summaryWriter,
                             Clock clock) {
        this.properties    = properties;
        this.transformer   = transformer;
        this.classifier    = classifier;
        this.writers       = writers.stream()
                .sorted(Comparator.comparing(ArtifactWriter::format))
                .toList();
        this.summaryWriter = summaryWriter;
        this.clock         = clock;
    }

    public ExportResult export(ExtractionResult extraction, Job job) {
        EnvironmentTag stored = EnvironmentTag.of(job);
        EnvironmentTag tag = resolveTag(job);
        Instant now = clock.instant();
        String timestamp = ArtifactNames.timestamp(now);

        List<VmRow>    vms    = transformer.cleanVms(extraction.vms(), tag, job.getId(), now);
        List<AlarmRow> alarms = transformer.cleanAlarms(extraction.alarms(), tag, job.getId(), now);

        List<String> artifacts = new ArrayList<>();
        try {
            Path outputDir = properties.getOutputDirectory();
            Files.createDirectories(outputDir);

            if (!vms.isEmpty()) {
                exportCollection(VM_KIND, VM_SHEET, vms, stored, timestamp, outputDir, artifacts);
            }
            if (!alarms.isEmpty()) {
                exportCollection(ALARM_KIND, ALARM_SHEET, alarms, stored, timestamp, outputDir, artifacts);
            }

            String summaryName = ArtifactNames.of(SUMMARY_KIND, tag.client(), tag.environment(), timestamp);
            Path summary = summaryWriter.write(job, tag, vms, alarms, now, outputDir, summaryName);
            artifacts.add(summary.toAbsolutePath().toString());
        } catch (IOException | RuntimeException e) {
            // Files already written stay recorded on the job.
            throw new ExportWriteException(
                    "Failed to write artifacts for " + job.getFilePath() + ": " + e.getMessage(), e, artifacts);
        }

        log.info("Exported {} VMs and {} alarms to {} artifacts (environment={}, client={})",
                vms.size(), alarms.size(), artifacts.size(), tag.environment(), tag.client());
        return new ExportResult(artifacts, tag);
    }

    /** The job's stored tag, or a classification of its path when it has none. */
    EnvironmentTag resolveTag(Job job) {
        EnvironmentTag stored = EnvironmentTag.of(job);
        EnvironmentTag tag = stored != null ? stored : classifier.classifyFile(Path.of(job.getFilePath()));
        return EnvironmentTag.UNKNOWN.overriddenBy(tag);
    }

    private void exportCollection(String kind, String sheet, List<? extends TabularRow> rows,
                                  EnvironmentTag jobTag, String timestamp, Path outputDir,
                                  List<String> artifacts) throws IOException {
        for (Map.Entry<String, List<TabularRow>> group : partition(kind, rows, jobTag, timestamp).entrySet()) {
            Table table = Table.of(sheet, group.getValue());
            for (ArtifactWriter writer : activeWriters()) {
                Path written = writer.write(table, outputDir, group.getKey());
                artifacts.add(written.toAbsolutePath().toString());
                log.debug("Wrote {} ({} rows)", written, group.getValue().size());
            }
        }
    }

    /**
     * Base name → rows. Rows without an environment are dropped when
     * separating. Otherwise everything forms one group, named after the
     * job's own tag when it has both environment and client.
     */
    Map<String, List<TabularRow>> partition(String kind, List<? extends TabularRow> rows,
                                            EnvironmentTag jobTag, String timestamp) {
        Map<String, List<TabularRow>> groups = new LinkedHashMap<>();

        if (!properties.isSeparateByEnvironment()) {
            String name = jobTag != null && jobTag.environment() != null && jobTag.client() != null
                    ? ArtifactNames.of(kind, jobTag.client(), jobTag.environment(), timestamp)
                    : ArtifactNames.of(kind, timestamp);
            groups.put(name, new ArrayList<>(rows));
            return groups;
        }

        Map<String, List<TabularRow>> byEnvironment = new LinkedHashMap<>();
        for (TabularRow row : rows) {
            if (row.environment() == null || row.environment().isBlank()) continue;
            byEnvironment.computeIfAbsent(row.environment(), env -> new ArrayList<>()).add(row);
        }
        byEnvironment.forEach((environment, members) -> {
            String client = members.get(0).client();
            groups.put(ArtifactNames.of(kind, client, environment, timestamp), members);
        });
        return groups;
    }

    private List<ArtifactWriter> activeWriters() {
        return writers.stream()
                .filter(w -> properties.getExportFormats().contains(w.format()))
                .toList();
    }
}
