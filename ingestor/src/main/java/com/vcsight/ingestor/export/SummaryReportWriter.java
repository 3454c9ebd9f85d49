package com.vcsight.ingestor.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcsight.ingestor.model.EnvironmentTag;
import com.vcsight.ingestor.model.Job;
import com.vcsight.ingestor.transform.AlarmRow;
import com.vcsight.ingestor.transform.Coercion;
import com.vcsight.ingestor.transform.VmRow;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Writes the per-job summary report: processing facts plus VM and alarm
 * statistics. One file per job, written even when nothing was extracted.
 */
@Component
public class SummaryReportWriter {

    static final int TOP_GUEST_OS = 10;

    private final ObjectMapper mapper = ArtifactJson.mapper();

    public Path write(Job job, EnvironmentTag tag, List<VmRow> vms, List<AlarmRow> alarms,
                      Instant processedAt, Path directory, String baseName) throws IOException {
        Path target = directory.resolve(baseName + ".json");
        mapper.writeValue(target.toFile(), build(job, tag, vms, alarms, processedAt));
        return target;
    }

    Map<String, Object> build(Job job, EnvironmentTag tag, List<VmRow> vms, List<AlarmRow> alarms,
                              Instant processedAt) {
        Map<String, Object> processing = new LinkedHashMap<>();
        processing.put("job_id", job.getId() != null ? job.getId().toString() : null);
        processing.put("source_file", job.getFilePath());
        processing.put("processed_at", processedAt);
        processing.put("total_vms", vms.size());
        processing.put("total_alarms", alarms.size());
        processing.put("vcenter_environment", tag.environment());
        processing.put("client_name", tag.client());
        processing.put("datacenter", tag.datacenter());

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("processing_summary", processing);
        report.put("vm_statistics", vmStatistics(vms));
        report.put("alarm_statistics", alarmStatistics(alarms));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("parsed_at", processedAt);
        metadata.put("total_vms", vms.size());
        metadata.put("total_alarms", alarms.size());
        report.put("metadata", metadata);
        return report;
    }

    static Map<String, Object> vmStatistics(List<VmRow> vms) {
        Map<String, Object> stats = new LinkedHashMap<>();
        if (vms.isEmpty()) return stats;

        stats.put("total_count", vms.size());
        stats.put("power_state_distribution", distribution(vms, VmRow::powerState, Integer.MAX_VALUE));
        stats.put("resource_category_distribution",
                distribution(vms, vm -> vm.resourceCategory().label(), Integer.MAX_VALUE));
        stats.put("average_cpu_count",
                Coercion.round2(vms.stream().mapToInt(VmRow::cpuCount).average().orElse(0)));
        stats.put("average_memory_gb",
                Coercion.round2(vms.stream().mapToDouble(VmRow::memoryGb).average().orElse(0)));
        stats.put("total_disk_gb",
                Coercion.round2(vms.stream().mapToDouble(VmRow::diskGb).sum()));
        stats.put("guest_os_distribution", distribution(vms, VmRow::guestOs, TOP_GUEST_OS));
        return stats;
    }

    static Map<String, Object> alarmStatistics(List<AlarmRow> alarms) {
        Map<String, Object> stats = new LinkedHashMap<>();
        if (alarms.isEmpty()) return stats;

        long acknowledged = alarms.stream().filter(AlarmRow::acknowledged).count();
        stats.put("total_count", alarms.size());
        stats.put("severity_distribution",
                distribution(alarms, a -> a.severityNormalized().label(), Integer.MAX_VALUE));
        stats.put("acknowledged_count", acknowledged);
        stats.put("unacknowledged_count", alarms.size() - acknowledged);
        stats.put("unique_vms_with_alarms", alarms.stream().map(AlarmRow::vmName).distinct().count());
        return stats;
    }

    /** Value counts, most frequent first (ties by value), null values skipped. */
    static <T> Map<String, Long> distribution(List<T> rows, Function<T, String> key, int limit) {
        Map<String, Long> counts = rows.stream()
                .map(key)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));

        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(limit)
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue,
                        (a, b) -> a, LinkedHashMap::new));
    }
}
