package com.vcsight.ingestor.transform;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/** A cleaned alarm with normalized severity, priority and age. */
public record AlarmRow(
        String   name,
        String   description,
        String   severity,
        String   status,
        String   vmName,
        Instant  triggeredTime,
        boolean  acknowledged,
        Severity severityNormalized,
        Long     daysSinceTriggered,
        UUID     processingJobId,
        Instant  processedAt,
        String   environment,
        String   client
) implements TabularRow {

    public int priorityScore() {
        return severityNormalized.priority();
    }

    @Override
    public Map<String, Object> toColumns() {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("name", name);
        columns.put("description", description);
        columns.put("severity", severity);
        columns.put("status", status);
        columns.put("vm_name", vmName);
        columns.put("triggered_time", triggeredTime);
        columns.put("acknowledged", acknowledged);
        columns.put("severity_normalized", severityNormalized.label());
        columns.put("priority_score", priorityScore());
        columns.put("days_since_triggered", daysSinceTriggered);
        columns.put("processing_job_id", processingJobId != null ? processingJobId.toString() : null);
        columns.put("processed_at", processedAt);
        columns.put("data_source", VmRow.DATA_SOURCE);
        columns.put("vcenter_environment", environment);
        columns.put("client_name", client);
        return columns;
    }
}
