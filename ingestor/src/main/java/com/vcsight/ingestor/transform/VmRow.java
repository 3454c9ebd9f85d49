package com.vcsight.ingestor.transform;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/** A cleaned VM with derived metrics, job metadata and environment tags. */
public record VmRow(
        String           name,
        String           uuid,
        String           powerState,
        int              cpuCount,
        long             memoryMb,
        double           diskGb,
        int              networkCount,
        String           guestOs,
        String           hostName,
        String           clusterName,
        String           datacenterName,
        double           memoryGb,
        double           cpuMemoryRatio,
        double           resourceScore,
        boolean          poweredOn,
        ResourceCategory resourceCategory,
        UUID             processingJobId,
        Instant          processedAt,
        String           environment,
        String           client
) implements TabularRow {

    public static final String DATA_SOURCE = "ansible_vcenter";

    @Override
    public Map<String, Object> toColumns() {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("name", name);
        columns.put("uuid", uuid);
        columns.put("power_state", powerState);
        columns.put("cpu_count", cpuCount);
        columns.put("memory_mb", memoryMb);
        columns.put("disk_gb", diskGb);
        columns.put("network_count", networkCount);
        columns.put("guest_os", guestOs);
        columns.put("host_name", hostName);
        columns.put("cluster_name", clusterName);
        columns.put("datacenter_name", datacenterName);
        columns.put("memory_gb", memoryGb);
        columns.put("cpu_memory_ratio", cpuMemoryRatio);
        columns.put("total_resources_score", resourceScore);
        columns.put("is_powered_on", poweredOn);
        columns.put("resource_category", resourceCategory.label());
        columns.put("processing_job_id", processingJobId != null ? processingJobId.toString() : null);
        columns.put("processed_at", processedAt);
        columns.put("data_source", DATA_SOURCE);
        columns.put("vcenter_environment", environment);
        columns.put("client_name", client);
        return columns;
    }
}
