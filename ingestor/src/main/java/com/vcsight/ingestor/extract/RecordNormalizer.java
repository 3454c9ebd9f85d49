package com.vcsight.ingestor.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;

import java.util.List;
import java.util.Locale;

/**
 * Maps one loosely-shaped VM or alarm object onto the canonical record.
 *
 * Each field is resolved from an ordered alias list (see {@link JsonFields}).
 * Numeric VM fields are resolved but not coerced.
 */
final class RecordNormalizer {

    static final String UNKNOWN_VM_NAME    = "Unknown";
    static final String UNKNOWN_ALARM_NAME = "Unknown Alarm";
    static final String UNKNOWN_ALARM_VM   = "Unknown VM";
    static final String UNKNOWN            = "unknown";

    private static final double KB_PER_GB = 1024.0 * 1024.0;

    // VM aliases
    private static final List<String> VM_NAME        = List.of("name", "vm_name", "guest_name");
    private static final List<String> VM_UUID        = List.of("uuid", "instance_uuid", "vm_uuid");
    private static final List<String> POWER_STATE    = List.of("power_state", "runtime.powerState");
    private static final List<String> CPU_COUNT      = List.of("num_cpu", "cpu_count", "config.hardware.numCPU");
    private static final List<String> MEMORY_MB      = List.of("memory_mb", "memory_size_mb", "config.hardware.memoryMB");
    private static final List<String> DISK_GB        = List.of("disk_gb", "disk_size_gb");
    private static final List<String> NETWORK_COUNT  = List.of("network_count");
    private static final List<String> GUEST_OS       = List.of("guest_fullname", "guest_os", "config.guestFullName");
    private static final List<String> HOST_NAME      = List.of("host_name", "runtime.host");
    private static final List<String> CLUSTER_NAME   = List.of("cluster_name", "cluster");
    private static final List<String> DATACENTER     = List.of("datacenter_name", "datacenter");

    // Alarm aliases
    private static final List<String> ALARM_NAME     = List.of("name", "alarm_name");
    private static final List<String> DESCRIPTION    = List.of("description", "alarm_description");
    private static final List<String> SEVERITY       = List.of("severity", "alarm_severity");
    private static final List<String> STATUS         = List.of("status", "alarm_status");
    private static final List<String> ALARM_VM       = List.of("vm_name", "entity_name", "object_name");
    private static final List<String> TRIGGERED      = List.of("triggered_time", "time", "created_time");
    private static final List<String> ACKNOWLEDGED   = List.of("acknowledged");

    private RecordNormalizer() {}

    /**
     * @param keyName map key the object was found under, used as its name
     *                when the object has no {@code name} field; may be null
     */
    static VmRecord vm(JsonNode vm, String keyName) {
        String name = keyName != null && !vm.has("name")
                ? keyName
                : JsonFields.text(vm, VM_NAME, UNKNOWN_VM_NAME);

        return new VmRecord(
                name,
                JsonFields.text(vm, VM_UUID, null),
                JsonFields.lowerText(vm, POWER_STATE, UNKNOWN),
                JsonFields.first(vm, CPU_COUNT),
                JsonFields.first(vm, MEMORY_MB),
                diskGb(vm),
                networkCount(vm),
                JsonFields.text(vm, GUEST_OS, null),
                JsonFields.text(vm, HOST_NAME, null),
                JsonFields.text(vm, CLUSTER_NAME, null),
                JsonFields.text(vm, DATACENTER, null));
    }

    static AlarmRecord alarm(JsonNode alarm, String keyName) {
        String name = keyName != null && !alarm.has("name")
                ? keyName
                : JsonFields.text(alarm, ALARM_NAME, UNKNOWN_ALARM_NAME);

        return new AlarmRecord(
                name,
                JsonFields.text(alarm, DESCRIPTION, ""),
                JsonFields.lowerText(alarm, SEVERITY, UNKNOWN),
                JsonFields.lowerText(alarm, STATUS, UNKNOWN),
                JsonFields.text(alarm, ALARM_VM, UNKNOWN_ALARM_VM),
                FlexibleDateParser.parse(JsonFields.first(alarm, TRIGGERED)).orElse(null),
                acknowledged(JsonFields.first(alarm, ACKNOWLEDGED)));
    }

    // disk_gb directly, else the sum of disk[].size_kb converted to GB
    private static JsonNode diskGb(JsonNode vm) {
        JsonNode direct = JsonFields.first(vm, DISK_GB);
        if (direct != null) return direct;

        JsonNode disks = vm.get("disk");
        if (disks == null || !disks.isArray()) return null;
        double totalKb = 0;
        for (JsonNode disk : disks) {
            JsonNode size = disk.get("size_kb");
            if (size != null && size.isNumber()) totalKb += size.asDouble();
            else if (size != null && size.isTextual()) totalKb += parseOrZero(size.asText());
        }
        return totalKb > 0 ? DoubleNode.valueOf(totalKb / KB_PER_GB) : null;
    }

    // network_count directly, else the number of entries under "networks"
    private static JsonNode networkCount(JsonNode vm) {
        JsonNode direct = JsonFields.first(vm, NETWORK_COUNT);
        if (direct != null) return direct;
        JsonNode networks = vm.get("networks");
        return IntNode.valueOf(networks != null && networks.isContainerNode() ? networks.size() : 0);
    }

    private static boolean acknowledged(JsonNode value) {
        if (value == null) return false;
        if (value.isBoolean()) return value.booleanValue();
        if (value.isNumber()) return value.asInt() != 0;
        return switch (value.asText().strip().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "y", "1" -> true;
            default -> false;
        };
    }

    private static double parseOrZero(String text) {
        try {
            return Double.parseDouble(text.strip());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
