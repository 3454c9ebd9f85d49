package com.vcsight.ingestor.extract;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Recovers VM and alarm records from a decoded inventory document of
 * unknown shape.
 *
 * The document is reduced to leaf result objects by {@link DocumentShape};
 * each leaf is then scanned for VMs and for alarms. Both scans always run.
 *
 * <p>VMs come from the first known container key present in the leaf. On
 * top of that, a leaf that itself looks like a VM is normalized as one too,
 * so a VM can appear twice. Records are not deduplicated.
 *
 * <p>A leaf that fails to scan is logged and skipped; its siblings are
 * still extracted. No I/O happens here.
 */
@Component
public class InventoryExtractor {

    private static final Logger log = LoggerFactory.getLogger(InventoryExtractor.class);

    static final List<String> VM_CONTAINERS = List.of(
            "vm_info", "virtual_machines", "vms", "instances",
            "vm_facts", "vmware_vm_info", "vcenter_vm_info");

    static final List<String> ALARM_CONTAINERS = List.of(
            "alarms", "vm_alarms", "alerts", "events",
            "alarm_info", "vmware_alarms");

    static final List<String> VM_INDICATORS = List.of(
            "name", "uuid", "instance_uuid", "power_state",
            "num_cpu", "memory_mb", "guest_fullname");

    public ExtractionResult extract(JsonNode document) {
        if (document == null || document.isNull() || document.isMissingNode()) {
            return ExtractionResult.empty();
        }

        DocumentShape shape = DocumentShape.of(document);
        List<JsonNode> leaves = shape.leaves(document);
        log.debug("Document shape {} with {} leaf result object(s)", shape, leaves.size());

        List<VmRecord>    vms    = new ArrayList<>();
        List<AlarmRecord> alarms = new ArrayList<>();
        int index = 0;
        for (JsonNode leaf : leaves) {
            try {
                List<VmRecord>    leafVms    = scanVms(leaf);
                List<AlarmRecord> leafAlarms = scanAlarms(leaf);
                vms.addAll(leafVms);
                alarms.addAll(leafAlarms);
            } catch (RuntimeException e) {
                log.warn("Skipping malformed leaf #{} ({} shape): {}", index, shape, e.getMessage());
            }
            index++;
        }
        return new ExtractionResult(vms, alarms);
    }

    // ------------------------------------------------------------------
    // VM scan
    // ------------------------------------------------------------------

    private List<VmRecord> scanVms(JsonNode leaf) {
        List<VmRecord> found = new ArrayList<>();

        for (String key : VM_CONTAINERS) {
            if (!leaf.has(key)) continue;
            JsonNode container = leaf.get(key);
            if (container.isArray()) {
                for (JsonNode vm : container) {
                    if (vm.isObject()) found.add(RecordNormalizer.vm(vm, null));
                }
            } else if (container.isObject()) {
                for (Map.Entry<String, JsonNode> entry : container.properties()) {
                    if (entry.getValue().isObject()) {
                        found.add(RecordNormalizer.vm(entry.getValue(), entry.getKey()));
                    }
                }
            }
            break;
        }

        if (JsonFields.hasAny(leaf, VM_INDICATORS)) {
            found.add(RecordNormalizer.vm(leaf, null));
        }
        return found;
    }

    // ------------------------------------------------------------------
    // Alarm scan
    // ------------------------------------------------------------------

    private List<AlarmRecord> scanAlarms(JsonNode leaf) {
        List<AlarmRecord> found = new ArrayList<>();

        for (String key : ALARM_CONTAINERS) {
            if (!leaf.has(key)) continue;
            JsonNode container = leaf.get(key);
            if (container.isArray()) {
                addAlarms(container, found);
            } else if (container.isObject()) {
                for (Map.Entry<String, JsonNode> entry : container.properties()) {
                    JsonNode alarm = entry.getValue();
                    if (alarm.isObject()) found.add(RecordNormalizer.alarm(alarm, entry.getKey()));
                    else if (alarm.isArray()) addAlarms(alarm, found);
                }
            }
            break;
        }
        return found;
    }

    private static void addAlarms(JsonNode array, List<AlarmRecord> found) {
        for (JsonNode alarm : array) {
            if (alarm.isObject()) found.add(RecordNormalizer.alarm(alarm, null));
        }
    }
}
