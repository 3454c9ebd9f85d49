package com.vcsight.ingestor.transform;

import com.vcsight.ingestor.extract.AlarmRecord;
import com.vcsight.ingestor.extract.VmRecord;
import com.vcsight.ingestor.model.EnvironmentTag;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Cleans extracted records and derives the analytics columns.
 *
 * This is the single place where raw values are coerced: every numeric VM
 * field leaves here as a number (0 when missing or unparseable), never null.
 */
@Component
public class InventoryTransformer {

    static final String DEFAULT_VM_NAME    = "Unknown VM";
    static final String DEFAULT_ALARM_NAME = "Unknown Alarm";
    static final String DEFAULT_ALARM_VM   = "Unknown VM";
    static final String UNKNOWN            = "unknown";
    static final String POWERED_ON         = "poweredon";

    private static final double CPU_WEIGHT    = 0.3;
    private static final double MEMORY_WEIGHT = 0.4;
    private static final double DISK_WEIGHT   = 0.3;

    private static final long SECONDS_PER_DAY = 86_400;

    public List<VmRow> cleanVms(List<VmRecord> vms, EnvironmentTag tag, UUID jobId, Instant now) {
        return vms.stream().map(vm -> cleanVm(vm, tag, jobId, now)).toList();
    }

    public List<AlarmRow> cleanAlarms(List<AlarmRecord> alarms, EnvironmentTag tag, UUID jobId, Instant now) {
        return alarms.stream().map(alarm -> cleanAlarm(alarm, tag, jobId, now)).toList();
    }

    VmRow cleanVm(VmRecord vm, EnvironmentTag tag, UUID jobId, Instant now) {
        String powerState = Coercion.orDefault(vm.powerState(), UNKNOWN);
        int    cpu        = Coercion.toInt(vm.cpuCount(), 0);
        long   memoryMb   = Coercion.toLong(vm.memoryMb(), 0);
        double diskGb     = Coercion.toDouble(vm.diskGb(), 0);
        int    networks   = Coercion.toInt(vm.networkCount(), 0);

        double memoryGb = Coercion.round2(memoryMb / 1024.0);
        double ratio    = Coercion.round2(memoryGb / Math.max(cpu, 1));
        double score    = Coercion.round2(cpu * CPU_WEIGHT + memoryGb * MEMORY_WEIGHT + diskGb * DISK_WEIGHT);

        return new VmRow(
                Coercion.orDefault(vm.name(), DEFAULT_VM_NAME),
                vm.uuid(),
                powerState,
                cpu,
                memoryMb,
                diskGb,
                networks,
                vm.guestOs(),
                vm.hostName(),
                vm.clusterName(),
                vm.datacenterName(),
                memoryGb,
                ratio,
                score,
                POWERED_ON.equalsIgnoreCase(powerState),
                ResourceCategory.of(score),
                jobId,
                now,
                tag != null ? tag.environment() : null,
                tag != null ? tag.client() : null);
    }

    AlarmRow cleanAlarm(AlarmRecord alarm, EnvironmentTag tag, UUID jobId, Instant now) {
        String severity = Coercion.orDefault(alarm.severity(), UNKNOWN);
        Long days = alarm.triggeredTime() != null
                ? Math.floorDiv(Duration.between(alarm.triggeredTime(), now).getSeconds(), SECONDS_PER_DAY)
                : null;

        return new AlarmRow(
                Coercion.orDefault(alarm.name(), DEFAULT_ALARM_NAME),
                alarm.description() != null ? alarm.description() : "",
                severity,
                Coercion.orDefault(alarm.status(), UNKNOWN),
                Coercion.orDefault(alarm.vmName(), DEFAULT_ALARM_VM),
                alarm.triggeredTime(),
                alarm.acknowledged(),
                Severity.normalize(severity),
                days,
                jobId,
                now,
                tag != null ? tag.environment() : null,
                tag != null ? tag.client() : null);
    }
}
