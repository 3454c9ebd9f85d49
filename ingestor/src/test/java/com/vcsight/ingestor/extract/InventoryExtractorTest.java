package com.vcsight.ingestor.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcsight.ingestor.ProcessingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for shape detection, container scanning and field aliasing.
 * Documents are decoded with the real DocumentDecoder; no Spring context.
 */
class InventoryExtractorTest {

    DocumentDecoder    decoder   = new DocumentDecoder();
    InventoryExtractor extractor = new InventoryExtractor();

    ObjectMapper       json      = new ObjectMapper();

    private ExtractionResult extractJson(String content) {
        return extractor.extract(tree(content));
    }

    private JsonNode tree(String content) {
        try {
            return json.readTree(content);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    // ------------------------------------------------------------------
    // Document shapes
    // ------------------------------------------------------------------

    @Test
    void playbookShape_hostResultsAreLeaves() {
        ExtractionResult result = extractJson("""
                {"plays": [{"tasks": [
                  {"hosts": {"localhost": {"vm_info": [
                     {"name": "web-01", "power_state": "poweredOn"},
                     {"name": "db-01",  "power_state": "poweredOff"}]}}},
                  {"hosts": {"localhost": {"alarms": [
                     {"name": "CPU high", "severity": "warning"}]}}}
                ]}]}
                """);

        assertThat(result.vms()).extracting(VmRecord::name).containsExactly("web-01", "db-01");
        assertThat(result.alarms()).extracting(AlarmRecord::name).containsExactly("CPU high");
    }

    @Test
    void resultsShape_arrayAndSingleObject() {
        ExtractionResult array = extractJson("""
                {"results": [
                  {"virtual_machines": [{"name": "a"}]},
                  {"virtual_machines": [{"name": "b"}]},
                  "not-an-object"
                ]}
                """);
        ExtractionResult single = extractJson("""
                {"results": {"vms": [{"name": "c"}]}}
                """);

        assertThat(array.vms()).extracting(VmRecord::name).containsExactly("a", "b");
        assertThat(single.vms()).extracting(VmRecord::name).containsExactly("c");
    }

    @Test
    void factsShape_onlyAnsibleFactsIsScanned() {
        ExtractionResult result = extractJson("""
                {"ansible_facts": {"vmware_vm_info": [{"name": "facts-vm"}]},
                 "vms": [{"name": "ignored"}]}
                """);

        assertThat(result.vms()).extracting(VmRecord::name).containsExactly("facts-vm");
    }

    @Test
    void directShape_topLevelListOfVms() {
        ExtractionResult result = extractJson("""
                [{"name": "vm-1", "num_cpu": 2}, {"name": "vm-2", "num_cpu": 4}, 42]
                """);

        assertThat(result.vms()).extracting(VmRecord::name).containsExactly("vm-1", "vm-2");
    }

    @Test
    void scalarOrEmptyDocument_yieldsNothing() {
        assertThat(extractJson("42")).isEqualTo(ExtractionResult.empty());
        assertThat(extractJson("{}")).isEqualTo(ExtractionResult.empty());
        assertThat(extractor.extract(null)).isEqualTo(ExtractionResult.empty());
    }

    // ------------------------------------------------------------------
    // Containers
    // ------------------------------------------------------------------

    @Test
    void objectContainer_keyNameUsedWhenVmHasNoName() {
        ExtractionResult result = extractJson("""
                {"vm_info": {
                  "app-01": {"power_state": "poweredOn"},
                  "app-02": {"name": "explicit-name"}
                }}
                """);

        assertThat(result.vms()).extracting(VmRecord::name).containsExactly("app-01", "explicit-name");
    }

    @Test
    void onlyFirstVmContainerPresentIsUsed() {
        ExtractionResult result = extractJson("""
                {"vm_info": [{"name": "first"}], "vms": [{"name": "second"}]}
                """);

        assertThat(result.vms()).extracting(VmRecord::name).containsExactly("first");
    }

    @Test
    void vmLikeLeafWithContainer_isDuplicatedOnPurpose() {
        // The leaf is itself VM-like (has "name") and also holds a container.
        ExtractionResult result = extractJson("""
                {"results": [{"name": "host-vm", "vm_info": [{"name": "inner"}]}]}
                """);

        assertThat(result.vms()).extracting(VmRecord::name).containsExactly("inner", "host-vm");
    }

    @Test
    void alarmObjectContainer_nestedListsAreFlattened() {
        ExtractionResult result = extractJson("""
                {"alarms": {
                  "web-01": [{"name": "Disk", "severity": "critical"}, {"name": "Mem", "severity": "warning"}],
                  "Host down": {"severity": "error", "entity_name": "esx-01"}
                }}
                """);

        assertThat(result.alarms()).extracting(AlarmRecord::name).containsExactly("Disk", "Mem", "Host down");
        assertThat(result.alarms().get(2).vmName()).isEqualTo("esx-01");
        assertThat(result.alarms().get(2).severity()).isEqualTo("error");
    }

    // ------------------------------------------------------------------
    // Field aliasing
    // ------------------------------------------------------------------

    @Test
    void vendorDottedKeys_areResolved() {
        ExtractionResult result = extractJson("""
                {"vms": [
                  {"name": "literal", "runtime.powerState": "poweredOn", "config.hardware.numCPU": 8},
                  {"name": "nested", "runtime": {"powerState": "POWEREDOFF", "host": "esx-02"},
                   "config": {"hardware": {"numCPU": 2, "memoryMB": 4096}, "guestFullName": "Ubuntu"}}
                ]}
                """);

        VmRecord literal = result.vms().get(0);
        VmRecord nested  = result.vms().get(1);
        assertThat(literal.powerState()).isEqualTo("poweredon");
        assertThat(literal.cpuCount().asInt()).isEqualTo(8);
        assertThat(nested.powerState()).isEqualTo("poweredoff");
        assertThat(nested.memoryMb().asInt()).isEqualTo(4096);
        assertThat(nested.guestOs()).isEqualTo("Ubuntu");
        assertThat(nested.hostName()).isEqualTo("esx-02");
    }

    @Test
    void diskSizes_areSummedFromKilobytes() {
        ExtractionResult result = extractJson("""
                {"vms": [
                  {"name": "a", "disk": [{"size_kb": 1048576}, {"size_kb": "2097152"}]},
                  {"name": "b", "disk_gb": 40},
                  {"name": "c", "disk": []}
                ]}
                """);

        assertThat(result.vms().get(0).diskGb().asDouble()).isEqualTo(3.0);
        assertThat(result.vms().get(1).diskGb().asInt()).isEqualTo(40);
        assertThat(result.vms().get(2).diskGb()).isNull();
    }

    @Test
    void networkCount_fallsBackToNetworksSize() {
        ExtractionResult result = extractJson("""
                {"vms": [{"name": "a", "networks": [{}, {}, {}]}, {"name": "b"}]}
                """);

        assertThat(result.vms().get(0).networkCount().asInt()).isEqualTo(3);
        assertThat(result.vms().get(1).networkCount().asInt()).isZero();
    }

    @Test
    void alarmFields_defaultsAndParsing() {
        ExtractionResult result = extractJson("""
                {"alarms": [
                  {"alarm_name": "Snapshot old", "alarm_severity": "WARNING",
                   "triggered_time": "2024-01-15 12:00:00", "acknowledged": "yes"},
                  {}
                ]}
                """);

        AlarmRecord first = result.alarms().get(0);
        assertThat(first.name()).isEqualTo("Snapshot old");
        assertThat(first.severity()).isEqualTo("warning");
        assertThat(first.triggeredTime()).isEqualTo(Instant.parse("2024-01-15T12:00:00Z"));
        assertThat(first.acknowledged()).isTrue();

        AlarmRecord empty = result.alarms().get(1);
        assertThat(empty.name()).isEqualTo("Unknown Alarm");
        assertThat(empty.vmName()).isEqualTo("Unknown VM");
        assertThat(empty.status()).isEqualTo("unknown");
        assertThat(empty.triggeredTime()).isNull();
        assertThat(empty.acknowledged()).isFalse();
    }

    // ------------------------------------------------------------------
    // Robustness
    // ------------------------------------------------------------------

    @Test
    void malformedLeaf_isSkippedAndSiblingsSurvive() {
        // "vms" holds a scalar: the leaf yields nothing, but does not stop the others
        ExtractionResult result = extractJson("""
                {"results": [
                  {"vms": "garbage"},
                  {"vms": [{"name": "ok-1"}]},
                  {"alarms": [{"name": "ok-alarm"}]}
                ]}
                """);

        assertThat(result.vms()).extracting(VmRecord::name).containsExactly("ok-1");
        assertThat(result.alarms()).extracting(AlarmRecord::name).containsExactly("ok-alarm");
    }

    @Test
    void extraction_isDeterministic() {
        JsonNode doc = tree("""
                {"vm_info": {"x": {"num_cpu": "4"}, "y": {"num_cpu": 1}}, "alarms": [{"name": "a"}]}
                """);

        assertThat(extractor.extract(doc)).isEqualTo(extractor.extract(doc));
    }

    @Test
    void yamlAndJson_extractTheSameRecords(@TempDir Path dir) throws IOException {
        Path json = dir.resolve("inv.json");
        Path yaml = dir.resolve("inv.yml");
        Files.writeString(json, """
                {"vms": [{"name": "web-01", "num_cpu": 4, "memory_mb": 8192, "power_state": "poweredOn"}],
                 "alarms": [{"name": "CPU", "severity": "critical", "acknowledged": true}]}
                """);
        Files.writeString(yaml, """
                vms:
                  - name: web-01
                    num_cpu: 4
                    memory_mb: 8192
                    power_state: poweredOn
                alarms:
                  - name: CPU
                    severity: critical
                    acknowledged: true
                """);

        ExtractionResult fromJson = extractor.extract(decoder.decode(json));
        ExtractionResult fromYaml = extractor.extract(decoder.decode(yaml));

        assertThat(fromYaml).isEqualTo(fromJson);
        assertThat(fromJson.vms()).hasSize(1);
        assertThat(fromJson.alarms()).hasSize(1);
    }

    @Test
    void decode_invalidJson_isInputDecodeError(@TempDir Path dir) throws IOException {
        Path bad = dir.resolve("bad.json");
        Files.writeString(bad, "{\"vms\": [");

        assertThatThrownBy(() -> decoder.decode(bad))
                .isInstanceOf(ProcessingException.class)
                .hasMessageContaining("Invalid JSON")
                .extracting(e -> ((ProcessingException) e).getKind())
                .isEqualTo(ProcessingException.Kind.INPUT_DECODE);
    }

    @Test
    void decode_unsupportedExtension_isRejected(@TempDir Path dir) throws IOException {
        Path txt = dir.resolve("inventory.txt");
        Files.writeString(txt, "{}");

        assertThatThrownBy(() -> decoder.decode(txt))
                .isInstanceOf(ProcessingException.class)
                .hasMessageContaining("Unsupported file format");
    }
}
