package com.vcsight.ingestor.service;

import com.vcsight.ingestor.classify.EnvironmentClassifier;
import com.vcsight.ingestor.config.IngestProperties;
import com.vcsight.ingestor.extract.DocumentDecoder;
import com.vcsight.ingestor.extract.InventoryExtractor;
import com.vcsight.ingestor.model.EnvironmentTag;
import com.vcsight.ingestor.service.FileValidationService.FileValidation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FileValidationServiceTest {

    @TempDir Path dir;

    IngestProperties      properties;
    FileValidationService service;

    @BeforeEach
    void setUp() {
        properties = new IngestProperties();
        service = new FileValidationService(properties,
                new EnvironmentClassifier(Map.of("dev-vcenter", new EnvironmentTag("development", "internal", null))),
                new DocumentDecoder(), new InventoryExtractor());
    }

    @Test
    void validate_goodFile_reportsCountsAndTag() throws IOException {
        Path file = Files.createDirectories(dir.resolve("dev-vcenter")).resolve("inv.yml");
        Files.writeString(file, """
                vm_info:
                  - name: a
                  - name: b
                alarms:
                  - name: x
                """);

        FileValidation v = service.validate(file);

        assertThat(v.valid()).isTrue();
        assertThat(v.vmCount()).isEqualTo(2);
        assertThat(v.alarmCount()).isEqualTo(1);
        assertThat(v.environment().environment()).isEqualTo("development");
        assertThat(v.error()).isNull();
    }

    @Test
    void validate_missingFile() {
        FileValidation v = service.validate(dir.resolve("nope.json"));

        assertThat(v.valid()).isFalse();
        assertThat(v.exists()).isFalse();
        assertThat(v.error()).startsWith("File not found");
    }

    @Test
    void validate_unsupportedExtension() throws IOException {
        FileValidation v = service.validate(Files.writeString(dir.resolve("inv.txt"), "{}"));

        assertThat(v.valid()).isFalse();
        assertThat(v.supportedExtension()).isFalse();
    }

    @Test
    void validate_tooLarge() throws IOException {
        properties.setMaxFileSizeMb(0);

        FileValidation v = service.validate(Files.writeString(dir.resolve("inv.json"), "{}"));

        assertThat(v.withinSizeLimit()).isFalse();
        assertThat(v.decodable()).isFalse();
        assertThat(v.error()).contains("exceeds");
    }

    @Test
    void validate_undecodable() throws IOException {
        FileValidation v = service.validate(Files.writeString(dir.resolve("inv.json"), "{oops"));

        assertThat(v.valid()).isFalse();
        assertThat(v.decodable()).isFalse();
        assertThat(v.error()).contains("Invalid JSON");
    }
}
