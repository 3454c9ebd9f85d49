package com.vcsight.ingestor.extract;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vcsight.ingestor.ProcessingException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Decodes an inventory file (JSON, or YAML for .yaml/.yml) into a Jackson tree.
 *
 * Both encodings produce the same node types for the same content, so the
 * extractor never needs to know which one it is looking at.
 */
@Component
public class DocumentDecoder {

    private final ObjectMapper json = new ObjectMapper();
    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

    /**
     * @throws ProcessingException of kind INPUT_DECODE when the file cannot
     *         be read, has an unsupported extension or is not valid JSON/YAML
     */
    public JsonNode decode(Path file) {
        ObjectMapper mapper = mapperFor(file);
        try (InputStream in = Files.newInputStream(file)) {
            JsonNode tree = mapper.readTree(in);
            return tree != null ? tree : MissingNode.getInstance();
        } catch (JacksonException e) {
            throw new ProcessingException(ProcessingException.Kind.INPUT_DECODE,
                    "Invalid " + formatName(file) + " in " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ProcessingException(ProcessingException.Kind.INPUT_DECODE,
                    "Cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    private ObjectMapper mapperFor(Path file) {
        String name = String.valueOf(file.getFileName()).toLowerCase(Locale.ROOT);
        if (name.endsWith(".json")) return json;
        if (name.endsWith(".yaml") || name.endsWith(".yml")) return yaml;
        throw new ProcessingException(ProcessingException.Kind.INPUT_DECODE,
                "Unsupported file format: " + file.getFileName());
    }

    private static String formatName(Path file) {
        return String.valueOf(file.getFileName()).toLowerCase(Locale.ROOT).endsWith(".json") ? "JSON" : "YAML";
    }
}
