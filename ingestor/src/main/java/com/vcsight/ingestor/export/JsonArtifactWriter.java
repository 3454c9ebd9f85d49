package com.vcsight.ingestor.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/** Structured-record encoding: a JSON array with one object per row. */
@Component
public class JsonArtifactWriter implements ArtifactWriter {

    private final ObjectMapper mapper = ArtifactJson.mapper();

    @Override
    public ExportFormat format() {
        return ExportFormat.JSON;
    }

    @Override
    public Path write(Table table, Path directory, String baseName) throws IOException {
        Path target = directory.resolve(baseName + "." + format().extension());
        mapper.writeValue(target.toFile(), table.rows());
        return target;
    }
}
