package com.vcsight.ingestor.export;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/** Delimited tabular encoding with a header row. */
@Component
public class CsvArtifactWriter implements ArtifactWriter {

    @Override
    public ExportFormat format() {
        return ExportFormat.CSV;
    }

    @Override
    public Path write(Table table, Path directory, String baseName) throws IOException {
        Path target = directory.resolve(baseName + "." + format().extension());
        CSVFormat csv = CSVFormat.DEFAULT.builder()
                .setHeader(table.columns().toArray(String[]::new))
                .build();

        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(out, csv)) {
            for (Map<String, Object> row : table.rows()) {
                printer.printRecord(table.columns().stream().map(row::get).toList());
            }
        }
        return target;
    }
}
