package com.vcsight.ingestor.export;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes one {@link Table} in one encoding.
 *
 * Implementations are Spring components; the exporter collects all of them
 * and uses the ones whose {@link #format()} is enabled in configuration.
 */
public interface ArtifactWriter {

    ExportFormat format();

    /**
     * @param baseName file name without extension
     * @return the file written
     */
    Path write(Table table, Path directory, String baseName) throws IOException;
}
