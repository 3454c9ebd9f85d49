package com.vcsight.ingestor.export;

import com.vcsight.ingestor.model.EnvironmentTag;

import java.util.List;

/**
 * Outcome of exporting one job.
 *
 * @param artifactPaths absolute paths of every file written, summary last
 * @param tag           the tag the rows were stamped with
 */
public record ExportResult(List<String> artifactPaths, EnvironmentTag tag) {

    public ExportResult {
        artifactPaths = List.copyOf(artifactPaths);
    }
}
