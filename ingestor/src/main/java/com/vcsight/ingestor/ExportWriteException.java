package com.vcsight.ingestor;

import java.util.List;

/**
 * An artifact could not be written (disk full, permissions, ...).
 *
 * Carries the artifacts that were already on disk when the write failed so
 * the worker can record them on the failed job and the retention sweep can
 * remove them later. The list is best-effort, not a guarantee.
 */
public class ExportWriteException extends ProcessingException {

    private final List<String> partialArtifacts;

    public ExportWriteException(String message, Throwable cause, List<String> partialArtifacts) {
        super(Kind.EXPORT_WRITE, message, cause);
        this.partialArtifacts = List.copyOf(partialArtifacts);
    }

    public List<String> getPartialArtifacts() { return partialArtifacts; }
}
