package com.vcsight.ingestor.export;

/** Artifact encodings produced per export group, in the order they are written. */
public enum ExportFormat {
    CSV("csv"),
    EXCEL("xlsx"),
    JSON("json");

    private final String extension;

    ExportFormat(String extension) {
        this.extension = extension;
    }

    public String extension() { return extension; }
}
