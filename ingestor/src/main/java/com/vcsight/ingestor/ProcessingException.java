package com.vcsight.ingestor;

/**
 * Thrown when a single job cannot be processed.
 *
 * Unchecked: the worker catches it once per job and records the message on
 * the job row, so one bad file never aborts the rest of a batch.
 */
public class ProcessingException extends RuntimeException {

    public enum Kind { INPUT_DECODE, SOURCE_MISSING, EXPORT_WRITE, RELOCATION }

    private final Kind kind;

    public ProcessingException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ProcessingException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
