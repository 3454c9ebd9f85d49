package com.vcsight.ingestor.model;

/**
 * Lifecycle of a processing Job.
 *
 * Transitions:
 *   PENDING    → PROCESSING (claimed by a scheduler pass)
 *   PROCESSING → COMPLETED  (artifacts written)
 *   PROCESSING → FAILED     (decode, missing source or export error)
 *   FAILED     → PENDING    (explicit retry only)
 *
 * COMPLETED and FAILED are terminal; nothing moves a job out of them
 * except a retry of a FAILED job.
 */
public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
