package com.vcsight.ingestor.service;

import com.vcsight.ingestor.model.JobStatus;

import java.util.UUID;

/**
 * A requested transition is not allowed from the job's current status
 * (e.g. retrying a job that is not FAILED).
 */
public class JobStateException extends RuntimeException {

    public JobStateException(UUID jobId, JobStatus current, String message) {
        super("Job " + jobId + " is " + current + ": " + message);
    }

    public JobStateException(UUID jobId, JobStatus current, String message, Throwable cause) {
        super("Job " + jobId + " is " + current + ": " + message, cause);
    }
}
