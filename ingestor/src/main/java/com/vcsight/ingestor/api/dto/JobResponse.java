package com.vcsight.ingestor.api.dto;

import com.vcsight.ingestor.model.Job;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response body for the job endpoints.
 * Contains enough information for the caller to poll job progress.
 */
public record JobResponse(
        UUID         id,
        String       fileName,
        String       filePath,
        String       status,
        String       environment,
        String       client,
        String       datacenter,
        Instant      createdAt,
        Instant      startedAt,
        Instant      completedAt,
        int          vmCount,
        int          alarmCount,
        String       errorMessage,
        List<String> artifactPaths
) {
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.getId(),
                job.getFileName(),
                job.getFilePath(),
                job.getStatus().name(),
                job.getEnvironment(),
                job.getClientName(),
                job.getDatacenter(),
                job.getCreatedAt(),
                job.getStartedAt(),
                job.getCompletedAt(),
                job.getVmCount(),
                job.getAlarmCount(),
                job.getErrorMessage(),
                List.copyOf(job.getArtifactPaths())
        );
    }
}
