package com.vcsight.ingestor.api.dto;

import com.vcsight.ingestor.model.JobStatus;

import java.util.Map;

/** Result of POST /api/jobs/process: jobs handled by the pass, then the job count per status. */
public record ProcessResponse(int processed, Map<JobStatus, Long> statusCounts) {}
