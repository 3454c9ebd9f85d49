package com.vcsight.ingestor.api.dto;

import com.vcsight.ingestor.model.Job;
import org.springframework.data.domain.Page;

import java.util.List;

/** One page of GET /api/jobs. */
public record JobPageResponse(
        List<JobResponse> jobs,
        int               page,
        int               size,
        long              totalElements,
        int               totalPages
) {
    public static JobPageResponse from(Page<Job> page) {
        return new JobPageResponse(
                page.getContent().stream().map(JobResponse::from).toList(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements(),
                page.getTotalPages()
        );
    }
}
