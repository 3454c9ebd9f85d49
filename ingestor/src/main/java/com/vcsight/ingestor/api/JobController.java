package com.vcsight.ingestor.api;

import com.vcsight.ingestor.api.dto.EnqueueRequest;
import com.vcsight.ingestor.api.dto.JobPageResponse;
import com.vcsight.ingestor.api.dto.JobResponse;
import com.vcsight.ingestor.api.dto.ProcessResponse;
import com.vcsight.ingestor.classify.EnvironmentClassifier;
import com.vcsight.ingestor.model.JobStatus;
import com.vcsight.ingestor.service.JobNotFoundException;
import com.vcsight.ingestor.service.JobScheduler;
import com.vcsight.ingestor.service.JobService;
import com.vcsight.ingestor.service.JobService.EnqueueResult;
import com.vcsight.ingestor.service.JobStateException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Manual trigger surface for the job queue.
 *
 * POST /api/jobs               : enqueue a file (idempotent per active path)
 * GET  /api/jobs               : list jobs, filtered and paged
 * GET  /api/jobs/{id}          : poll one job
 * POST /api/jobs/{id}/retry    : FAILED → PENDING
 * POST /api/jobs/process       : run a processing pass now
 */
@RestController
@RequestMapping("/api/jobs")
public class JobController {

    private static final int MAX_PAGE_SIZE = 200;

    private final JobService            jobService;
    private final JobScheduler          scheduler;
    private final EnvironmentClassifier classifier;

    public JobController(JobService jobService, JobScheduler scheduler, EnvironmentClassifier classifier) {
        this.jobService = jobService;
        this.scheduler  = scheduler;
        this.classifier = classifier;
    }

    /**
     * Enqueue a file already on disk.
     *
     * HTTP 201: new job created
     * HTTP 200: a PENDING/PROCESSING job for the file already existed; it is returned
     * HTTP 400: filePath missing
     * HTTP 404: file does not exist
     */
    @PostMapping
    public ResponseEntity<JobResponse> enqueue(@RequestBody EnqueueRequest req) {
        if (req == null || req.filePath() == null || req.filePath().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "filePath is required");
        }
        Path file = Path.of(req.filePath());
        if (!Files.isRegularFile(file)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "File not found: " + req.filePath());
        }

        EnqueueResult result = jobService.enqueue(file, classifier.classifyFile(file));
        HttpStatus status = result.created() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(JobResponse.from(result.job()));
    }

    @GetMapping
    public JobPageResponse list(@RequestParam(required = false) JobStatus status,
                                @RequestParam(required = false) String environment,
                                @RequestParam(required = false) String client,
                                @RequestParam(defaultValue = "0") int page,
                                @RequestParam(defaultValue = "20") int size) {
        if (page < 0 || size < 1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "page must be >= 0 and size >= 1");
        }
        PageRequest pageable = PageRequest.of(page, Math.min(size, MAX_PAGE_SIZE),
                Sort.by(Sort.Direction.DESC, "createdAt"));
        return JobPageResponse.from(jobService.list(status, environment, client, pageable));
    }

    /** Returns 404 if the job ID is not found. */
    @GetMapping("/{id}")
    public JobResponse getJob(@PathVariable UUID id) {
        return jobService.findById(id)
                .map(JobResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Job not found: " + id));
    }

    /**
     * HTTP 200: job reset to PENDING
     * HTTP 404: job ID not found
     * HTTP 409: job is not FAILED, or another job is active for its file
     */
    @PostMapping("/{id}/retry")
    public JobResponse retry(@PathVariable UUID id) {
        try {
            return JobResponse.from(jobService.retry(id));
        } catch (JobNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e);
        } catch (JobStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage(), e);
        }
    }

    @PostMapping("/process")
    public ProcessResponse process() {
        int processed = scheduler.runPass();
        return new ProcessResponse(processed, jobService.statusCounts());
    }
}
