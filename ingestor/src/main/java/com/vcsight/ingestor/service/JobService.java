package com.vcsight.ingestor.service;

import com.vcsight.ingestor.config.IngestProperties;
import com.vcsight.ingestor.model.EnvironmentTag;
import com.vcsight.ingestor.model.Job;
import com.vcsight.ingestor.model.JobStatus;
import com.vcsight.ingestor.repository.JobRepository;
import com.vcsight.ingestor.repository.JobSpecifications;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Core business logic for the job lifecycle.
 *
 * PENDING → PROCESSING → COMPLETED | FAILED, and FAILED → PENDING on retry.
 *
 * The two writes that race (enqueue and claim) are conditional in the
 * database: enqueue relies on the UNIQUE active_path column, claim on a
 * {@code WHERE status = PENDING} update. Neither needs a lock held here.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private static final EnumSet<JobStatus> TERMINAL = EnumSet.of(JobStatus.COMPLETED, JobStatus.FAILED);

    private final JobRepository    jobRepo;
    private final IngestProperties properties;
    private final Clock            clock;

    public JobService(JobRepository jobRepo, IngestProperties properties, Clock clock) {
        this.jobRepo    = jobRepo;
        this.properties = properties;
        this.clock      = clock;
    }

    /** @param created false when an active job for the same file already existed */
    public record EnqueueResult(Job job, boolean created) {}

    // ------------------------------------------------------------------
    // Enqueue
    // ------------------------------------------------------------------

    /**
     * Create a PENDING job for a file unless one is already PENDING or
     * PROCESSING for the same path, in which case that job is returned.
     *
     * Not @Transactional on purpose: the insert is flushed on its own so a
     * unique-key violation from a concurrent enqueue surfaces here and can
     * be answered with the winner's row.
     */
    public EnqueueResult enqueue(Path file, EnvironmentTag tag) {
        String path = normalize(file);

        Optional<Job> existing = jobRepo.findByActivePath(path);
        if (existing.isPresent()) {
            log.debug("Active job {} already covers {}", existing.get().getId(), path);
            return new EnqueueResult(existing.get(), false);
        }

        Job job = new Job(String.valueOf(file.getFileName()), path, clock.instant());
        job.applyTag(tag);
        try {
            Job saved = jobRepo.saveAndFlush(job);
            withJobId(saved, () -> log.info("Created job for {} (environment={}, client={})",
                    path, saved.getEnvironment(), saved.getClientName()));
            return new EnqueueResult(saved, true);
        } catch (DataIntegrityViolationException e) {
            // Lost the insert race: another caller enqueued the same path first.
            return jobRepo.findByActivePath(path)
                    .map(winner -> new EnqueueResult(winner, false))
                    .orElseThrow(() -> e);
        }
    }

    public static String normalize(Path file) {
        return file.toAbsolutePath().normalize().toString();
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /** True when any job, in any state, was ever created for this file. */
    public boolean isKnown(Path file) {
        return jobRepo.existsByFilePath(normalize(file));
    }

    public Optional<Job> findById(UUID id) {
        return jobRepo.findById(id);
    }

    public Page<Job> list(JobStatus status, String environment, String client, Pageable pageable) {
        return jobRepo.findAll(JobSpecifications.matching(status, environment, client), pageable);
    }

    /** Job count per status, every status present (0 when none). */
    public Map<JobStatus, Long> statusCounts() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, jobRepo.countByStatus(status));
        }
        return counts;
    }

    // ------------------------------------------------------------------
    // Claiming (called by the scheduler)
    // ------------------------------------------------------------------

    /**
     * Claim up to {@code batchSize} PENDING jobs, oldest first.
     *
     * Each candidate is flipped with a conditional update; a job another
     * claimer got to first affects zero rows and is skipped.
     */
    public List<Job> claimPending(int batchSize) {
        List<UUID> candidates = jobRepo.findIdsByStatus(JobStatus.PENDING, PageRequest.of(0, batchSize));
        List<Job> claimed = new ArrayList<>();
        for (UUID id : candidates) {
            if (jobRepo.transition(id, JobStatus.PENDING, JobStatus.PROCESSING, clock.instant()) == 1) {
                jobRepo.findById(id).ifPresent(claimed::add);
            } else {
                log.debug("Job {} was claimed elsewhere", id);
            }
        }
        if (!claimed.isEmpty()) {
            log.info("Claimed {} of {} pending job(s)", claimed.size(), candidates.size());
        }
        return claimed;
    }

    // ------------------------------------------------------------------
    // Transitions (called by the processor)
    // ------------------------------------------------------------------

    @Transactional
    public Job recordCounts(Job job, int vmCount, int alarmCount) {
        job.setVmCount(vmCount);
        job.setAlarmCount(alarmCount);
        return jobRepo.save(job);
    }

    /** PROCESSING → COMPLETED. The tag is applied only to fields the job does not have yet. */
    @Transactional
    public Job complete(Job job, List<String> artifacts, EnvironmentTag tag) {
        job.setStatus(JobStatus.COMPLETED);
        job.setCompletedAt(clock.instant());
        job.setActivePath(null);
        job.setArtifactPaths(artifacts);
        job.setErrorMessage(null);
        job.applyTag(tag);
        Job saved = jobRepo.save(job);
        log.info("Job completed: {} VMs, {} alarms, {} artifacts",
                saved.getVmCount(), saved.getAlarmCount(), saved.getArtifactPaths().size());
        return saved;
    }

    /** → FAILED, keeping whatever artifacts were written before the failure. */
    @Transactional
    public Job fail(Job job, String message, List<String> partialArtifacts) {
        job.setStatus(JobStatus.FAILED);
        job.setCompletedAt(clock.instant());
        job.setActivePath(null);
        job.setErrorMessage(message);
        job.setArtifactPaths(partialArtifacts);
        Job saved = jobRepo.save(job);
        log.error("Job failed: {}", message);
        return saved;
    }

    /**
     * FAILED → PENDING.
     *
     * @throws JobNotFoundException unknown id
     * @throws JobStateException    job is not FAILED, or another job is
     *                              already active for the same file
     */
    @Transactional
    public Job retry(UUID id) {
        Job job = jobRepo.findById(id).orElseThrow(() -> new JobNotFoundException(id));
        if (job.getStatus() != JobStatus.FAILED) {
            throw new JobStateException(id, job.getStatus(), "only FAILED jobs can be retried");
        }
        if (jobRepo.existsByActivePath(job.getFilePath())) {
            throw new JobStateException(id, job.getStatus(),
                    "another job is already active for " + job.getFilePath());
        }

        job.resetForRetry();
        Job saved;
        try {
            saved = jobRepo.saveAndFlush(job);
        } catch (DataIntegrityViolationException e) {
            // An enqueue for the same file won the active path in between.
            throw new JobStateException(id, JobStatus.FAILED,
                    "another job is already active for " + job.getFilePath(), e);
        }
        withJobId(saved, () -> log.info("Job reset to PENDING for retry"));
        return saved;
    }

    // ------------------------------------------------------------------
    // Retention
    // ------------------------------------------------------------------

    /**
     * Delete terminal jobs finished before now − retention, with their
     * artifact files. A file that cannot be deleted is logged and skipped.
     *
     * @return number of job rows deleted
     */
    @Transactional
    public int sweepRetention() {
        Instant cutoff = clock.instant().minus(properties.getRetention());
        List<Job> expired = jobRepo.findByStatusInAndCompletedAtBefore(TERMINAL, cutoff);
        if (expired.isEmpty()) return 0;

        int files = 0;
        for (Job job : expired) {
            for (String artifact : job.getArtifactPaths()) {
                if (deleteArtifact(artifact)) files++;
            }
        }
        jobRepo.deleteAll(expired);
        log.info("Retention sweep removed {} job(s) and {} artifact file(s) older than {}",
                expired.size(), files, cutoff);
        return expired.size();
    }

    private static boolean deleteArtifact(String artifact) {
        try {
            return Files.deleteIfExists(Path.of(artifact));
        } catch (IOException | InvalidPathException e) {
            log.warn("Could not delete artifact {}: {}", artifact, e.getMessage());
            return false;
        }
    }

    private static void withJobId(Job job, Runnable action) {
        MDC.put("jobId", String.valueOf(job.getId()));
        try {
            action.run();
        } finally {
            MDC.remove("jobId");
        }
    }
}
