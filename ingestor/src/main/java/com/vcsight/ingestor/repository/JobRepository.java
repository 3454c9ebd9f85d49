package com.vcsight.ingestor.repository;

import com.vcsight.ingestor.model.Job;
import com.vcsight.ingestor.model.JobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + query operations for the jobs table.
 *
 * Spring Data JPA generates the implementation at startup.
 * List filtering goes through {@link JobSpecifications}.
 */
public interface JobRepository extends JpaRepository<Job, UUID>, JpaSpecificationExecutor<Job> {

    /** The PENDING or PROCESSING job for a file, if any. */
    Optional<Job> findByActivePath(String activePath);

    boolean existsByActivePath(String activePath);

    /** Any job, in any state, ever created for this file. */
    boolean existsByFilePath(String filePath);

    /** Oldest first; the page size is the claim batch size. */
    @Query("SELECT j.id FROM Job j WHERE j.status = :status ORDER BY j.createdAt ASC, j.id ASC")
    List<UUID> findIdsByStatus(@Param("status") JobStatus status, Pageable page);

    /**
     * Conditional state change: only applies when the job is still in
     * {@code from}. Returns the number of rows changed (0 or 1), so two
     * claimers racing for the same job cannot both win.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Job j SET j.status = :to, j.startedAt = :startedAt WHERE j.id = :id AND j.status = :from")
    int transition(@Param("id") UUID id,
                   @Param("from") JobStatus from,
                   @Param("to") JobStatus to,
                   @Param("startedAt") Instant startedAt);

    /** Retention sweep candidates. */
    List<Job> findByStatusInAndCompletedAtBefore(Collection<JobStatus> statuses, Instant cutoff);

    long countByStatus(JobStatus status);
}
