package com.vcsight.ingestor.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One unit of work: the processing of a single inventory export file.
 *
 * The job row is the durable anchor for a run. Extracted VM and alarm
 * records are never stored as rows; they end up in the artifact files
 * listed in {@link #artifactPaths}.
 *
 * DB table: jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "jobs")
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "file_name", nullable = false)
    private String fileName;

    @Column(name = "file_path", nullable = false, length = 1024)
    private String filePath;

    // Equals filePath while the job is PENDING or PROCESSING, null once terminal.
    // The UNIQUE constraint on this column is what keeps one active job per file.
    @Column(name = "active_path", length = 1024, unique = true)
    private String activePath;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.PENDING;

    @Column(name = "environment")
    private String environment;

    @Column(name = "client_name")
    private String clientName;

    @Column(name = "datacenter")
    private String datacenter;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "vm_count", nullable = false)
    private int vmCount = 0;

    @Column(name = "alarm_count", nullable = false)
    private int alarmCount = 0;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    // Loaded eagerly: jobs are handed to scheduler threads and controllers
    // outside any persistence context.
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "job_artifacts", joinColumns = @JoinColumn(name = "job_id"))
    @OrderColumn(name = "artifact_order")
    @Column(name = "artifact_path", nullable = false, length = 1024)
    private List<String> artifactPaths = new ArrayList<>();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Job() {}   // required by JPA

    public Job(String fileName, String filePath, Instant createdAt) {
        this.fileName   = fileName;
        this.filePath   = filePath;
        this.activePath = filePath;
        this.createdAt  = createdAt;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID         getId()            { return id; }
    public String       getFileName()      { return fileName; }
    public String       getFilePath()      { return filePath; }
    public String       getActivePath()    { return activePath; }
    public JobStatus    getStatus()        { return status; }
    public String       getEnvironment()   { return environment; }
    public String       getClientName()    { return clientName; }
    public String       getDatacenter()    { return datacenter; }
    public Instant      getCreatedAt()     { return createdAt; }
    public Instant      getStartedAt()     { return startedAt; }
    public Instant      getCompletedAt()   { return completedAt; }
    public int          getVmCount()       { return vmCount; }
    public int          getAlarmCount()    { return alarmCount; }
    public String       getErrorMessage()  { return errorMessage; }
    public List<String> getArtifactPaths() { return artifactPaths; }

    public void setStatus(JobStatus status)          { this.status = status; }
    public void setActivePath(String activePath)     { this.activePath = activePath; }
    public void setStartedAt(Instant t)              { this.startedAt = t; }
    public void setCompletedAt(Instant t)            { this.completedAt = t; }
    public void setVmCount(int vmCount)              { this.vmCount = vmCount; }
    public void setAlarmCount(int alarmCount)        { this.alarmCount = alarmCount; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public void setArtifactPaths(List<String> paths) {
        this.artifactPaths.clear();
        if (paths != null) this.artifactPaths.addAll(paths);
    }

    /**
     * Apply an environment tag. Fields already set on the job are kept:
     * once classified, a job's tag is never overwritten.
     */
    public void applyTag(EnvironmentTag tag) {
        if (tag == null) return;
        if (environment == null) environment = tag.environment();
        if (clientName  == null) clientName  = tag.client();
        if (datacenter  == null) datacenter  = tag.datacenter();
    }

    /** Back to PENDING with everything a previous run recorded cleared. Tags are kept. */
    public void resetForRetry() {
        status       = JobStatus.PENDING;
        activePath   = filePath;
        startedAt    = null;
        completedAt  = null;
        vmCount      = 0;
        alarmCount   = 0;
        errorMessage = null;
        artifactPaths.clear();
    }
}
