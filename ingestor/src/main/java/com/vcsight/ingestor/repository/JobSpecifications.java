package com.vcsight.ingestor.repository;

import com.vcsight.ingestor.model.Job;
import com.vcsight.ingestor.model.JobStatus;
import org.springframework.data.jpa.domain.Specification;

/** Optional list filters for GET /api/jobs. A null argument means "no filter". */
public final class JobSpecifications {

    private JobSpecifications() {}

    public static Specification<Job> matching(JobStatus status, String environment, String client) {
        return Specification.where(hasStatus(status))
                .and(hasEnvironment(environment))
                .and(hasClient(client));
    }

    static Specification<Job> hasStatus(JobStatus status) {
        return (root, query, cb) -> status == null ? null : cb.equal(root.get("status"), status);
    }

    static Specification<Job> hasEnvironment(String environment) {
        return (root, query, cb) -> environment == null ? null : cb.equal(root.get("environment"), environment);
    }

    static Specification<Job> hasClient(String client) {
        return (root, query, cb) -> client == null ? null : cb.equal(root.get("clientName"), client);
    }
}
