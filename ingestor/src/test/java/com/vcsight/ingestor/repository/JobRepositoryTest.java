package com.vcsight.ingestor.repository;

import com.vcsight.ingestor.model.EnvironmentTag;
import com.vcsight.ingestor.model.Job;
import com.vcsight.ingestor.model.JobStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Repository tests on embedded H2 with the Flyway schema, so the UNIQUE
 * active_path constraint and the conditional update run for real.
 */
@DataJpaTest(properties = "spring.jpa.hibernate.ddl-auto=none")
class JobRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    @Autowired JobRepository jobRepo;

    @Test
    void activePath_isUniqueWhileActive() {
        jobRepo.saveAndFlush(new Job("a.json", "/in/a.json", T0));

        assertThatThrownBy(() -> jobRepo.saveAndFlush(new Job("a.json", "/in/a.json", T0.plusSeconds(1))))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void terminalJobs_doNotBlockANewJobForTheSamePath() {
        Job done = new Job("a.json", "/in/a.json", T0);
        done.setStatus(JobStatus.COMPLETED);
        done.setActivePath(null);
        jobRepo.saveAndFlush(done);

        Job again = jobRepo.saveAndFlush(new Job("a.json", "/in/a.json", T0.plusSeconds(5)));

        assertThat(jobRepo.findByActivePath("/in/a.json")).map(Job::getId).contains(again.getId());
        assertThat(jobRepo.existsByFilePath("/in/a.json")).isTrue();
        assertThat(jobRepo.existsByFilePath("/in/b.json")).isFalse();
    }

    @Test
    void transition_onlySucceedsFromExpectedStatus() {
        UUID id = jobRepo.saveAndFlush(new Job("a.json", "/in/a.json", T0)).getId();

        int first  = jobRepo.transition(id, JobStatus.PENDING, JobStatus.PROCESSING, T0.plusSeconds(10));
        int second = jobRepo.transition(id, JobStatus.PENDING, JobStatus.PROCESSING, T0.plusSeconds(20));

        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        Job reloaded = jobRepo.findById(id).orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(reloaded.getStartedAt()).isEqualTo(T0.plusSeconds(10));
    }

    @Test
    void findIdsByStatus_oldestFirstAndLimited() {
        Job newer = jobRepo.save(new Job("b.json", "/in/b.json", T0.plusSeconds(60)));
        Job older = jobRepo.save(new Job("a.json", "/in/a.json", T0));
        jobRepo.save(new Job("c.json", "/in/c.json", T0.plusSeconds(120)));
        jobRepo.flush();

        List<UUID> ids = jobRepo.findIdsByStatus(JobStatus.PENDING, PageRequest.of(0, 2));

        assertThat(ids).containsExactly(older.getId(), newer.getId());
    }

    @Test
    void artifacts_arePersistedInOrder() {
        Job job = new Job("a.json", "/in/a.json", T0);
        job.setArtifactPaths(List.of("/out/z.csv", "/out/a.json", "/out/summary.json"));
        UUID id = jobRepo.saveAndFlush(job).getId();

        assertThat(jobRepo.findById(id).orElseThrow().getArtifactPaths())
                .containsExactly("/out/z.csv", "/out/a.json", "/out/summary.json");
    }

    @Test
    void specifications_filterByStatusEnvironmentAndClient() {
        Job prodA = new Job("1.json", "/in/1.json", T0);
        prodA.applyTag(new EnvironmentTag("production", "client-a", null));
        Job prodB = new Job("2.json", "/in/2.json", T0);
        prodB.applyTag(new EnvironmentTag("production", "client-b", null));
        Job dev = new Job("3.json", "/in/3.json", T0);
        dev.applyTag(new EnvironmentTag("development", "client-a", null));
        jobRepo.saveAllAndFlush(List.of(prodA, prodB, dev));

        Page<Job> production = jobRepo.findAll(
                JobSpecifications.matching(null, "production", null), PageRequest.of(0, 10));
        Page<Job> clientA = jobRepo.findAll(
                JobSpecifications.matching(JobStatus.PENDING, null, "client-a"), PageRequest.of(0, 10));
        Page<Job> failed = jobRepo.findAll(
                JobSpecifications.matching(JobStatus.FAILED, null, null), PageRequest.of(0, 10));

        assertThat(production.getContent()).extracting(Job::getFileName).containsExactlyInAnyOrder("1.json", "2.json");
        assertThat(clientA.getContent()).extracting(Job::getFileName).containsExactlyInAnyOrder("1.json", "3.json");
        assertThat(failed.getTotalElements()).isZero();
    }

    @Test
    void retentionQuery_onlyTerminalJobsFinishedBeforeCutoff() {
        Job oldDone = terminal("old.json", JobStatus.COMPLETED, T0.minusSeconds(3600));
        Job oldFailed = terminal("oldf.json", JobStatus.FAILED, T0.minusSeconds(7200));
        terminal("recent.json", JobStatus.COMPLETED, T0.plusSeconds(3600));
        jobRepo.flush();

        List<Job> expired = jobRepo.findByStatusInAndCompletedAtBefore(
                EnumSet.of(JobStatus.COMPLETED, JobStatus.FAILED), T0);

        assertThat(expired).extracting(Job::getId).containsExactlyInAnyOrder(oldDone.getId(), oldFailed.getId());
        assertThat(jobRepo.countByStatus(JobStatus.COMPLETED)).isEqualTo(2);
    }

    private Job terminal(String name, JobStatus status, Instant completedAt) {
        Job job = new Job(name, "/in/" + name, completedAt.minusSeconds(60));
        job.setStatus(status);
        job.setActivePath(null);
        job.setCompletedAt(completedAt);
        return jobRepo.save(job);
    }
}
