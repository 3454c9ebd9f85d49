package com.vcsight.ingestor.service;

import com.vcsight.ingestor.config.IngestProperties;
import com.vcsight.ingestor.model.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Background timers: the periodic processing pass and the retention sweep.
 *
 * The database is the queue. A pass claims a batch through
 * {@link JobService#claimPending} and processes it sequentially; a
 * concurrent pass (e.g. one triggered over REST) only ever gets jobs this
 * one did not claim.
 */
@Component
@EnableScheduling
public class JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final JobService       jobService;
    private final JobProcessor     processor;
    private final IngestProperties properties;

    public JobScheduler(JobService jobService, JobProcessor processor, IngestProperties properties) {
        this.jobService = jobService;
        this.processor  = processor;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${vcsight.processing-interval:PT5M}",
               initialDelayString = "${vcsight.processing-interval:PT5M}")
    public void processPending() {
        runPass();
    }

    @Scheduled(fixedDelayString = "${vcsight.cleanup-interval:PT24H}",
               initialDelayString = "${vcsight.cleanup-interval:PT24H}")
    public void sweep() {
        jobService.sweepRetention();
    }

    /**
     * One processing pass. A job that throws past the processor is logged
     * and the pass moves on to the next one.
     *
     * @return number of jobs processed
     */
    public int runPass() {
        List<Job> claimed = jobService.claimPending(properties.getBatchSize());
        int processed = 0;
        for (Job job : claimed) {
            try {
                processor.process(job);
                processed++;
            } catch (RuntimeException e) {
                log.error("Unhandled error processing job {}: {}", job.getId(), e.getMessage(), e);
            }
        }
        if (processed > 0) {
            log.info("Processing pass finished: {} job(s)", processed);
        }
        return processed;
    }
}
