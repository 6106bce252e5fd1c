package net.kairo.core.service;

import net.kairo.core.model.Job;
import net.kairo.core.model.JobFailure;
import net.kairo.core.spi.JobEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

public final class LoggingJobEventListener implements JobEventListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingJobEventListener.class);

    @Override
    public void onFailure(JobFailure f) {
        if (f.jobId() == null) {
            log.error("Scheduler tick failed [{}]: {}", f.kind(), f.message(), f.cause());
            return;
        }
        switch (f.kind()) {
            case EXECUTION_FAILURE -> log.error("Error executing job {} ({}) [{}]: {}",
                    f.jobId(), f.jobName(), f.kind(), f.message(), f.cause());
            // the job may already have run; its outcome or claim was not stored
            case STORE_UNAVAILABLE -> log.error("Job {} ({}) state not stored [{}]: {}",
                    f.jobId(), f.jobName(), f.kind(), f.message(), f.cause());
            case UNSATISFIABLE_SCHEDULE -> log.warn("Job {} ({}) needs operator attention [{}]: {}",
                    f.jobId(), f.jobName(), f.kind(), f.message());
            default -> log.warn("Job {} ({}) skipped [{}]: {}",
                    f.jobId(), f.jobName(), f.kind(), f.message());
        }
    }

    @Override
    public void onSuccess(Job job, Instant startedAt, Instant nextRun) {
        log.info("Job {} ({}) completed. Started at {}, next run: {}", job.id(), job.name(), startedAt, nextRun);
    }
}
