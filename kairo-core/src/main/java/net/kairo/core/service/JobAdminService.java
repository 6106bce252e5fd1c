package net.kairo.core.service;

import net.kairo.core.cron.CronEvaluator;
import net.kairo.core.error.InvalidScheduleExpressionException;
import net.kairo.core.error.JobNotFoundException;
import net.kairo.core.error.KairoException;
import net.kairo.core.error.StoreUnavailableException;
import net.kairo.core.model.Job;
import net.kairo.core.model.JobDraft;
import net.kairo.core.model.JobPatch;
import net.kairo.core.spi.Clock;
import net.kairo.core.spi.JobStore;
import net.kairo.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Create/read/update/delete of job records. New jobs start without {@code lastRun} and
 * {@code nextRun}; a schedule change on a job that already ran recomputes {@code nextRun}
 * from its {@code lastRun}.
 */
public final class JobAdminService {
    private static final Logger log = LoggerFactory.getLogger(JobAdminService.class);

    private final JobStore jobs;
    private final TxRunner tx;
    private final Clock clock;
    private final CronEvaluator cron;

    public JobAdminService(JobStore jobs, TxRunner tx, Clock clock, CronEvaluator cron) {
        this.jobs = jobs;
        this.tx = tx;
        this.clock = clock;
        this.cron = cron;
    }

    public Job create(JobDraft draft) {
        Objects.requireNonNull(draft, "draft");
        requireName(draft.name());
        checkSchedule(draft.schedule());
        Job created = inTx(() -> jobs.create(draft, clock.now()));
        log.info("Job created: id={} name='{}' schedule='{}'", created.id(), created.name(), created.schedule());
        return created;
    }

    public List<Job> list() {
        return inTx(jobs::findAll);
    }

    public Job get(long id) {
        return inTx(() -> jobs.get(id)).orElseThrow(() -> new JobNotFoundException(id));
    }

    public Job update(long id, JobPatch patch) {
        Objects.requireNonNull(patch, "patch");
        if (patch.name() != null) requireName(patch.name());
        if (patch.schedule() != null) checkSchedule(patch.schedule());

        return inTx(() -> {
            Job current = jobs.get(id).orElseThrow(() -> new JobNotFoundException(id));
            JobPatch effective = patch;
            if (patch.schedule() != null && !patch.schedule().equals(current.schedule()) && current.lastRun() != null) {
                effective = patch.withNextRun(cron.nextOccurrence(patch.schedule(), current.lastRun()));
            }
            return jobs.update(id, effective, clock.now()).orElseThrow(() -> new JobNotFoundException(id));
        });
    }

    public void delete(long id) {
        boolean removed = inTx(() -> jobs.delete(id));
        if (!removed) throw new JobNotFoundException(id);
        log.info("Job deleted: id={}", id);
    }

    /** Creates the job, or updates the first job with the same name. */
    public Job upsertByName(JobDraft draft) {
        Objects.requireNonNull(draft, "draft");
        requireName(draft.name());
        checkSchedule(draft.schedule());
        var existing = inTx(() -> jobs.findByName(draft.name()));
        if (existing.isEmpty()) {
            return create(draft);
        }
        return update(existing.get().id(),
                new JobPatch(null, draft.description(), draft.schedule(), draft.activeOrDefault(), null));
    }

    // unsatisfiable schedules are rejected here, not only at dispatch time
    private void checkSchedule(String schedule) {
        if (schedule == null) {
            throw new InvalidScheduleExpressionException(null, "schedule is required");
        }
        cron.nextOccurrence(schedule, clock.now());
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    private <T> T inTx(Callable<T> body) {
        try {
            return tx.required(body);
        } catch (KairoException | IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            throw new StoreUnavailableException("Job store operation failed: " + e.getMessage(), e);
        }
    }
}
