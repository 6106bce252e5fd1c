package net.kairo.core.service;

import net.kairo.core.cron.CronEvaluator;
import net.kairo.core.error.ExecutionFailureException;
import net.kairo.core.error.InvalidScheduleExpressionException;
import net.kairo.core.error.UnknownJobTypeException;
import net.kairo.core.error.UnsatisfiableScheduleException;
import net.kairo.core.executor.JobExecutor;
import net.kairo.core.executor.JobExecutorRegistry;
import net.kairo.core.model.ErrorKind;
import net.kairo.core.model.Job;
import net.kairo.core.model.JobFailure;
import net.kairo.core.model.RunOutcome;
import net.kairo.core.model.TickReport;
import net.kairo.core.spi.Clock;
import net.kairo.core.spi.JobEventListener;
import net.kairo.core.spi.JobStore;
import net.kairo.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One scheduler tick: list active jobs, pick the due ones, dispatch each on the worker pool
 * and write back {@code lastRun}/{@code nextRun} on success.
 *
 * <p>Job-level errors are reported to the {@link JobEventListener} and never thrown. A store
 * failure while listing aborts the tick. A job stays in flight from claim to recorded outcome
 * and is not dispatched again meanwhile.
 */
public final class JobTickService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobTickService.class);

    private final JobStore jobs;
    private final TxRunner tx;
    private final Clock clock;
    private final CronEvaluator cron;
    private final DueJobSelector selector;
    private final JobExecutorRegistry registry;
    private final JobEventListener events;
    private final SchedulerSettings settings;

    private final ExecutorService workers;
    private final ScheduledExecutorService watchdog;
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();
    // "jobId:schedule" pairs already reported as unsatisfiable
    private final Set<String> flagged = ConcurrentHashMap.newKeySet();

    public JobTickService(JobStore jobs,
                          TxRunner tx,
                          Clock clock,
                          CronEvaluator cron,
                          DueJobSelector selector,
                          JobExecutorRegistry registry,
                          JobEventListener events,
                          SchedulerSettings settings) {
        this.jobs = jobs;
        this.tx = tx;
        this.clock = clock;
        this.cron = cron;
        this.selector = selector;
        this.registry = registry;
        this.events = events;
        this.settings = settings;
        this.workers = Executors.newFixedThreadPool(settings.maxConcurrentDispatches(),
                new NamedThreadFactory("kairo-worker"));
        this.watchdog = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("kairo-watchdog"));
    }

    public TickReport tickOnce() {
        TickReport r = new TickReport();
        Instant now = clock.now();
        r.startedAt = now;

        List<Job> active;
        try {
            active = tx.required(jobs::listActive);
        } catch (Exception e) {
            r.aborted = true;
            report(JobFailure.ofTick(ErrorKind.STORE_UNAVAILABLE, "Could not list active jobs: " + describe(e), e, now));
            return r;
        }
        r.fetched = active.size();

        List<Job> due = selector.selectDue(active, now);
        r.due = due.size();

        List<CompletableFuture<RunOutcome>> dispatched = new ArrayList<>();
        for (Job job : due) {
            if (inFlight.contains(job.id())) {
                log.debug("Job {} still running from an earlier tick, skipping", job.id());
                r.skippedInFlight++;
                continue;
            }
            if (!scheduleUsable(job, now)) {
                r.skippedInvalid++;
                continue;
            }
            JobExecutor executor;
            try {
                executor = registry.resolve(job.name());
            } catch (UnknownJobTypeException e) {
                report(JobFailure.of(job, e.kind(), e.getMessage(), e, now));
                r.failed++;
                continue;
            }
            if (!inFlight.add(job.id())) {
                r.skippedInFlight++;
                continue;
            }
            boolean claimed;
            try {
                claimed = claim(job, now);
            } catch (Exception e) {
                inFlight.remove(job.id());
                r.aborted = true;
                report(JobFailure.of(job, ErrorKind.STORE_UNAVAILABLE, "Could not claim job: " + describe(e), e, now));
                break;
            }
            if (!claimed) {
                inFlight.remove(job.id());
                log.debug("Job {} is leased by another scheduler, skipping", job.id());
                r.skippedUnclaimed++;
                continue;
            }
            log.info("Running job: {} (ID: {})", job.name(), job.id());
            dispatched.add(dispatch(job, executor));
            r.dispatched++;
        }

        awaitGrace(dispatched, r);
        if (r.dispatched > 0 || r.aborted) {
            log.debug("Tick finished: {}", r);
        }
        return r;
    }

    /** Ids of jobs whose dispatch has not been recorded yet. */
    public Set<Long> inFlight() {
        return Collections.unmodifiableSet(inFlight);
    }

    public void shutdown(Duration timeout) {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers still running after {}, interrupting", timeout);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            watchdog.shutdownNow();
        }
    }

    @Override
    public void close() {
        shutdown(settings.shutdownTimeout());
    }

    private boolean scheduleUsable(Job job, Instant now) {
        String key = job.id() + ":" + job.schedule();
        try {
            cron.nextOccurrence(job.schedule(), now);
            flagged.remove(key);
            return true;
        } catch (InvalidScheduleExpressionException e) {
            report(JobFailure.of(job, e.kind(), e.getMessage(), e, now));
            return false;
        } catch (UnsatisfiableScheduleException e) {
            if (flagged.add(key)) {
                report(JobFailure.of(job, e.kind(), e.getMessage(), e, now));
            } else {
                log.debug("Job {} still has unsatisfiable schedule [{}]", job.id(), job.schedule());
            }
            return false;
        }
    }

    private boolean claim(Job job, Instant now) throws Exception {
        if (!settings.claimEnabled()) return true;
        Instant until = now.plus(settings.leaseDuration());
        return tx.required(() -> jobs.tryClaim(job.id(), settings.owner(), now, until));
    }

    private CompletableFuture<RunOutcome> dispatch(Job job, JobExecutor executor) {
        Instant startTime = clock.now();
        CompletableFuture<RunOutcome> result = new CompletableFuture<>();
        try {
            workers.execute(new Dispatch(job, executor, result));
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(
                    finish(job, startTime, RunOutcome.failure("Worker pool rejected the job", e)));
        }
        return result.thenApply(outcome -> finish(job, startTime, outcome));
    }

    /** Runs on a worker. The timeout counts from here, not from the moment the job was queued. */
    private final class Dispatch extends FutureTask<Void> {
        private final CompletableFuture<RunOutcome> result;

        Dispatch(Job job, JobExecutor executor, CompletableFuture<RunOutcome> result) {
            super(() -> {
                invoke(job, executor, result);
                return null;
            });
            this.result = result;
        }

        @Override
        public void run() {
            Duration timeout = settings.executionTimeout();
            ScheduledFuture<?> timer = null;
            try {
                timer = watchdog.schedule(() -> {
                    String msg = "Timed out after " + timeout;
                    if (result.complete(RunOutcome.failure(msg, new ExecutionFailureException(msg)))) {
                        cancel(true);
                    }
                }, timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("Watchdog is shut down, running without a timeout");
            }
            try {
                super.run();
            } finally {
                if (timer != null) timer.cancel(false);
                result.complete(RunOutcome.failure("Worker ended without an outcome"));
            }
        }
    }

    private static void invoke(Job job, JobExecutor executor, CompletableFuture<RunOutcome> result) {
        try {
            RunOutcome outcome = executor.run(job.id(), job.name());
            result.complete(outcome != null ? outcome : RunOutcome.failure("Executor returned no outcome"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result.complete(RunOutcome.failure("Interrupted", e));
        } catch (Exception e) {
            result.complete(RunOutcome.failure(describe(e), e));
        }
    }

    private RunOutcome finish(Job job, Instant startTime, RunOutcome outcome) {
        try {
            if (!outcome.isSuccess()) {
                report(JobFailure.of(job, ErrorKind.EXECUTION_FAILURE, outcome.message(), outcome.cause(), clock.now()));
                release(job);
                return outcome;
            }
            return writeBack(job, startTime, outcome);
        } finally {
            inFlight.remove(job.id());
        }
    }

    // nextRun follows the schedule stored now, which may have been edited during the run
    private RunOutcome writeBack(Job job, Instant startTime, RunOutcome outcome) {
        Optional<Job> updated;
        try {
            updated = tx.required(() -> {
                Optional<Job> current = jobs.get(job.id());
                if (current.isEmpty()) return current;
                Instant nextRun = cron.nextOccurrence(current.get().schedule(), startTime);
                return jobs.updateRunTimestamps(job.id(), startTime, nextRun, clock.now());
            });
        } catch (InvalidScheduleExpressionException | UnsatisfiableScheduleException e) {
            report(JobFailure.of(job, e.kind(), e.getMessage(), e, clock.now()));
            release(job);
            return RunOutcome.failure(e.getMessage(), e);
        } catch (Exception e) {
            report(JobFailure.of(job, ErrorKind.STORE_UNAVAILABLE,
                    "Could not record run: " + describe(e), e, clock.now()));
            return RunOutcome.failure("Could not record run", e);
        }
        if (updated.isEmpty()) {
            log.info("Job {} was deleted while running, nothing to write back", job.id());
        } else {
            notifySuccess(updated.get(), startTime, updated.get().nextRun());
        }
        return outcome;
    }

    private void release(Job job) {
        if (!settings.claimEnabled()) return;
        try {
            tx.required(() -> {
                jobs.release(job.id(), settings.owner());
                return null;
            });
        } catch (Exception e) {
            log.warn("Could not release lease on job {}, it expires on its own: {}", job.id(), describe(e));
        }
    }

    private void awaitGrace(List<CompletableFuture<RunOutcome>> dispatched, TickReport r) {
        if (dispatched.isEmpty()) return;
        try {
            CompletableFuture.allOf(dispatched.toArray(new CompletableFuture[0]))
                    .get(settings.gracePeriod().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("Grace period of {} elapsed with dispatches still running", settings.gracePeriod());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.warn("Unexpected dispatch error", e.getCause());
        }
        for (var f : dispatched) {
            if (!f.isDone()) {
                r.pending++;
            } else if (f.isCompletedExceptionally()) {
                r.failed++;
            } else if (f.join().isSuccess()) {
                r.succeeded++;
            } else {
                r.failed++;
            }
        }
    }

    private void report(JobFailure failure) {
        try {
            events.onFailure(failure);
        } catch (RuntimeException e) {
            log.warn("Event listener failed on {}", failure.kind(), e);
        }
    }

    private void notifySuccess(Job job, Instant startTime, Instant nextRun) {
        try {
            events.onSuccess(job, startTime, nextRun);
        } catch (RuntimeException e) {
            log.warn("Event listener failed on success of job {}", job.id(), e);
        }
    }

    private static String describe(Throwable t) {
        String msg = t.getMessage();
        return msg == null ? t.getClass().getSimpleName() : msg;
    }
}
