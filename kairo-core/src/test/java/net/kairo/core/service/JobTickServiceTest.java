package net.kairo.core.service;

import net.kairo.core.cron.CronEvaluator;
import net.kairo.core.executor.JobExecutor;
import net.kairo.core.executor.JobExecutorRegistry;
import net.kairo.core.executor.JobType;
import net.kairo.core.executor.UnknownTypePolicy;
import net.kairo.core.model.ErrorKind;
import net.kairo.core.model.Job;
import net.kairo.core.model.JobDraft;
import net.kairo.core.model.JobPatch;
import net.kairo.core.model.RunOutcome;
import net.kairo.core.model.TickReport;
import net.kairo.core.spi.JobEventListener;
import net.kairo.core.spi.TxRunner;
import net.kairo.core.store.InMemoryJobStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class JobTickServiceTest {
    private static final Instant T = Instant.parse("2026-03-10T10:15:00Z");

    InMemoryJobStore store;
    TestClock clock;
    RecordingListener events;
    JobTickService ticks;

    SchedulerSettings settings = SchedulerSettings.defaults()
            .withExecutionTimeout(Duration.ofSeconds(5))
            .withGracePeriod(Duration.ofSeconds(5));

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore();
        clock = new TestClock(T);
        events = new RecordingListener();
    }

    @AfterEach
    void tearDown() {
        if (ticks != null) ticks.shutdown(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("every-minute job that never ran fires and gets nextRun one minute later")
    void firstRunOfEveryMinuteJob() {
        Job job = store.create(JobDraft.of("welcome email", "* * * * *"), T.minusSeconds(3600));
        AtomicInteger calls = new AtomicInteger();
        ticks = service(Map.of(JobType.EMAIL, (id, name) -> {
            calls.incrementAndGet();
            return RunOutcome.success();
        }), UnknownTypePolicy.FAIL);

        TickReport r = ticks.tickOnce();

        assertThat(r.due).isEqualTo(1);
        assertThat(r.dispatched).isEqualTo(1);
        assertThat(r.succeeded).isEqualTo(1);
        assertThat(calls.get()).isEqualTo(1);
        Job after = store.get(job.id()).orElseThrow();
        assertThat(after.lastRun()).isEqualTo(T);
        assertThat(after.nextRun()).isEqualTo(T.plusSeconds(60));
        assertThat(after.leaseOwner()).isNull();
        assertThat(after.updatedAt()).isEqualTo(T);
        assertThat(events.successes).containsExactly(job.id());
        assertThat(ticks.inFlight()).isEmpty();
    }

    @Test
    void dispatchedJobIsNotDueAgainUntilNextRun() {
        Job job = store.create(JobDraft.of("daily email", "0 9 * * *"), T.minusSeconds(3600));
        AtomicInteger calls = new AtomicInteger();
        ticks = service(Map.of(JobType.EMAIL, (id, name) -> {
            calls.incrementAndGet();
            return RunOutcome.success();
        }), UnknownTypePolicy.FAIL);

        ticks.tickOnce();
        assertThat(store.get(job.id()).orElseThrow().nextRun()).isEqualTo(Instant.parse("2026-03-11T09:00:00Z"));

        clock.advance(Duration.ofSeconds(30));
        TickReport second = ticks.tickOnce();
        assertThat(second.due).isZero();
        assertThat(calls.get()).isEqualTo(1);

        clock.set(Instant.parse("2026-03-11T09:00:00Z"));
        TickReport third = ticks.tickOnce();
        assertThat(third.dispatched).isEqualTo(1);
        assertThat(calls.get()).isEqualTo(2);
        assertThat(store.get(job.id()).orElseThrow().lastRun()).isEqualTo(Instant.parse("2026-03-11T09:00:00Z"));
    }

    @Test
    void inactiveJobsAreNeverDispatched() {
        store.create(new JobDraft("paused email", null, "* * * * *", false), T);
        AtomicInteger calls = new AtomicInteger();
        ticks = service(Map.of(JobType.EMAIL, (id, name) -> {
            calls.incrementAndGet();
            return RunOutcome.success();
        }), UnknownTypePolicy.FAIL);

        TickReport r = ticks.tickOnce();

        assertThat(r.fetched).isZero();
        assertThat(calls.get()).isZero();
    }

    @Test
    @DisplayName("timed out executor is a failure and leaves the job due")
    void timeoutIsExecutionFailure() {
        Instant lastRun = T.minusSeconds(120);
        Instant nextRun = T.minusSeconds(60);
        store.put(new Job(1L, "slow email", null, "* * * * *", true, lastRun, nextRun,
                null, null, T.minusSeconds(3600), T.minusSeconds(3600)));
        AtomicBoolean interrupted = new AtomicBoolean();
        JobExecutor slow = (id, name) -> {
            try {
                Thread.sleep(60_000);
            } catch (InterruptedException e) {
                interrupted.set(true);
                throw e;
            }
            return RunOutcome.success();
        };
        settings = settings.withExecutionTimeout(Duration.ofMillis(100)).withGracePeriod(Duration.ofSeconds(5));
        ticks = service(Map.of(JobType.EMAIL, slow), UnknownTypePolicy.FAIL);

        TickReport r = ticks.tickOnce();

        assertThat(r.failed).isEqualTo(1);
        assertThat(events.kinds()).containsExactly(ErrorKind.EXECUTION_FAILURE);
        assertThat(events.failures.get(0).message()).contains("Timed out");
        Job after = store.get(1L).orElseThrow();
        assertThat(after.lastRun()).isEqualTo(lastRun);
        assertThat(after.nextRun()).isEqualTo(nextRun);
        assertThat(after.leaseOwner()).isNull();
        await().atMost(5, TimeUnit.SECONDS).untilTrue(interrupted);
        assertThat(new DueJobSelector().isDue(after, clock.now())).isTrue();
    }

    @Test
    @DisplayName("a job waiting for a free worker does not use up its timeout in the queue")
    void timeoutStartsWhenTheJobStartsRunning() {
        Job first = store.create(JobDraft.of("first email", "* * * * *"), T);
        Job second = store.create(JobDraft.of("second email", "* * * * *"), T);
        settings = settings.withMaxConcurrentDispatches(1)
                .withExecutionTimeout(Duration.ofMillis(700))
                .withGracePeriod(Duration.ofSeconds(5));
        ticks = service(Map.of(JobType.EMAIL, (id, name) -> {
            Thread.sleep(500);
            return RunOutcome.success();
        }), UnknownTypePolicy.FAIL);

        TickReport r = ticks.tickOnce();

        assertThat(r.dispatched).isEqualTo(2);
        assertThat(r.succeeded).isEqualTo(2);
        assertThat(r.failed).isZero();
        assertThat(events.failures).isEmpty();
        assertThat(store.get(first.id()).orElseThrow().lastRun()).isEqualTo(T);
        assertThat(store.get(second.id()).orElseThrow().lastRun()).isEqualTo(T);
    }

    @Test
    @DisplayName("a schedule edited during the run decides the written nextRun")
    void writeBackUsesTheScheduleStoredAfterTheRun() {
        Job job = store.create(JobDraft.of("daily email", "0 9 * * *"), T);
        ticks = service(Map.of(JobType.EMAIL, (id, name) -> {
            store.update(id, new JobPatch(null, null, "*/5 * * * *", null, null), T);
            return RunOutcome.success();
        }), UnknownTypePolicy.FAIL);

        TickReport r = ticks.tickOnce();

        assertThat(r.succeeded).isEqualTo(1);
        Job after = store.get(job.id()).orElseThrow();
        assertThat(after.schedule()).isEqualTo("*/5 * * * *");
        assertThat(after.lastRun()).isEqualTo(T);
        assertThat(after.nextRun()).isEqualTo(Instant.parse("2026-03-10T10:20:00Z"));
        assertThat(events.successes).containsExactly(job.id());
    }

    @Test
    void scheduleEditedToInvalidDuringRunIsReported() {
        Job job = store.create(JobDraft.of("daily email", "0 9 * * *"), T);
        ticks = service(Map.of(JobType.EMAIL, (id, name) -> {
            store.update(id, new JobPatch(null, null, "0 0 30 2 *", null, null), T);
            return RunOutcome.success();
        }), UnknownTypePolicy.FAIL);

        TickReport r = ticks.tickOnce();

        assertThat(r.failed).isEqualTo(1);
        assertThat(events.kinds()).containsExactly(ErrorKind.UNSATISFIABLE_SCHEDULE);
        Job after = store.get(job.id()).orElseThrow();
        assertThat(after.lastRun()).isNull();
        assertThat(after.leaseOwner()).isNull();
    }

    @Test
    @DisplayName("one failing job does not stop another due in the same tick")
    void failureIsIsolatedPerJob() {
        Job failing = store.create(JobDraft.of("broken email", "* * * * *"), T);
        Job healthy = store.create(JobDraft.of("send notification", "*/5 * * * *"), T);
        ticks = service(Map.of(
                JobType.EMAIL, (id, name) -> { throw new IllegalStateException("SMTP down"); },
                JobType.NOTIFICATION, (id, name) -> RunOutcome.success()
        ), UnknownTypePolicy.FAIL);

        TickReport r = ticks.tickOnce();

        assertThat(r.dispatched).isEqualTo(2);
        assertThat(r.succeeded).isEqualTo(1);
        assertThat(r.failed).isEqualTo(1);
        assertThat(store.get(failing.id()).orElseThrow().lastRun()).isNull();
        Job ok = store.get(healthy.id()).orElseThrow();
        assertThat(ok.lastRun()).isEqualTo(T);
        assertThat(ok.nextRun()).isEqualTo(Instant.parse("2026-03-10T10:20:00Z"));
        assertThat(events.failures).singleElement().satisfies(f -> {
            assertThat(f.jobId()).isEqualTo(failing.id());
            assertThat(f.kind()).isEqualTo(ErrorKind.EXECUTION_FAILURE);
            assertThat(f.message()).isEqualTo("SMTP down");
        });
    }

    @Test
    void failedOutcomeDoesNotAdvanceTimestamps() {
        Job job = store.create(JobDraft.of("email", "* * * * *"), T);
        ticks = service(Map.of(JobType.EMAIL, (id, name) -> RunOutcome.failure("mailbox full")), UnknownTypePolicy.FAIL);

        ticks.tickOnce();
        ticks.tickOnce();

        assertThat(store.get(job.id()).orElseThrow().lastRun()).isNull();
        assertThat(events.kinds()).containsExactly(ErrorKind.EXECUTION_FAILURE, ErrorKind.EXECUTION_FAILURE);
    }

    @Test
    void storeOutageAbortsTheTick() {
        var broken = new InMemoryJobStore() {
            @Override
            public synchronized List<Job> listActive() {
                throw new IllegalStateException("connection refused");
            }
        };
        store = broken;
        ticks = service(Map.of(JobType.EMAIL, (id, name) -> RunOutcome.success()), UnknownTypePolicy.FAIL);

        TickReport r = ticks.tickOnce();

        assertThat(r.aborted).isTrue();
        assertThat(r.dispatched).isZero();
        assertThat(events.failures).singleElement().satisfies(f -> {
            assertThat(f.kind()).isEqualTo(ErrorKind.STORE_UNAVAILABLE);
            assertThat(f.jobId()).isNull();
        });
    }

    @Test
    void writeBackFailureIsReportedAndJobStaysDue() {
        var flaky = new InMemoryJobStore() {
            @Override
            public synchronized Optional<Job> updateRunTimestamps(long id, Instant lastRun, Instant nextRun, Instant now) {
                throw new IllegalStateException("write timeout");
            }
        };
        store = flaky;
        Job job = store.create(JobDraft.of("email", "* * * * *"), T);
        ticks = service(Map.of(JobType.EMAIL, (id, name) -> RunOutcome.success()), UnknownTypePolicy.FAIL);

        TickReport r = ticks.tickOnce();

        assertThat(r.failed).isEqualTo(1);
        assertThat(events.kinds()).containsExactly(ErrorKind.STORE_UNAVAILABLE);
        assertThat(store.get(job.id()).orElseThrow().lastRun()).isNull();
        assertThat(ticks.inFlight()).isEmpty();
    }

    @Test
    void unknownJobTypeFailsUnderFailPolicy() {
        Job job = store.create(JobDraft.of("cleanup", "* * * * *"), T);
        ticks = service(Map.of(JobType.EMAIL, (id, name) -> RunOutcome.success()), UnknownTypePolicy.FAIL);

        TickReport r = ticks.tickOnce();

        assertThat(r.dispatched).isZero();
        assertThat(r.failed).isEqualTo(1);
        assertThat(events.kinds()).containsExactly(ErrorKind.UNKNOWN_JOB_TYPE);
        assertThat(store.get(job.id()).orElseThrow().lastRun()).isNull();
    }

    @Test
    void unknownJobTypeRunsGenericUnderDefaultPolicy() {
        Job job = store.create(JobDraft.of("cleanup", "* * * * *"), T);
        AtomicInteger generic = new AtomicInteger();
        ticks = service(Map.of(JobType.GENERIC, (id, name) -> {
            generic.incrementAndGet();
            return RunOutcome.success();
        }), UnknownTypePolicy.DEFAULT);

        ticks.tickOnce();

        assertThat(generic.get()).isEqualTo(1);
        assertThat(store.get(job.id()).orElseThrow().lastRun()).isEqualTo(T);
    }

    @Test
    void invalidScheduleIsSkippedAndKept() {
        store.put(new Job(7L, "email", null, "not a cron", true, null, null, null, null, T, T));
        ticks = service(Map.of(JobType.EMAIL, (id, name) -> RunOutcome.success()), UnknownTypePolicy.FAIL);

        TickReport r = ticks.tickOnce();

        assertThat(r.skippedInvalid).isEqualTo(1);
        assertThat(events.kinds()).containsExactly(ErrorKind.INVALID_SCHEDULE_EXPRESSION);
        assertThat(store.get(7L)).isPresent();
    }

    @Test
    void unsatisfiableScheduleIsFlaggedOnce() {
        store.put(new Job(8L, "email", null, "0 0 30 2 *", true, null, null, null, null, T, T));
        ticks = service(Map.of(JobType.EMAIL, (id, name) -> RunOutcome.success()), UnknownTypePolicy.FAIL);

        ticks.tickOnce();
        ticks.tickOnce();
        TickReport third = ticks.tickOnce();

        assertThat(third.skippedInvalid).isEqualTo(1);
        assertThat(events.kinds()).containsExactly(ErrorKind.UNSATISFIABLE_SCHEDULE);
    }

    @Test
    @DisplayName("a job still running from an earlier tick is not dispatched twice")
    void inFlightJobIsSkipped() {
        Job job = store.create(JobDraft.of("email", "* * * * *"), T);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        settings = settings.withGracePeriod(Duration.ofMillis(50));
        ticks = service(Map.of(JobType.EMAIL, (id, name) -> {
            calls.incrementAndGet();
            release.await();
            return RunOutcome.success();
        }), UnknownTypePolicy.FAIL);

        TickReport first = ticks.tickOnce();
        assertThat(first.pending).isEqualTo(1);
        assertThat(ticks.inFlight()).containsExactly(job.id());

        TickReport second = ticks.tickOnce();
        assertThat(second.due).isEqualTo(1);
        assertThat(second.skippedInFlight).isEqualTo(1);
        assertThat(second.dispatched).isZero();

        release.countDown();
        await().atMost(5, TimeUnit.SECONDS).until(() -> ticks.inFlight().isEmpty());
        assertThat(calls.get()).isEqualTo(1);
        assertThat(store.get(job.id()).orElseThrow().lastRun()).isEqualTo(T);
    }

    @Test
    void jobLeasedByAnotherSchedulerIsSkipped() {
        store.put(new Job(3L, "email", null, "* * * * *", true, null, null,
                "other-node", T.plusSeconds(300), T, T));
        AtomicInteger calls = new AtomicInteger();
        ticks = service(Map.of(JobType.EMAIL, (id, name) -> {
            calls.incrementAndGet();
            return RunOutcome.success();
        }), UnknownTypePolicy.FAIL);

        TickReport r = ticks.tickOnce();

        assertThat(r.skippedUnclaimed).isEqualTo(1);
        assertThat(calls.get()).isZero();

        clock.advance(Duration.ofMinutes(10));
        TickReport later = ticks.tickOnce();
        assertThat(later.dispatched).isEqualTo(1);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void jobDeletedWhileRunningIsTolerated() {
        Job job = store.create(JobDraft.of("email", "* * * * *"), T);
        ticks = service(Map.of(JobType.EMAIL, (id, name) -> {
            store.delete(id);
            return RunOutcome.success();
        }), UnknownTypePolicy.FAIL);

        TickReport r = ticks.tickOnce();

        assertThat(r.succeeded).isEqualTo(1);
        assertThat(store.get(job.id())).isEmpty();
        assertThat(events.failures).isEmpty();
        assertThat(events.successes).isEmpty();
    }

    @Test
    void listenerFailureDoesNotBreakTheTick() {
        store.create(JobDraft.of("email", "* * * * *"), T);
        JobEventListener throwing = failure -> {
            throw new IllegalStateException("sink down");
        };
        ticks = new JobTickService(store, TxRunner.direct(), clock, CronEvaluator.utc(), new DueJobSelector(),
                JobExecutorRegistry.of(Map.of(JobType.EMAIL, (id, name) -> RunOutcome.failure("nope")), UnknownTypePolicy.FAIL),
                throwing, settings);

        TickReport r = ticks.tickOnce();

        assertThat(r.failed).isEqualTo(1);
    }

    private JobTickService service(Map<JobType, JobExecutor> executors, UnknownTypePolicy policy) {
        return new JobTickService(store, TxRunner.direct(), clock, CronEvaluator.utc(), new DueJobSelector(),
                JobExecutorRegistry.of(executors, policy), events, settings);
    }
}
