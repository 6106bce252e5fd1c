package net.kairo.core.service;

import net.kairo.core.model.TickReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives {@link JobTickService#tickOnce()} at a fixed rate on a single timer thread.
 * States: {@code IDLE -> TICKING -> IDLE}; ticks never overlap. {@link #stop()} is final.
 */
public final class SchedulerLoop implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);

    public enum State { IDLE, TICKING }

    private final JobTickService ticks;
    private final SchedulerSettings settings;
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);

    private ScheduledExecutorService timer;
    private ScheduledFuture<?> handle;
    private boolean stopped;
    private volatile TickReport lastReport;

    public SchedulerLoop(JobTickService ticks, SchedulerSettings settings) {
        this.ticks = ticks;
        this.settings = settings;
    }

    public synchronized void start() {
        if (stopped) throw new IllegalStateException("Scheduler loop already stopped");
        if (handle != null) return;
        timer = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("kairo-scheduler"));
        handle = timer.scheduleAtFixedRate(this::onTimer,
                settings.initialDelay().toMillis(),
                settings.tickInterval().toMillis(),
                TimeUnit.MILLISECONDS);
        log.info("Scheduler started - checking jobs every {}", settings.tickInterval());
    }

    public synchronized void stop() {
        if (stopped) return;
        stopped = true;
        if (handle != null) {
            handle.cancel(false);
            timer.shutdown();
            awaitTimer(settings.shutdownTimeout());
        }
        ticks.shutdown(settings.shutdownTimeout());
        log.info("Scheduler stopped");
    }

    public synchronized boolean isRunning() {
        return handle != null && !stopped;
    }

    public State state() {
        return state.get();
    }

    public Optional<TickReport> lastReport() {
        return Optional.ofNullable(lastReport);
    }

    /** Runs one tick on the caller's thread. Empty if a tick is already in progress. */
    public Optional<TickReport> tickNow() {
        if (!state.compareAndSet(State.IDLE, State.TICKING)) {
            log.debug("Tick already in progress, skipping");
            return Optional.empty();
        }
        try {
            TickReport report = ticks.tickOnce();
            lastReport = report;
            return Optional.of(report);
        } finally {
            state.set(State.IDLE);
        }
    }

    @Override
    public void close() {
        stop();
    }

    // an exception escaping here would cancel the fixed-rate schedule
    private void onTimer() {
        try {
            tickNow();
        } catch (RuntimeException e) {
            log.error("Error checking jobs", e);
        }
    }

    private void awaitTimer(Duration timeout) {
        try {
            if (!timer.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                timer.shutdownNow();
            }
        } catch (InterruptedException e) {
            timer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
