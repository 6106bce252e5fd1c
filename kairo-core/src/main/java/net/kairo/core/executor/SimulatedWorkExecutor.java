package net.kairo.core.executor;

import net.kairo.core.model.RunOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Base for the built-in variants: logs, then spends {@code latency} doing the "work".
 * Interruption aborts the work and propagates.
 */
public abstract class SimulatedWorkExecutor implements JobExecutor {
    private final Logger log = LoggerFactory.getLogger(getClass());
    private final Duration latency;

    protected SimulatedWorkExecutor(Duration latency) {
        this.latency = latency == null ? Duration.ZERO : latency;
    }

    protected abstract String startVerb();

    protected abstract String doneVerb();

    @Override
    public RunOutcome run(long jobId, String jobName) throws InterruptedException {
        log.info("[job {}] {} - {}", jobId, jobName, startVerb());
        if (!latency.isZero() && !latency.isNegative()) {
            Thread.sleep(latency.toMillis());
        }
        log.info("[job {}] {} - {}", jobId, jobName, doneVerb());
        return RunOutcome.success(doneVerb());
    }

    public Duration latency() {
        return latency;
    }
}
