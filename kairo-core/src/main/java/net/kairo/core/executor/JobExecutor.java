package net.kairo.core.executor;

import net.kairo.core.model.RunOutcome;

/**
 * One executor variant. Implementations are stateless, may block, and should stop
 * promptly when their thread is interrupted. A thrown exception counts as a failure.
 */
@FunctionalInterface
public interface JobExecutor {
    RunOutcome run(long jobId, String jobName) throws Exception;
}
