package net.kairo.core.spi;

import net.kairo.core.model.Job;
import net.kairo.core.model.JobFailure;

import java.time.Instant;
import java.util.List;

/** Observability sink for the scheduler. Implementations must not throw. */
public interface JobEventListener {

    void onFailure(JobFailure failure);

    default void onSuccess(Job job, Instant startedAt, Instant nextRun) {
    }

    static JobEventListener composite(List<? extends JobEventListener> listeners) {
        var copy = List.copyOf(listeners);
        return new JobEventListener() {
            @Override public void onFailure(JobFailure failure) {
                for (var l : copy) l.onFailure(failure);
            }

            @Override public void onSuccess(Job job, Instant startedAt, Instant nextRun) {
                for (var l : copy) l.onSuccess(job, startedAt, nextRun);
            }
        };
    }
}
