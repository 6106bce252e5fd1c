package net.kairo.core.model;

import java.time.Instant;

/** What the scheduler reports to listeners when something goes wrong. {@code jobId} is null for tick-level failures. */
public record JobFailure(
        Long jobId,
        String jobName,
        ErrorKind kind,
        String message,
        Throwable cause,
        Instant at
) {
    public static JobFailure ofTick(ErrorKind kind, String message, Throwable cause, Instant at) {
        return new JobFailure(null, null, kind, message, cause, at);
    }

    public static JobFailure of(Job job, ErrorKind kind, String message, Throwable cause, Instant at) {
        return new JobFailure(job.id(), job.name(), kind, message, cause, at);
    }
}
