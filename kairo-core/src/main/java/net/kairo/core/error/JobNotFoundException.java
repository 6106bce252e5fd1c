package net.kairo.core.error;

import net.kairo.core.model.ErrorKind;

public class JobNotFoundException extends KairoException {
    private final long jobId;

    public JobNotFoundException(long jobId) {
        super(ErrorKind.JOB_NOT_FOUND, "Job not found: " + jobId);
        this.jobId = jobId;
    }

    public long jobId() {
        return jobId;
    }
}
