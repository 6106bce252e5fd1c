package net.kairo.core.error;

import net.kairo.core.model.ErrorKind;

public class UnknownJobTypeException extends KairoException {
    public UnknownJobTypeException(String jobName) {
        super(ErrorKind.UNKNOWN_JOB_TYPE, "No executor for job name: " + jobName);
    }
}
