package net.kairo.core.model;

public enum ErrorKind {
    INVALID_SCHEDULE_EXPRESSION,
    UNSATISFIABLE_SCHEDULE,
    UNKNOWN_JOB_TYPE,
    EXECUTION_FAILURE,
    STORE_UNAVAILABLE,
    JOB_NOT_FOUND
}
