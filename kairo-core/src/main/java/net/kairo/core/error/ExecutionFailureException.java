package net.kairo.core.error;

import net.kairo.core.model.ErrorKind;

public class ExecutionFailureException extends KairoException {
    public ExecutionFailureException(String message) {
        super(ErrorKind.EXECUTION_FAILURE, message);
    }

    public ExecutionFailureException(String message, Throwable cause) {
        super(ErrorKind.EXECUTION_FAILURE, message, cause);
    }
}
