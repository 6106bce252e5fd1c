package net.kairo.core.error;

import net.kairo.core.model.ErrorKind;

public abstract class KairoException extends RuntimeException {
    private final ErrorKind kind;

    protected KairoException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected KairoException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
