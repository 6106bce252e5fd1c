package net.kairo.core.error;

import net.kairo.core.model.ErrorKind;

public class StoreUnavailableException extends KairoException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorKind.STORE_UNAVAILABLE, message, cause);
    }
}
