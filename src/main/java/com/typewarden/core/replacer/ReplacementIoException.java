package com.typewarden.core.replacer;

/**
 * Thrown when a backup, read, write or restore fails. Never retried: the
 * current unit of work is aborted and the exception reaches the caller.
 */
public class ReplacementIoException extends RuntimeException {
    public ReplacementIoException(String message) {
        super(message);
    }

    public ReplacementIoException(String message, Throwable cause) {
        super(message, cause);
    }
}
