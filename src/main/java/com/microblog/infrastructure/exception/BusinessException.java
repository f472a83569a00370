package com.microblog.infrastructure.exception;

import com.microblog.domain.error.ErrorKind;

/**
 * Base for failures that abort the current operation and roll back its transaction.
 * Carries the same code/kind pair the {@code Result} errors use, so the web layer
 * renders both the same way.
 */
public abstract class BusinessException extends RuntimeException {

    private final String errorCode;
    private final ErrorKind kind;

    protected BusinessException(ErrorKind kind, String errorCode, String message) {
        super(message);
        this.kind = kind;
        this.errorCode = errorCode;
    }

    protected BusinessException(ErrorKind kind, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
