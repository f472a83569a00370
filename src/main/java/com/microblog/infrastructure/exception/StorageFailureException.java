package com.microblog.infrastructure.exception;

import com.microblog.domain.error.ErrorKind;

/**
 * The relational store or the media store rejected a write for a reason
 * that is not one of the mapped integrity violations.
 */
public class StorageFailureException extends BusinessException {

    public StorageFailureException(String message, Throwable cause) {
        super(ErrorKind.BAD_REQUEST, "STORAGE_FAILURE", message, cause);
    }
}
