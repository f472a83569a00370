package com.microblog.domain.error;

/**
 * Coarse classification shared by every business error. Adapters translate it
 * into their own vocabulary (HTTP status, CLI exit code).
 */
public enum ErrorKind {
    AUTHENTICATION_REQUIRED,
    INVALID_CREDENTIAL,
    NOT_FOUND,
    PERMISSION_DENIED,
    CONFLICT,
    BAD_REQUEST
}
