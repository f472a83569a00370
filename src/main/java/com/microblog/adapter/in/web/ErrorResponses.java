package com.microblog.adapter.in.web;

import com.microblog.domain.error.ErrorKind;
import com.microblog.infrastructure.context.RequestContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Renders business errors as HTTP responses.
 */
public final class ErrorResponses {

    private ErrorResponses() {}

    public static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case AUTHENTICATION_REQUIRED -> HttpStatus.UNAUTHORIZED;
            case INVALID_CREDENTIAL, PERMISSION_DENIED -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT -> HttpStatus.CONFLICT;
            case BAD_REQUEST -> HttpStatus.BAD_REQUEST;
        };
    }

    public static ResponseEntity<ErrorResponse> of(ErrorKind kind, String code, String message) {
        return ResponseEntity.status(statusOf(kind))
            .body(new ErrorResponse(code, message, RequestContext.getRequestId()));
    }
}
