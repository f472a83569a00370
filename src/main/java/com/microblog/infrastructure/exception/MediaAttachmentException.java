package com.microblog.infrastructure.exception;

import com.microblog.domain.error.MediaError;

/**
 * Thrown when a media item passed its pre-check but was taken by a concurrent
 * request before the attach statement ran. Rolls back the tweet insert.
 */
public class MediaAttachmentException extends BusinessException {

    private final transient MediaError error;

    public MediaAttachmentException(MediaError error) {
        super(error.kind(), error.code(), error.message());
        this.error = error;
    }

    public MediaError getError() {
        return error;
    }
}
