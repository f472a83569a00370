package com.microblog.domain.error;

public sealed interface MediaError {

    record MediaNotFound(long mediaId) implements MediaError {
        @Override
        public String message() {
            return "Media not found: " + mediaId;
        }

        @Override
        public String code() {
            return "MEDIA_NOT_FOUND";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.NOT_FOUND;
        }
    }

    record AlreadyAttached(long mediaId, Long tweetId) implements MediaError {
        @Override
        public String message() {
            return "Media " + mediaId + " is already attached to tweet " + tweetId;
        }

        @Override
        public String code() {
            return "MEDIA_ALREADY_ATTACHED";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.CONFLICT;
        }
    }

    record ValidationFailed(ValidationError error) implements MediaError {
        @Override
        public String message() {
            return error.message();
        }

        @Override
        public String code() {
            return error.code();
        }

        @Override
        public ErrorKind kind() {
            return error.kind();
        }
    }

    String message();

    String code();

    ErrorKind kind();
}
