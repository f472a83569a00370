package com.microblog.domain.error;

/**
 * Errors raised by domain factories before any state is consulted.
 */
public sealed interface ValidationError {

    String message();

    String code();

    default ErrorKind kind() {
        return ErrorKind.BAD_REQUEST;
    }

    sealed interface UserIdError extends ValidationError {

        record Empty() implements UserIdError {
            public static final Empty INSTANCE = new Empty();

            @Override
            public String message() {
                return "User ID cannot be empty";
            }

            @Override
            public String code() {
                return "USER_ID_EMPTY";
            }
        }

        record InvalidFormat(String value) implements UserIdError {
            @Override
            public String message() {
                return "User ID must be a positive integer: " + value;
            }

            @Override
            public String code() {
                return "USER_ID_INVALID_FORMAT";
            }
        }
    }

    sealed interface TweetContentError extends ValidationError {

        record EmptyContent() implements TweetContentError {
            public static final EmptyContent INSTANCE = new EmptyContent();

            @Override
            public String message() {
                return "Tweet content cannot be empty";
            }

            @Override
            public String code() {
                return "TWEET_CONTENT_EMPTY";
            }
        }

        record ContentTooLong(int length, int maxLength) implements TweetContentError {
            @Override
            public String message() {
                return "Tweet content exceeds " + maxLength + " characters (was " + length + ")";
            }

            @Override
            public String code() {
                return "TWEET_CONTENT_TOO_LONG";
            }
        }
    }

    /**
     * Following and unfollowing yourself are refused as a permission problem,
     * not as malformed input.
     */
    sealed interface FollowValidationError extends ValidationError {

        @Override
        default ErrorKind kind() {
            return ErrorKind.PERMISSION_DENIED;
        }

        record SelfFollow() implements FollowValidationError {
            public static final SelfFollow INSTANCE = new SelfFollow();

            @Override
            public String message() {
                return "Cannot follow yourself";
            }

            @Override
            public String code() {
                return "SELF_FOLLOW";
            }
        }

        record SelfUnfollow() implements FollowValidationError {
            public static final SelfUnfollow INSTANCE = new SelfUnfollow();

            @Override
            public String message() {
                return "Cannot unfollow yourself";
            }

            @Override
            public String code() {
                return "SELF_UNFOLLOW";
            }
        }
    }

    sealed interface MediaUploadError extends ValidationError {

        record EmptyFile() implements MediaUploadError {
            public static final EmptyFile INSTANCE = new EmptyFile();

            @Override
            public String message() {
                return "Uploaded file is empty";
            }

            @Override
            public String code() {
                return "MEDIA_EMPTY";
            }
        }

        record UnsupportedContentType(String contentType) implements MediaUploadError {
            @Override
            public String message() {
                return "Unsupported media type: " + contentType;
            }

            @Override
            public String code() {
                return "MEDIA_UNSUPPORTED_TYPE";
            }
        }
    }

    sealed interface MediaReferenceError extends ValidationError {

        record MissingMediaId() implements MediaReferenceError {
            public static final MissingMediaId INSTANCE = new MissingMediaId();

            @Override
            public String message() {
                return "Media ids must not be null";
            }

            @Override
            public String code() {
                return "MEDIA_ID_MISSING";
            }
        }
    }
}
