package com.microblog.domain.error;

import com.microblog.domain.model.UserId;

/**
 * Business errors of follow operations that depend on stored state.
 * Self-follow checks live in {@link ValidationError.FollowValidationError}.
 */
public sealed interface FollowError {

    record AlreadyFollowing(UserId followerId, UserId followeeId) implements FollowError {
        @Override
        public String message() {
            return "User " + followerId + " is already following " + followeeId;
        }

        @Override
        public String code() {
            return "ALREADY_FOLLOWING";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.CONFLICT;
        }
    }

    record NotFollowing(UserId followerId, UserId followeeId) implements FollowError {
        @Override
        public String message() {
            return "User " + followerId + " is not following " + followeeId;
        }

        @Override
        public String code() {
            return "NOT_FOLLOWING";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.NOT_FOUND;
        }
    }

    record UserNotFound(UserId userId) implements FollowError {
        @Override
        public String message() {
            return "User not found: " + userId;
        }

        @Override
        public String code() {
            return "USER_NOT_FOUND";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.NOT_FOUND;
        }
    }

    record ValidationFailed(ValidationError error) implements FollowError {
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
