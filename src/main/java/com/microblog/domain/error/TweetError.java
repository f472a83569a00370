package com.microblog.domain.error;

import com.microblog.domain.model.UserId;

public sealed interface TweetError {

    record TweetNotFound(long tweetId) implements TweetError {
        @Override
        public String message() {
            return "Tweet not found: " + tweetId;
        }

        @Override
        public String code() {
            return "TWEET_NOT_FOUND";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.NOT_FOUND;
        }
    }

    record NotAuthor(long tweetId, UserId requesterId) implements TweetError {
        @Override
        public String message() {
            return "User " + requesterId + " is not the author of tweet " + tweetId;
        }

        @Override
        public String code() {
            return "NOT_TWEET_AUTHOR";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.PERMISSION_DENIED;
        }
    }

    /**
     * A referenced media item cannot be attached to the new tweet.
     */
    record MediaRejected(MediaError error) implements TweetError {
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

    record ValidationFailed(ValidationError error) implements TweetError {
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
