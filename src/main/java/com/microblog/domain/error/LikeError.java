package com.microblog.domain.error;

import com.microblog.domain.model.UserId;

public sealed interface LikeError {

    record AlreadyLiked(UserId userId, long tweetId) implements LikeError {
        @Override
        public String message() {
            return "User " + userId + " already liked tweet " + tweetId;
        }

        @Override
        public String code() {
            return "ALREADY_LIKED";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.CONFLICT;
        }
    }

    record NotLiked(UserId userId, long tweetId) implements LikeError {
        @Override
        public String message() {
            return "User " + userId + " has not liked tweet " + tweetId;
        }

        @Override
        public String code() {
            return "NOT_LIKED";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.NOT_FOUND;
        }
    }

    record TweetNotFound(long tweetId) implements LikeError {
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

    String message();

    String code();

    ErrorKind kind();
}
