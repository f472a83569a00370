package com.microblog.domain.model;

import java.time.Instant;

public record Like(UserId userId, long tweetId, Instant createdAt) {

    public static Like of(UserId userId, long tweetId) {
        return new Like(userId, tweetId, Instant.now());
    }
}
