package com.microblog.domain.event;

import com.microblog.domain.model.UserId;

import java.time.Instant;
import java.util.List;

/**
 * Published inside the deleting transaction; listeners act only after it commits.
 * Carries the storage keys of the attachments whose rows the delete cascaded away.
 */
public record TweetDeleted(
    long tweetId,
    UserId authorId,
    List<String> storageKeys,
    Instant occurredAt
) {
    public TweetDeleted {
        storageKeys = List.copyOf(storageKeys);
    }

    public static TweetDeleted of(long tweetId, UserId authorId, List<String> storageKeys) {
        return new TweetDeleted(tweetId, authorId, storageKeys, Instant.now());
    }
}
