package com.microblog.domain.model;

/**
 * An uploaded file. {@code tweetId} stays null until the media is attached;
 * once set it never changes.
 */
public record Media(long id, String storageKey, Long tweetId) {

    public boolean isAttached() {
        return tweetId != null;
    }
}
