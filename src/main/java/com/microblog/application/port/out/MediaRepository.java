package com.microblog.application.port.out;

import com.microblog.domain.model.Media;

import java.util.List;
import java.util.Optional;

public interface MediaRepository {

    Media create(String storageKey);

    Optional<Media> findById(long mediaId);

    /**
     * Sets the tweet reference only if the media is still unattached.
     *
     * @return false if the media does not exist or is already attached
     */
    boolean attachToTweet(long mediaId, long tweetId);

    List<String> findStorageKeysByTweetId(long tweetId);

    long count();
}
