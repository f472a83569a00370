package com.microblog.application.port.out;

import com.microblog.domain.model.Like;
import com.microblog.domain.model.UserId;

public interface LikeRepository {

    /**
     * @return false when the user had already liked the tweet
     * @throws org.springframework.dao.DataIntegrityViolationException if the tweet or user does not exist
     */
    boolean save(Like like);

    boolean delete(UserId userId, long tweetId);

    boolean exists(UserId userId, long tweetId);

    long countForTweet(long tweetId);

    long count();
}
