package com.microblog.application.port.out;

import com.microblog.domain.model.Tweet;
import com.microblog.domain.model.TweetDetails;
import com.microblog.domain.model.UserId;

import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface TweetRepository {

    /**
     * Inserts the tweet and returns it with its generated id.
     */
    Tweet save(Tweet tweet);

    Optional<Tweet> findById(long tweetId);

    boolean exists(long tweetId);

    /**
     * Deletes the tweet; likes and media rows go with it.
     */
    boolean deleteById(long tweetId);

    /**
     * Loads every tweet written by the given authors together with author, likers and media.
     */
    List<TweetDetails> findWithRelationsByAuthors(Set<UserId> authorIds);

    long count();
}
