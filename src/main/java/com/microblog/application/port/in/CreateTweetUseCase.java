package com.microblog.application.port.in;

import com.microblog.domain.error.TweetError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.Tweet;
import com.microblog.domain.model.UserId;

import java.util.List;

public interface CreateTweetUseCase {

    /**
     * Stores a tweet and attaches the given media to it in one transaction.
     * Duplicate media ids are attached once.
     */
    Result<Tweet, TweetError> createTweet(UserId authorId, String content, List<Long> mediaIds);
}
