package com.microblog.application.port.in;

import com.microblog.domain.model.Feed;
import com.microblog.domain.model.UserId;

public interface GetFeedUseCase {

    /**
     * Tweets of everyone the user follows plus their own, most liked first.
     */
    Feed buildFeed(UserId userId);
}
