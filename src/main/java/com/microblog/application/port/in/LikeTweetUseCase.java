package com.microblog.application.port.in;

import com.microblog.domain.error.LikeError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.UserId;

public interface LikeTweetUseCase {

    Result<Void, LikeError> likeTweet(UserId userId, long tweetId);
}
