package com.microblog.application.port.in;

import com.microblog.domain.error.LikeError;
import com.microblog.domain.model.Result;

public interface GetLikeCountUseCase {

    Result<Long, LikeError> getLikeCount(long tweetId);
}
