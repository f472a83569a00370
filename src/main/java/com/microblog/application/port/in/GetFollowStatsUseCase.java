package com.microblog.application.port.in;

import com.microblog.domain.model.FollowStats;
import com.microblog.domain.model.UserId;

public interface GetFollowStatsUseCase {

    FollowStats getFollowStats(UserId userId);
}
