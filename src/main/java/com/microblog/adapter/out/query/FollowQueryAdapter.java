package com.microblog.adapter.out.query;

import com.microblog.application.port.out.FollowQueryPort;
import com.microblog.application.port.out.FollowRepository;
import com.microblog.domain.model.UserId;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * In-process adapter giving the feed read access to the social graph.
 */
@Component
public class FollowQueryAdapter implements FollowQueryPort {

    private final FollowRepository followRepository;

    public FollowQueryAdapter(FollowRepository followRepository) {
        this.followRepository = followRepository;
    }

    @Override
    public Set<UserId> findFolloweeIds(UserId userId) {
        return followRepository.findFolloweeIds(userId);
    }
}
