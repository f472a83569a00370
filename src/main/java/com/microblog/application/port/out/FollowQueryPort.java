package com.microblog.application.port.out;

import com.microblog.domain.model.UserId;

import java.util.Set;

/**
 * Read access to the social graph for modules that do not own follows.
 * In-process today; a remote client could implement it without touching the feed code.
 */
public interface FollowQueryPort {

    Set<UserId> findFolloweeIds(UserId userId);
}
