package com.microblog.application.port.out;

import com.microblog.domain.model.Follow;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;

import java.util.List;
import java.util.Set;

/**
 * One table of directed edges, read in both directions.
 */
public interface FollowRepository {

    /**
     * @return false when the edge already existed
     * @throws org.springframework.dao.DataIntegrityViolationException if either user does not exist
     */
    boolean save(Follow follow);

    /**
     * @return false when there was no edge to remove
     */
    boolean delete(UserId followerId, UserId followeeId);

    boolean exists(UserId followerId, UserId followeeId);

    Set<UserId> findFolloweeIds(UserId followerId);

    /**
     * Users following {@code userId}, most recent first.
     */
    List<User> findFollowers(UserId userId);

    /**
     * Users {@code userId} follows, most recent first.
     */
    List<User> findFollowing(UserId userId);

    long countFollowers(UserId userId);

    long countFollowing(UserId userId);

    long count();
}
