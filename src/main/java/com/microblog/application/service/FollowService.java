package com.microblog.application.service;

import com.microblog.application.port.in.FollowUserUseCase;
import com.microblog.application.port.in.GetFollowStatsUseCase;
import com.microblog.application.port.in.GetFollowersUseCase;
import com.microblog.application.port.in.GetFollowingUseCase;
import com.microblog.application.port.in.UnfollowUserUseCase;
import com.microblog.application.port.out.FollowRepository;
import com.microblog.application.port.out.MetricsPort;
import com.microblog.application.port.out.UserRepository;
import com.microblog.domain.error.FollowError;
import com.microblog.domain.model.Follow;
import com.microblog.domain.model.FollowStats;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import com.microblog.infrastructure.exception.StorageFailureException;
import com.microblog.infrastructure.exception.UserNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Follow and unfollow each write a single statement, so they run without an
 * explicit transaction and let the schema arbitrate concurrent callers.
 */
@Service
public class FollowService implements FollowUserUseCase, UnfollowUserUseCase,
        GetFollowersUseCase, GetFollowingUseCase, GetFollowStatsUseCase {

    private static final Logger log = LoggerFactory.getLogger(FollowService.class);

    private final FollowRepository followRepository;
    private final UserRepository userRepository;
    private final MetricsPort metrics;

    public FollowService(
            FollowRepository followRepository,
            UserRepository userRepository,
            MetricsPort metrics) {
        this.followRepository = followRepository;
        this.userRepository = userRepository;
        this.metrics = metrics;
    }

    @Override
    public Result<Void, FollowError> followUser(UserId followerId, UserId followeeId) {
        log.debug("Processing follow request: follower={}, followee={}", followerId, followeeId);

        var followResult = Follow.create(followerId, followeeId);
        if (followResult.isFailure()) {
            log.warn("Follow validation failed: {}", followResult.errorOrNull().message());
            return Result.failure(new FollowError.ValidationFailed(followResult.errorOrNull()));
        }

        if (!userRepository.exists(followeeId)) {
            log.debug("Followee does not exist: {}", followeeId);
            return Result.failure(new FollowError.UserNotFound(followeeId));
        }

        if (followRepository.exists(followerId, followeeId)) {
            log.debug("Already following: follower={}, followee={}", followerId, followeeId);
            return Result.failure(new FollowError.AlreadyFollowing(followerId, followeeId));
        }

        boolean inserted;
        try {
            inserted = followRepository.save(followResult.getOrThrow());
        } catch (DuplicateKeyException e) {
            inserted = false;
        } catch (DataIntegrityViolationException e) {
            log.warn("Follow rejected by foreign key, user removed concurrently: {} -> {}", followerId, followeeId);
            return Result.failure(new FollowError.UserNotFound(followeeId));
        } catch (DataAccessException e) {
            log.error("Failed to store follow {} -> {}", followerId, followeeId, e);
            throw new StorageFailureException("Failed to store follow", e);
        }

        if (!inserted) {
            log.debug("Concurrent follow won the insert: follower={}, followee={}", followerId, followeeId);
            return Result.failure(new FollowError.AlreadyFollowing(followerId, followeeId));
        }

        metrics.incrementFollows();
        log.info("Follow completed: {} -> {}", followerId, followeeId);

        return Result.success(null);
    }

    @Override
    public Result<Void, FollowError> unfollow(UserId followerId, UserId followeeId) {
        log.debug("Processing unfollow request: follower={}, followee={}", followerId, followeeId);

        var check = Follow.checkUnfollow(followerId, followeeId);
        if (check.isFailure()) {
            log.warn("Unfollow validation failed: {}", check.errorOrNull().message());
            return Result.failure(new FollowError.ValidationFailed(check.errorOrNull()));
        }

        if (!userRepository.exists(followeeId)) {
            return Result.failure(new FollowError.UserNotFound(followeeId));
        }

        boolean deleted;
        try {
            deleted = followRepository.delete(followerId, followeeId);
        } catch (DataAccessException e) {
            log.error("Failed to delete follow {} -> {}", followerId, followeeId, e);
            throw new StorageFailureException("Failed to delete follow", e);
        }

        if (!deleted) {
            log.debug("Not following: follower={}, followee={}", followerId, followeeId);
            return Result.failure(new FollowError.NotFollowing(followerId, followeeId));
        }

        metrics.incrementUnfollows();
        log.info("Unfollow completed: {} -> {}", followerId, followeeId);

        return Result.success(null);
    }

    @Override
    public List<User> getFollowers(UserId userId) {
        requireUser(userId);
        return followRepository.findFollowers(userId);
    }

    @Override
    public List<User> getFollowing(UserId userId) {
        requireUser(userId);
        return followRepository.findFollowing(userId);
    }

    @Override
    public FollowStats getFollowStats(UserId userId) {
        requireUser(userId);
        return new FollowStats(
            followRepository.countFollowers(userId),
            followRepository.countFollowing(userId)
        );
    }

    // Same 404 as the profile endpoint, rather than an empty list for a user that was never registered
    private void requireUser(UserId userId) {
        if (!userRepository.exists(userId)) {
            throw new UserNotFoundException(userId);
        }
    }
}
