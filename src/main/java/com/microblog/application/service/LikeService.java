package com.microblog.application.service;

import com.microblog.application.port.in.GetLikeCountUseCase;
import com.microblog.application.port.in.LikeTweetUseCase;
import com.microblog.application.port.in.UnlikeTweetUseCase;
import com.microblog.application.port.out.LikeRepository;
import com.microblog.application.port.out.MetricsPort;
import com.microblog.application.port.out.TweetRepository;
import com.microblog.domain.error.LikeError;
import com.microblog.domain.model.Like;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.UserId;
import com.microblog.infrastructure.exception.StorageFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

@Service
public class LikeService implements LikeTweetUseCase, UnlikeTweetUseCase, GetLikeCountUseCase {

    private static final Logger log = LoggerFactory.getLogger(LikeService.class);

    private final LikeRepository likeRepository;
    private final TweetRepository tweetRepository;
    private final MetricsPort metrics;

    public LikeService(LikeRepository likeRepository, TweetRepository tweetRepository, MetricsPort metrics) {
        this.likeRepository = likeRepository;
        this.tweetRepository = tweetRepository;
        this.metrics = metrics;
    }

    @Override
    public Result<Void, LikeError> likeTweet(UserId userId, long tweetId) {
        log.debug("Processing like: user={}, tweet={}", userId, tweetId);

        if (!tweetRepository.exists(tweetId)) {
            return Result.failure(new LikeError.TweetNotFound(tweetId));
        }
        if (likeRepository.exists(userId, tweetId)) {
            return Result.failure(new LikeError.AlreadyLiked(userId, tweetId));
        }

        boolean inserted;
        try {
            inserted = likeRepository.save(Like.of(userId, tweetId));
        } catch (DuplicateKeyException e) {
            inserted = false;
        } catch (DataIntegrityViolationException e) {
            log.warn("Like rejected by foreign key, tweet {} deleted concurrently", tweetId);
            return Result.failure(new LikeError.TweetNotFound(tweetId));
        } catch (DataAccessException e) {
            log.error("Failed to store like: user={}, tweet={}", userId, tweetId, e);
            throw new StorageFailureException("Failed to store like", e);
        }

        if (!inserted) {
            return Result.failure(new LikeError.AlreadyLiked(userId, tweetId));
        }

        metrics.incrementLikes();
        log.info("Like completed: user={}, tweet={}", userId, tweetId);
        return Result.success(null);
    }

    @Override
    public Result<Void, LikeError> unlikeTweet(UserId userId, long tweetId) {
        log.debug("Processing unlike: user={}, tweet={}", userId, tweetId);

        boolean deleted;
        try {
            deleted = likeRepository.delete(userId, tweetId);
        } catch (DataAccessException e) {
            log.error("Failed to delete like: user={}, tweet={}", userId, tweetId, e);
            throw new StorageFailureException("Failed to delete like", e);
        }

        if (!deleted) {
            return Result.failure(new LikeError.NotLiked(userId, tweetId));
        }

        metrics.incrementUnlikes();
        log.info("Unlike completed: user={}, tweet={}", userId, tweetId);
        return Result.success(null);
    }

    @Override
    public Result<Long, LikeError> getLikeCount(long tweetId) {
        if (!tweetRepository.exists(tweetId)) {
            return Result.failure(new LikeError.TweetNotFound(tweetId));
        }
        return Result.success(likeRepository.countForTweet(tweetId));
    }
}
