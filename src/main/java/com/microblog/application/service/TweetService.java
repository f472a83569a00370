package com.microblog.application.service;

import com.microblog.application.port.in.CreateTweetUseCase;
import com.microblog.application.port.in.DeleteTweetUseCase;
import com.microblog.application.port.out.MetricsPort;
import com.microblog.application.port.out.TweetRepository;
import com.microblog.domain.error.TweetError;
import com.microblog.domain.error.ValidationError.MediaReferenceError;
import com.microblog.domain.event.TweetDeleted;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.Tweet;
import com.microblog.domain.model.UserId;
import com.microblog.infrastructure.exception.MediaAttachmentException;
import com.microblog.infrastructure.exception.StorageFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Service
public class TweetService implements CreateTweetUseCase, DeleteTweetUseCase {

    private static final Logger log = LoggerFactory.getLogger(TweetService.class);

    private final TweetRepository tweetRepository;
    private final MediaService mediaService;
    private final ApplicationEventPublisher eventPublisher;
    private final MetricsPort metrics;

    public TweetService(
            TweetRepository tweetRepository,
            MediaService mediaService,
            ApplicationEventPublisher eventPublisher,
            MetricsPort metrics) {
        this.tweetRepository = tweetRepository;
        this.mediaService = mediaService;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
    }

    @Override
    @Transactional
    public Result<Tweet, TweetError> createTweet(UserId authorId, String content, List<Long> mediaIds) {
        log.debug("Creating tweet for user={}, contentLength={}, media={}",
            authorId, content != null ? content.length() : 0, mediaIds);

        var tweetResult = Tweet.create(authorId, content);
        if (tweetResult.isFailure()) {
            log.warn("Tweet validation failed for user={}: {}", authorId, tweetResult.errorOrNull().message());
            return Result.failure(new TweetError.ValidationFailed(tweetResult.errorOrNull()));
        }

        if (mediaIds != null && mediaIds.stream().anyMatch(Objects::isNull)) {
            log.warn("Tweet rejected for user={}: null media id in {}", authorId, mediaIds);
            return Result.failure(new TweetError.ValidationFailed(MediaReferenceError.MissingMediaId.INSTANCE));
        }

        List<Long> distinctMediaIds = mediaIds == null ? List.of() : List.copyOf(new LinkedHashSet<>(mediaIds));
        for (Long mediaId : distinctMediaIds) {
            var media = mediaService.resolveUnattached(mediaId);
            if (media.isFailure()) {
                log.warn("Tweet rejected for user={}: {}", authorId, media.errorOrNull().message());
                return Result.failure(new TweetError.MediaRejected(media.errorOrNull()));
            }
        }

        Tweet tweet;
        try {
            tweet = tweetRepository.save(tweetResult.getOrThrow());
        } catch (DataAccessException e) {
            log.error("Failed to insert tweet for user={}", authorId, e);
            throw new StorageFailureException("Failed to create tweet", e);
        }
        log.debug("Tweet row inserted: tweetId={}", tweet.id());

        for (Long mediaId : distinctMediaIds) {
            var attached = mediaService.attach(mediaId, tweet.id());
            if (attached.isFailure()) {
                log.warn("Media {} was taken before it could be attached to tweet {}, rolling back", mediaId, tweet.id());
                throw new MediaAttachmentException(attached.errorOrNull());
            }
        }

        metrics.incrementTweetsCreated();
        log.info("Tweet created: tweetId={}, userId={}, chars={}, media={}",
            tweet.id(), authorId, tweet.content().length(), distinctMediaIds.size());

        return Result.success(tweet);
    }

    @Override
    @Transactional
    public Result<Void, TweetError> deleteTweet(long tweetId, UserId requesterId) {
        log.debug("Deleting tweet={} requested by user={}", tweetId, requesterId);

        Optional<Tweet> tweet = tweetRepository.findById(tweetId);
        if (tweet.isEmpty()) {
            return Result.failure(new TweetError.TweetNotFound(tweetId));
        }
        if (!tweet.get().isAuthoredBy(requesterId)) {
            log.warn("User {} tried to delete tweet {} of user {}", requesterId, tweetId, tweet.get().authorId());
            return Result.failure(new TweetError.NotAuthor(tweetId, requesterId));
        }

        List<String> storageKeys = mediaService.storageKeysFor(tweetId);

        boolean deleted;
        try {
            deleted = tweetRepository.deleteById(tweetId);
        } catch (DataAccessException e) {
            log.error("Failed to delete tweet={}", tweetId, e);
            throw new StorageFailureException("Failed to delete tweet", e);
        }
        if (!deleted) {
            return Result.failure(new TweetError.TweetNotFound(tweetId));
        }

        // Files are removed by MediaCleanupListener once this transaction commits.
        eventPublisher.publishEvent(TweetDeleted.of(tweetId, requesterId, storageKeys));

        metrics.incrementTweetsDeleted();
        log.info("Tweet deleted: tweetId={}, userId={}, mediaFiles={}", tweetId, requesterId, storageKeys.size());

        return Result.success(null);
    }
}
