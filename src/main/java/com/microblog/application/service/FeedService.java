package com.microblog.application.service;

import com.microblog.application.port.in.GetFeedUseCase;
import com.microblog.application.port.out.FollowQueryPort;
import com.microblog.application.port.out.MetricsPort;
import com.microblog.application.port.out.TweetQueryPort;
import com.microblog.domain.model.Feed;
import com.microblog.domain.model.FeedItem;
import com.microblog.domain.model.TweetDetails;
import com.microblog.domain.model.UserId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds a feed from the tweets of the user and everyone they follow.
 * Most liked first; among equal like counts the newer tweet (higher id) wins.
 */
@Service
public class FeedService implements GetFeedUseCase {

    private static final Logger log = LoggerFactory.getLogger(FeedService.class);

    static final Comparator<TweetDetails> FEED_ORDER = Comparator
        .comparingInt(TweetDetails::likeCount).reversed()
        .thenComparing((TweetDetails details) -> details.tweet().id(), Comparator.reverseOrder());

    private final FollowQueryPort followQueryPort;
    private final TweetQueryPort tweetQueryPort;
    private final MediaService mediaService;
    private final MetricsPort metrics;

    public FeedService(
            FollowQueryPort followQueryPort,
            TweetQueryPort tweetQueryPort,
            MediaService mediaService,
            MetricsPort metrics) {
        this.followQueryPort = followQueryPort;
        this.tweetQueryPort = tweetQueryPort;
        this.mediaService = mediaService;
        this.metrics = metrics;
    }

    @Override
    @Transactional(readOnly = true)
    public Feed buildFeed(UserId userId) {
        log.debug("Building feed for user={}", userId);
        metrics.incrementFeedRequests();

        Feed feed = metrics.recordFeedBuildDuration(() -> {
            Set<UserId> authorIds = new LinkedHashSet<>(followQueryPort.findFolloweeIds(userId));
            authorIds.add(userId);

            List<FeedItem> items = tweetQueryPort.findFeedCandidates(authorIds).stream()
                .sorted(FEED_ORDER)
                .map(this::toFeedItem)
                .toList();
            log.debug("Feed for user={} drew from {} authors", userId, authorIds.size());
            return new Feed(items);
        });

        log.info("Feed built for user={}: {} tweets", userId, feed.tweets().size());
        return feed;
    }

    private FeedItem toFeedItem(TweetDetails details) {
        return new FeedItem(
            details.tweet().id(),
            details.tweet().content(),
            details.attachments().stream().map(mediaService::urlFor).toList(),
            new FeedItem.Author(details.author().id().value(), details.author().name()),
            details.likedBy().stream()
                .map(liker -> new FeedItem.Liker(liker.id().value(), liker.name()))
                .toList()
        );
    }
}
