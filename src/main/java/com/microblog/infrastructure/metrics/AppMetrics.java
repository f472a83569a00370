package com.microblog.infrastructure.metrics;

import com.microblog.application.port.out.MetricsPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

@Component
public class AppMetrics implements MetricsPort {

    private final Counter tweetsCreated;
    private final Counter tweetsDeleted;
    private final Counter followsCreated;
    private final Counter unfollows;
    private final Counter likesCreated;
    private final Counter unlikes;
    private final Counter feedRequests;
    private final Counter mediaUploaded;
    private final Counter orphanedMediaFiles;
    private final Timer feedBuildDuration;

    public AppMetrics(MeterRegistry registry) {
        this.tweetsCreated = counter(registry, "tweets_created_total", "Total number of tweets created");
        this.tweetsDeleted = counter(registry, "tweets_deleted_total", "Total number of tweets deleted");
        this.followsCreated = counter(registry, "follows_created_total", "Total number of follow actions");
        this.unfollows = counter(registry, "unfollows_total", "Total number of unfollow actions");
        this.likesCreated = counter(registry, "likes_created_total", "Total number of likes");
        this.unlikes = counter(registry, "unlikes_total", "Total number of removed likes");
        this.feedRequests = counter(registry, "feed_requests_total", "Total number of feed requests");
        this.mediaUploaded = counter(registry, "media_uploaded_total", "Total number of uploaded media files");
        this.orphanedMediaFiles = counter(registry, "media_orphaned_files_total",
            "Media files that could not be deleted after their rows were removed");

        this.feedBuildDuration = Timer.builder("feed_build_duration_seconds")
            .description("Time taken to assemble and rank a feed")
            .register(registry);
    }

    private static Counter counter(MeterRegistry registry, String name, String description) {
        return Counter.builder(name)
            .description(description)
            .register(registry);
    }

    @Override
    public void incrementTweetsCreated() {
        tweetsCreated.increment();
    }

    @Override
    public void incrementTweetsDeleted() {
        tweetsDeleted.increment();
    }

    @Override
    public void incrementFollows() {
        followsCreated.increment();
    }

    @Override
    public void incrementUnfollows() {
        unfollows.increment();
    }

    @Override
    public void incrementLikes() {
        likesCreated.increment();
    }

    @Override
    public void incrementUnlikes() {
        unlikes.increment();
    }

    @Override
    public void incrementFeedRequests() {
        feedRequests.increment();
    }

    @Override
    public void incrementMediaUploaded() {
        mediaUploaded.increment();
    }

    @Override
    public void incrementOrphanedMediaFiles() {
        orphanedMediaFiles.increment();
    }

    @Override
    public <T> T recordFeedBuildDuration(Supplier<T> operation) {
        return feedBuildDuration.record(operation);
    }
}
