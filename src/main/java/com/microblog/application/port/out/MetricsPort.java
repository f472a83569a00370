package com.microblog.application.port.out;

import java.util.function.Supplier;

public interface MetricsPort {

    void incrementTweetsCreated();

    void incrementTweetsDeleted();

    void incrementFollows();

    void incrementUnfollows();

    void incrementLikes();

    void incrementUnlikes();

    void incrementFeedRequests();

    void incrementMediaUploaded();

    void incrementOrphanedMediaFiles();

    <T> T recordFeedBuildDuration(Supplier<T> operation);
}
