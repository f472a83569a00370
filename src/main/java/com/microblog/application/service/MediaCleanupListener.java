package com.microblog.application.service;

import com.microblog.domain.event.TweetDeleted;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Deletes attachment files of a deleted tweet after the row delete has committed.
 * A rolled-back delete never reaches this listener, so files are never lost for
 * rows that still exist.
 */
@Component
public class MediaCleanupListener {

    private static final Logger log = LoggerFactory.getLogger(MediaCleanupListener.class);

    private final MediaService mediaService;

    public MediaCleanupListener(MediaService mediaService) {
        this.mediaService = mediaService;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onTweetDeleted(TweetDeleted event) {
        if (event.storageKeys().isEmpty()) {
            return;
        }
        int failures = mediaService.deleteFilesForPaths(event.storageKeys());
        if (failures > 0) {
            log.warn("Tweet {} deleted with {} orphaned media files", event.tweetId(), failures);
        }
    }
}
