package com.microblog.application.service;

import com.microblog.application.port.in.UploadMediaUseCase;
import com.microblog.application.port.out.MediaRepository;
import com.microblog.application.port.out.MediaStorage;
import com.microblog.application.port.out.MetricsPort;
import com.microblog.domain.error.MediaError;
import com.microblog.domain.error.ValidationError.MediaUploadError;
import com.microblog.domain.model.Media;
import com.microblog.domain.model.Result;
import com.microblog.infrastructure.config.AppProperties;
import com.microblog.infrastructure.exception.StorageFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Owns media rows and their files. A media item is uploaded unattached and can be
 * attached to exactly one tweet, once.
 */
@Service
public class MediaService implements UploadMediaUseCase {

    private static final Logger log = LoggerFactory.getLogger(MediaService.class);

    private final MediaRepository mediaRepository;
    private final MediaStorage mediaStorage;
    private final AppProperties appProperties;
    private final MetricsPort metrics;

    public MediaService(
            MediaRepository mediaRepository,
            MediaStorage mediaStorage,
            AppProperties appProperties,
            MetricsPort metrics) {
        this.mediaRepository = mediaRepository;
        this.mediaStorage = mediaStorage;
        this.appProperties = appProperties;
        this.metrics = metrics;
    }

    @Override
    public Result<Media, MediaError> uploadMedia(String filename, String contentType, byte[] content) {
        log.debug("Uploading media: filename={}, contentType={}", filename, contentType);

        List<String> allowed = appProperties.getMedia().getAllowedContentTypes();
        if (contentType == null || !allowed.contains(contentType.toLowerCase(Locale.ROOT))) {
            return Result.failure(new MediaError.ValidationFailed(new MediaUploadError.UnsupportedContentType(contentType)));
        }
        if (content == null || content.length == 0) {
            return Result.failure(new MediaError.ValidationFailed(MediaUploadError.EmptyFile.INSTANCE));
        }

        String key;
        try {
            key = mediaStorage.put(content, extensionOf(filename));
        } catch (IOException e) {
            log.error("Failed to write media file {}", filename, e);
            throw new StorageFailureException("Failed to store media file", e);
        }

        Media media;
        try {
            media = mediaRepository.create(key);
        } catch (DataAccessException e) {
            log.error("Failed to record media row for key {}, removing file", key, e);
            deleteFilesForPaths(List.of(key));
            throw new StorageFailureException("Failed to record media", e);
        }

        metrics.incrementMediaUploaded();
        log.info("Media uploaded: mediaId={}, key={}, bytes={}", media.id(), key, content.length);
        return Result.success(media);
    }

    public Result<Media, MediaError> resolve(long mediaId) {
        Optional<Media> media = mediaRepository.findById(mediaId);
        return media.<Result<Media, MediaError>>map(Result::success)
            .orElseGet(() -> Result.failure(new MediaError.MediaNotFound(mediaId)));
    }

    /**
     * Resolves a media item and checks it is still free to attach.
     */
    public Result<Media, MediaError> resolveUnattached(long mediaId) {
        var resolved = resolve(mediaId);
        if (resolved.isSuccess() && resolved.getOrThrow().isAttached()) {
            return Result.failure(new MediaError.AlreadyAttached(mediaId, resolved.getOrThrow().tweetId()));
        }
        return resolved;
    }

    /**
     * Points the media at the tweet. Never moves media that is already attached,
     * whatever the target.
     */
    public Result<Void, MediaError> attach(long mediaId, long tweetId) {
        boolean attached;
        try {
            attached = mediaRepository.attachToTweet(mediaId, tweetId);
        } catch (DataAccessException e) {
            log.error("Failed to attach media {} to tweet {}", mediaId, tweetId, e);
            throw new StorageFailureException("Failed to attach media", e);
        }
        if (attached) {
            log.debug("Media {} attached to tweet {}", mediaId, tweetId);
            return Result.success(null);
        }
        var current = resolve(mediaId);
        if (current.isFailure()) {
            return Result.failure(current.errorOrNull());
        }
        return Result.failure(new MediaError.AlreadyAttached(mediaId, current.getOrThrow().tweetId()));
    }

    public List<String> storageKeysFor(long tweetId) {
        return mediaRepository.findStorageKeysByTweetId(tweetId);
    }

    /**
     * Best-effort removal of media files whose rows are already gone.
     * Each key gets exactly one delete attempt; failures leave an orphaned file behind.
     *
     * @return number of files that could not be deleted
     */
    public int deleteFilesForPaths(List<String> storageKeys) {
        int failures = 0;
        for (String key : storageKeys) {
            try {
                mediaStorage.delete(key);
            } catch (IOException | RuntimeException e) {
                failures++;
                metrics.incrementOrphanedMediaFiles();
                log.error("Failed to delete media file {}, leaving it orphaned", key, e);
            }
        }
        if (failures == 0) {
            log.debug("Deleted {} media files", storageKeys.size());
        }
        return failures;
    }

    public String urlFor(Media media) {
        String prefix = appProperties.getMedia().getUrlPrefix();
        while (prefix.endsWith("/")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        String key = media.storageKey();
        while (key.startsWith("/")) {
            key = key.substring(1);
        }
        return prefix + "/" + key;
    }

    private static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return "";
        }
        String extension = filename.substring(dot).toLowerCase(Locale.ROOT);
        return extension.matches("\\.[a-z0-9]{1,10}") ? extension : "";
    }
}
