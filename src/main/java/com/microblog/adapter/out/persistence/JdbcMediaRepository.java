package com.microblog.adapter.out.persistence;

import com.microblog.application.port.out.MediaRepository;
import com.microblog.domain.model.Media;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class JdbcMediaRepository implements MediaRepository {

    private final JdbcTemplate jdbc;

    static final RowMapper<Media> MEDIA_ROW_MAPPER = (rs, rowNum) -> new Media(
        rs.getLong("id"),
        rs.getString("storage_key"),
        rs.getObject("tweet_id", Long.class)
    );

    public JdbcMediaRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Media create(String storageKey) {
        Long id = jdbc.queryForObject(
            "INSERT INTO media (storage_key) VALUES (?) RETURNING id",
            Long.class,
            storageKey
        );
        return new Media(id, storageKey, null);
    }

    @Override
    public Optional<Media> findById(long mediaId) {
        return jdbc.query(
            "SELECT id, storage_key, tweet_id FROM media WHERE id = ?",
            MEDIA_ROW_MAPPER,
            mediaId
        ).stream().findFirst();
    }

    @Override
    public boolean attachToTweet(long mediaId, long tweetId) {
        // The IS NULL guard makes attach a one-shot transition even under concurrent callers.
        int updated = jdbc.update(
            "UPDATE media SET tweet_id = ? WHERE id = ? AND tweet_id IS NULL",
            tweetId,
            mediaId
        );
        return updated > 0;
    }

    @Override
    public List<String> findStorageKeysByTweetId(long tweetId) {
        return jdbc.queryForList(
            "SELECT storage_key FROM media WHERE tweet_id = ? ORDER BY id",
            String.class,
            tweetId
        );
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM media", Long.class);
        return count != null ? count : 0;
    }
}
