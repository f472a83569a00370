package com.microblog.domain.model;

import java.util.List;

/**
 * One ranked entry of a feed, flattened for presentation.
 */
public record FeedItem(
    long id,
    String content,
    List<String> attachments,
    Author author,
    List<Liker> likes
) {
    public FeedItem {
        attachments = List.copyOf(attachments);
        likes = List.copyOf(likes);
    }

    public record Author(long id, String name) {}

    public record Liker(long likerId, String likerName) {}
}
