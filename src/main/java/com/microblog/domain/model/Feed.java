package com.microblog.domain.model;

import java.util.List;

public record Feed(List<FeedItem> tweets) {

    public Feed {
        tweets = List.copyOf(tweets);
    }
}
