package com.microblog.adapter.in.web;

import com.microblog.application.port.in.GetFeedUseCase;
import com.microblog.domain.model.Feed;
import com.microblog.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Feed", description = "Ranked feed of the authenticated user")
public class FeedController {

    private final GetFeedUseCase getFeedUseCase;

    public FeedController(GetFeedUseCase getFeedUseCase) {
        this.getFeedUseCase = getFeedUseCase;
    }

    @GetMapping("/feed")
    @Operation(summary = "Get feed", description = "Tweets of followed users and the caller, most liked first")
    public ResponseEntity<Feed> getFeed() {
        return ResponseEntity.ok(getFeedUseCase.buildFeed(RequestContext.getUserId()));
    }
}
