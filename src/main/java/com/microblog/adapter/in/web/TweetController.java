package com.microblog.adapter.in.web;

import com.microblog.application.port.in.CreateTweetUseCase;
import com.microblog.application.port.in.DeleteTweetUseCase;
import com.microblog.domain.error.TweetError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.Tweet;
import com.microblog.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Tweets", description = "Tweet creation and deletion")
public class TweetController {

    private final CreateTweetUseCase createTweetUseCase;
    private final DeleteTweetUseCase deleteTweetUseCase;

    public TweetController(CreateTweetUseCase createTweetUseCase, DeleteTweetUseCase deleteTweetUseCase) {
        this.createTweetUseCase = createTweetUseCase;
        this.deleteTweetUseCase = deleteTweetUseCase;
    }

    @PostMapping("/tweets")
    @Operation(summary = "Create a tweet", description = "Posts a tweet for the authenticated user, optionally attaching uploaded media")
    public ResponseEntity<?> createTweet(@Valid @RequestBody CreateTweetRequest request) {
        Result<Tweet, TweetError> result = createTweetUseCase.createTweet(
            RequestContext.getUserId(), request.content(), request.mediaIds());

        if (result.isFailure()) {
            TweetError error = result.errorOrNull();
            return ErrorResponses.of(error.kind(), error.code(), error.message());
        }
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(new TweetCreatedResponse(result.getOrThrow().id()));
    }

    @DeleteMapping("/tweets/{tweetId}")
    @Operation(summary = "Delete a tweet", description = "Deletes one of the authenticated user's tweets with its likes and media")
    public ResponseEntity<?> deleteTweet(
            @Parameter(description = "Tweet ID", example = "1")
            @PathVariable long tweetId) {
        Result<Void, TweetError> result = deleteTweetUseCase.deleteTweet(tweetId, RequestContext.getUserId());

        if (result.isFailure()) {
            TweetError error = result.errorOrNull();
            return ErrorResponses.of(error.kind(), error.code(), error.message());
        }
        return ResponseEntity.ok(new StatusResponse("deleted"));
    }

    public record CreateTweetRequest(
        @NotNull String content,
        List<@NotNull Long> mediaIds
    ) {}

    public record TweetCreatedResponse(long tweetId) {}

    public record StatusResponse(String status) {}
}
