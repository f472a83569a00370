package com.microblog.adapter.in.web;

import com.microblog.application.port.in.GetLikeCountUseCase;
import com.microblog.application.port.in.LikeTweetUseCase;
import com.microblog.application.port.in.UnlikeTweetUseCase;
import com.microblog.domain.error.LikeError;
import com.microblog.domain.model.Result;
import com.microblog.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Likes", description = "Like/unlike operations")
public class LikeController {

    private final LikeTweetUseCase likeTweetUseCase;
    private final UnlikeTweetUseCase unlikeTweetUseCase;
    private final GetLikeCountUseCase getLikeCountUseCase;

    public LikeController(
            LikeTweetUseCase likeTweetUseCase,
            UnlikeTweetUseCase unlikeTweetUseCase,
            GetLikeCountUseCase getLikeCountUseCase) {
        this.likeTweetUseCase = likeTweetUseCase;
        this.unlikeTweetUseCase = unlikeTweetUseCase;
        this.getLikeCountUseCase = getLikeCountUseCase;
    }

    @PostMapping("/tweets/{tweetId}/likes")
    @Operation(summary = "Like a tweet")
    public ResponseEntity<?> like(
            @Parameter(description = "Tweet ID", example = "1")
            @PathVariable long tweetId) {
        Result<Void, LikeError> result = likeTweetUseCase.likeTweet(RequestContext.getUserId(), tweetId);
        return result.isSuccess()
            ? ResponseEntity.status(HttpStatus.CREATED).body(new LikeResponse(tweetId, "liked"))
            : toErrorResponse(result.errorOrNull());
    }

    @DeleteMapping("/tweets/{tweetId}/likes")
    @Operation(summary = "Remove a like")
    public ResponseEntity<?> unlike(
            @Parameter(description = "Tweet ID", example = "1")
            @PathVariable long tweetId) {
        Result<Void, LikeError> result = unlikeTweetUseCase.unlikeTweet(RequestContext.getUserId(), tweetId);
        return result.isSuccess()
            ? ResponseEntity.ok(new LikeResponse(tweetId, "unliked"))
            : toErrorResponse(result.errorOrNull());
    }

    @GetMapping("/tweets/{tweetId}/likes/count")
    @Operation(summary = "Count likes of a tweet")
    public ResponseEntity<?> count(
            @Parameter(description = "Tweet ID", example = "1")
            @PathVariable long tweetId) {
        Result<Long, LikeError> result = getLikeCountUseCase.getLikeCount(tweetId);
        return result.isSuccess()
            ? ResponseEntity.ok(new LikeCountResponse(tweetId, result.getOrThrow()))
            : toErrorResponse(result.errorOrNull());
    }

    private ResponseEntity<ErrorResponse> toErrorResponse(LikeError error) {
        return ErrorResponses.of(error.kind(), error.code(), error.message());
    }

    public record LikeResponse(long tweetId, String status) {}

    public record LikeCountResponse(long tweetId, long likes) {}
}
