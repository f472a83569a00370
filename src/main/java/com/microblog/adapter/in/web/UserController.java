package com.microblog.adapter.in.web;

import com.microblog.application.port.in.GetUserProfileUseCase;
import com.microblog.domain.model.UserId;
import com.microblog.domain.model.UserProfile;
import com.microblog.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Users", description = "User profiles")
public class UserController {

    private final GetUserProfileUseCase getUserProfileUseCase;

    public UserController(GetUserProfileUseCase getUserProfileUseCase) {
        this.getUserProfileUseCase = getUserProfileUseCase;
    }

    @GetMapping("/users/me")
    @Operation(summary = "Profile of the authenticated user")
    public ResponseEntity<ProfileResponse> me() {
        return ResponseEntity.ok(ProfileResponse.from(getUserProfileUseCase.getProfile(RequestContext.getUserId())));
    }

    @GetMapping("/users/{userId}")
    @Operation(summary = "Profile of a user", description = "Name plus followers and following lists")
    public ResponseEntity<?> profile(
            @Parameter(description = "User ID", example = "1")
            @PathVariable String userId) {
        var userIdResult = UserId.parse(userId);
        if (userIdResult.isFailure()) {
            var error = userIdResult.errorOrNull();
            return ErrorResponses.of(error.kind(), error.code(), error.message());
        }
        return ResponseEntity.ok(ProfileResponse.from(getUserProfileUseCase.getProfile(userIdResult.getOrThrow())));
    }

    public record ProfileResponse(
        long id,
        String name,
        List<UserResponse> followers,
        List<UserResponse> following
    ) {
        static ProfileResponse from(UserProfile profile) {
            return new ProfileResponse(
                profile.user().id().value(),
                profile.user().name(),
                profile.followers().stream().map(UserResponse::from).toList(),
                profile.following().stream().map(UserResponse::from).toList()
            );
        }
    }
}
