package com.microblog.admin.adapter.in.web;

import com.microblog.admin.application.port.in.GetStatsUseCase;
import com.microblog.admin.application.port.in.RegisterUserUseCase;
import com.microblog.admin.application.port.in.RegisterUserUseCase.RegisteredUser;
import com.microblog.admin.application.port.out.AdminDataPort.DataCounts;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoints, guarded by the admin token in AuthFilter.
 */
@RestController
@RequestMapping("/api/v1/admin")
@Tag(name = "Admin", description = "User registration and statistics")
public class AdminController {

    private final RegisterUserUseCase registerUserUseCase;
    private final GetStatsUseCase getStatsUseCase;

    public AdminController(RegisterUserUseCase registerUserUseCase, GetStatsUseCase getStatsUseCase) {
        this.registerUserUseCase = registerUserUseCase;
        this.getStatsUseCase = getStatsUseCase;
    }

    @PostMapping("/users")
    @Operation(summary = "Register a user", description = "Creates a user with the given or a generated API key")
    public ResponseEntity<RegisteredUser> registerUser(@Valid @RequestBody RegisterUserRequest request) {
        RegisteredUser user = registerUserUseCase.registerUser(request.name(), request.apiKey());
        return ResponseEntity.status(HttpStatus.CREATED).body(user);
    }

    @GetMapping("/stats")
    @Operation(summary = "Get system statistics", description = "Returns current counts of users, tweets, follows, likes and media")
    public ResponseEntity<DataCounts> stats() {
        return ResponseEntity.ok(getStatsUseCase.getStats());
    }

    public record RegisterUserRequest(@NotBlank String name, String apiKey) {}
}
