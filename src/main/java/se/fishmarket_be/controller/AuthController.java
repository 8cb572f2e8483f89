package se.fishmarket_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import se.fishmarket_be.dto.request.LoginRequest;
import se.fishmarket_be.dto.request.RegisterRequest;
import se.fishmarket_be.dto.response.ApiResponse;
import se.fishmarket_be.dto.response.AuthResponse;
import se.fishmarket_be.dto.response.UserResponse;
import se.fishmarket_be.exception.InvalidTokenException;
import se.fishmarket_be.service.UserService;

@RestController
@RequestMapping("/api/auth")
@Tag(name = "Authentication", description = "Registration, login and session lookup")
@RequiredArgsConstructor
public class AuthController {

    private static final String BEARER_PREFIX = "Bearer ";

    private final UserService userService;

    @PostMapping("/register")
    @Operation(summary = "Register a new account")
    public ResponseEntity<ApiResponse<AuthResponse>> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.created("Registration successful", userService.register(request)));
    }

    @PostMapping("/login")
    @Operation(summary = "Log in with email and password")
    public ResponseEntity<ApiResponse<AuthResponse>> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Login successful", userService.login(request)));
    }

    @GetMapping("/me")
    @Operation(summary = "Resolve the account behind the bearer token")
    @SecurityRequirement(name = "bearer-auth")
    public ResponseEntity<ApiResponse<UserResponse>> me(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            throw new InvalidTokenException("Missing bearer token");
        }
        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        return ResponseEntity.ok(ApiResponse.success("Current user", userService.getCurrentUser(token)));
    }
}
