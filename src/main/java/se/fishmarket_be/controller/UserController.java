package se.fishmarket_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import se.fishmarket_be.dto.request.UpdateUserRequest;
import se.fishmarket_be.dto.response.ApiResponse;
import se.fishmarket_be.dto.response.UserResponse;
import se.fishmarket_be.pojo.User;
import se.fishmarket_be.service.UserService;

import java.util.List;

@RestController
@RequestMapping("/api/users")
@Tag(name = "Users", description = "User administration")
@SecurityRequirement(name = "bearer-auth")
@RequiredArgsConstructor
@Validated
public class UserController {

    private final UserService userService;

    @GetMapping
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "List users", description = "Admin-only. Search matches email or full name.")
    public ResponseEntity<ApiResponse<List<UserResponse>>> getUsers(
            @Parameter(description = "Case-insensitive match on email or full name")
            @RequestParam(required = false) String search,
            @RequestParam(required = false) Boolean isAdmin,
            @RequestParam(required = false) Boolean isActive,
            @RequestParam(required = false) @Positive(message = "Limit must be positive") Integer limit,
            @RequestParam(required = false) @PositiveOrZero(message = "Offset cannot be negative") Integer offset) {
        return ResponseEntity.ok(ApiResponse.success("Successfully retrieved users",
                userService.getUsers(search, isAdmin, isActive, limit, offset)));
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Get user by ID")
    public ResponseEntity<ApiResponse<UserResponse>> getUserById(@PathVariable Long id) {
        return userService.getUserById(id)
                .map(user -> ResponseEntity.ok(ApiResponse.success("Successfully retrieved user", user)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ApiResponse.error(HttpStatus.NOT_FOUND, "User not found with ID: " + id)));
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Update a profile", description = "Allowed for the user themself or an admin. Explicit nulls clear phone and avatar.")
    public ResponseEntity<ApiResponse<UserResponse>> updateUser(
            @PathVariable Long id,
            @Valid @RequestBody UpdateUserRequest request,
            @AuthenticationPrincipal UserDetails currentUser) {
        User requester = userService.findByEmail(currentUser.getUsername());
        return ResponseEntity.ok(ApiResponse.success("User updated", userService.updateUser(id, request, requester)));
    }

    @PatchMapping("/{id}/deactivate")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Deactivate a user")
    public ResponseEntity<ApiResponse<Boolean>> deactivateUser(@PathVariable Long id) {
        return toggleResult(userService.deactivateUser(id), id, "User deactivated");
    }

    @PatchMapping("/{id}/activate")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Activate a user")
    public ResponseEntity<ApiResponse<Boolean>> activateUser(@PathVariable Long id) {
        return toggleResult(userService.activateUser(id), id, "User activated");
    }

    private ResponseEntity<ApiResponse<Boolean>> toggleResult(boolean found, Long id, String message) {
        if (!found) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ApiResponse.<Boolean>builder()
                            .status(HttpStatus.NOT_FOUND.toString())
                            .message("User not found with ID: " + id)
                            .data(false)
                            .build());
        }
        return ResponseEntity.ok(ApiResponse.success(message, true));
    }
}
