package se.fishmarket_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import se.fishmarket_be.dto.request.AssignMembershipRequest;
import se.fishmarket_be.dto.request.MembershipPackageRequest;
import se.fishmarket_be.dto.request.OnCreate;
import se.fishmarket_be.dto.response.ApiResponse;
import se.fishmarket_be.dto.response.MembershipPackageResponse;
import se.fishmarket_be.service.MembershipService;

import java.util.List;

@RestController
@RequestMapping("/api/memberships")
@RequiredArgsConstructor
@Tag(name = "Memberships", description = "Membership packages and admin assignment")
public class MembershipController {

    private final MembershipService membershipService;

    @GetMapping("/packages")
    @Operation(summary = "List active membership packages", description = "Public, cheapest first")
    public ResponseEntity<ApiResponse<List<MembershipPackageResponse>>> getMembershipPackages() {
        return ResponseEntity.ok(ApiResponse.success("Successfully retrieved membership packages",
                membershipService.getMembershipPackages()));
    }

    @GetMapping("/packages/{id}")
    @Operation(summary = "Get membership package by ID", description = "Also returns deactivated packages")
    public ResponseEntity<ApiResponse<MembershipPackageResponse>> getMembershipPackageById(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Successfully retrieved membership package",
                membershipService.getMembershipPackageById(id)));
    }

    @PostMapping("/packages")
    @PreAuthorize("hasRole('ADMIN')")
    @SecurityRequirement(name = "bearer-auth")
    @Operation(summary = "Create membership package")
    public ResponseEntity<ApiResponse<MembershipPackageResponse>> createMembershipPackage(
            @Validated(OnCreate.class) @RequestBody MembershipPackageRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.created("Membership package created", membershipService.createMembershipPackage(request)));
    }

    @PatchMapping("/packages/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    @SecurityRequirement(name = "bearer-auth")
    @Operation(summary = "Update membership package", description = "Only the fields present in the body change")
    public ResponseEntity<ApiResponse<MembershipPackageResponse>> updateMembershipPackage(
            @PathVariable Long id, @Valid @RequestBody MembershipPackageRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Membership package updated",
                membershipService.updateMembershipPackage(id, request)));
    }

    @DeleteMapping("/packages/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    @SecurityRequirement(name = "bearer-auth")
    @Operation(summary = "Deactivate membership package")
    public ResponseEntity<ApiResponse<Boolean>> deactivateMembershipPackage(@PathVariable Long id) {
        if (!membershipService.deactivateMembershipPackage(id)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ApiResponse.<Boolean>builder()
                            .status(HttpStatus.NOT_FOUND.toString())
                            .message("Membership package not found with ID: " + id)
                            .data(false)
                            .build());
        }
        return ResponseEntity.ok(ApiResponse.success("Membership package deactivated", true));
    }

    @PostMapping("/assign")
    @PreAuthorize("hasRole('ADMIN')")
    @SecurityRequirement(name = "bearer-auth")
    @Operation(summary = "Assign a membership to a user", description = "Admin-only; grants no boost credits")
    public ResponseEntity<ApiResponse<Boolean>> assignMembershipToUser(@Valid @RequestBody AssignMembershipRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Membership assigned",
                membershipService.assignMembershipToUser(request.getUserId(), request.getMembershipId())));
    }
}
