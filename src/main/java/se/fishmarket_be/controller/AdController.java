package se.fishmarket_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springdoc.core.annotations.ParameterObject;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.*;
import se.fishmarket_be.dto.request.AdCreateRequest;
import se.fishmarket_be.dto.request.AdFilterRequest;
import se.fishmarket_be.dto.request.AdUpdateRequest;
import se.fishmarket_be.dto.request.BoostAdRequest;
import se.fishmarket_be.dto.request.ModerateAdRequest;
import se.fishmarket_be.dto.response.AdResponse;
import se.fishmarket_be.dto.response.ApiResponse;
import se.fishmarket_be.pojo.User;
import se.fishmarket_be.service.AdService;
import se.fishmarket_be.service.UserService;

import java.util.List;

@RestController
@RequestMapping("/api/ads")
@RequiredArgsConstructor
@Tag(name = "Ads",
     description = "Fish listings: public browsing, owner management, boosting and admin moderation")
public class AdController {

    private final AdService adService;
    private final UserService userService;

    @GetMapping
    @Operation(summary = "List active ads",
            description = "Public. Filters combine with AND. Effectively boosted ads come first, then newest first.")
    public ResponseEntity<ApiResponse<List<AdResponse>>> getAds(@ParameterObject @Valid AdFilterRequest filter) {
        return ResponseEntity.ok(ApiResponse.success("Successfully retrieved ads", adService.getAds(filter)));
    }

    @GetMapping("/admin")
    @PreAuthorize("hasRole('ADMIN')")
    @SecurityRequirement(name = "bearer-auth")
    @Operation(summary = "List ads of any status", description = "Admin moderation queue; accepts a status filter")
    public ResponseEntity<ApiResponse<List<AdResponse>>> getAllAds(@ParameterObject @Valid AdFilterRequest filter) {
        return ResponseEntity.ok(ApiResponse.success("Successfully retrieved ads", adService.getAllAds(filter)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get ad by ID", description = "Public. Each successful read counts one view.")
    public ResponseEntity<ApiResponse<AdResponse>> getAdById(@PathVariable Long id) {
        return adService.getAdById(id)
                .map(ad -> ResponseEntity.ok(ApiResponse.success("Successfully retrieved ad", ad)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ApiResponse.error(HttpStatus.NOT_FOUND, "Ad not found with ID: " + id)));
    }

    @GetMapping("/user/{userId}")
    @SecurityRequirement(name = "bearer-auth")
    @Operation(summary = "List all ads of a user", description = "Every status, newest first")
    public ResponseEntity<ApiResponse<List<AdResponse>>> getUserAds(@PathVariable Long userId) {
        return ResponseEntity.ok(ApiResponse.success("Successfully retrieved user ads", adService.getUserAds(userId)));
    }

    @PostMapping
    @SecurityRequirement(name = "bearer-auth")
    @Operation(summary = "Create an ad", description = "The ad starts as DRAFT and waits for moderation")
    public ResponseEntity<ApiResponse<AdResponse>> createAd(
            @Valid @RequestBody AdCreateRequest request,
            @AuthenticationPrincipal UserDetails currentUser) {
        User owner = userService.findByEmail(currentUser.getUsername());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.created("Ad created", adService.createAd(request, owner.getUserId())));
    }

    @PatchMapping("/{id}")
    @SecurityRequirement(name = "bearer-auth")
    @Operation(summary = "Update own ad", description = "Only the fields present in the body change; status is untouched")
    public ResponseEntity<ApiResponse<AdResponse>> updateAd(
            @PathVariable Long id,
            @Valid @RequestBody AdUpdateRequest request,
            @AuthenticationPrincipal UserDetails currentUser) {
        User requester = userService.findByEmail(currentUser.getUsername());
        return ResponseEntity.ok(ApiResponse.success("Ad updated", adService.updateAd(id, request, requester.getUserId())));
    }

    @DeleteMapping("/{id}")
    @SecurityRequirement(name = "bearer-auth")
    @Operation(summary = "Delete an ad", description = "Soft delete by the owner or an admin")
    public ResponseEntity<ApiResponse<Boolean>> deleteAd(
            @PathVariable Long id,
            @AuthenticationPrincipal UserDetails currentUser) {
        User requester = userService.findByEmail(currentUser.getUsername());
        return ResponseEntity.ok(ApiResponse.success("Ad deleted", adService.deleteAd(id, requester)));
    }

    @PostMapping("/{id}/boost")
    @SecurityRequirement(name = "bearer-auth")
    @Operation(summary = "Boost own ad", description = "Costs one boost credit per call")
    public ResponseEntity<ApiResponse<AdResponse>> boostAd(
            @PathVariable Long id,
            @Valid @RequestBody BoostAdRequest request,
            @AuthenticationPrincipal UserDetails currentUser) {
        User requester = userService.findByEmail(currentUser.getUsername());
        return ResponseEntity.ok(ApiResponse.success("Ad boosted", adService.boostAd(id, request, requester.getUserId())));
    }

    @PatchMapping("/{id}/moderate")
    @PreAuthorize("hasRole('ADMIN')")
    @SecurityRequirement(name = "bearer-auth")
    @Operation(summary = "Moderate an ad", description = "Admin-only; moves the ad to ACTIVE or REJECTED")
    public ResponseEntity<ApiResponse<AdResponse>> moderateAd(
            @PathVariable Long id,
            @Valid @RequestBody ModerateAdRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Ad moderated", adService.moderateAd(id, request)));
    }

    @PostMapping("/{id}/contact")
    @Operation(summary = "Record a contact", description = "Public counter of buyers revealing the seller's contact")
    public ResponseEntity<ApiResponse<Boolean>> incrementContactCount(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Contact recorded", adService.incrementContactCount(id)));
    }
}
