package se.fishmarket_be.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.*;
import se.fishmarket_be.dto.request.PaymentCallbackRequest;
import se.fishmarket_be.dto.request.PaymentCreateRequest;
import se.fishmarket_be.dto.response.ApiResponse;
import se.fishmarket_be.dto.response.PaymentResponse;
import se.fishmarket_be.pojo.User;
import se.fishmarket_be.service.PaymentService;
import se.fishmarket_be.service.UserService;

import java.util.List;

@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Payments", description = "Membership and boost-credit purchases and the gateway webhook")
public class PaymentController {

    static final String CALLBACK_TOKEN_HEADER = "X-Callback-Token";

    private final PaymentService paymentService;
    private final UserService userService;
    private final ObjectMapper objectMapper;

    @PostMapping
    @SecurityRequirement(name = "bearer-auth")
    @Operation(summary = "Create a pending payment")
    public ResponseEntity<ApiResponse<PaymentResponse>> createPayment(
            @Valid @RequestBody PaymentCreateRequest request,
            @AuthenticationPrincipal UserDetails currentUser) {
        User user = userService.findByEmail(currentUser.getUsername());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.created("Payment created", paymentService.createPayment(request, user.getUserId())));
    }

    @PostMapping("/callback")
    @Operation(summary = "Payment gateway notification",
            description = "Public webhook. When a callback token is configured the X-Callback-Token header must match.")
    public ResponseEntity<ApiResponse<Boolean>> handleGatewayCallback(
            @RequestHeader(value = CALLBACK_TOKEN_HEADER, required = false) String callbackToken,
            @RequestBody String body) {
        paymentService.verifyCallbackToken(callbackToken);
        PaymentCallbackRequest request = PaymentCallbackRequest.parse(body, objectMapper);
        log.info("Gateway callback for transaction {} with status '{}'",
                request.getTransactionId(), request.getTransactionStatus());
        boolean handled = paymentService.handleGatewayCallback(
                request.getTransactionId(), request.getTransactionStatus(), request.getRawPayload());
        return ResponseEntity.ok(ApiResponse.success("Callback processed", handled));
    }

    @GetMapping
    @PreAuthorize("hasRole('ADMIN')")
    @SecurityRequirement(name = "bearer-auth")
    @Operation(summary = "List all payments", description = "Admin-only, newest first")
    public ResponseEntity<ApiResponse<List<PaymentResponse>>> getAllPayments() {
        return ResponseEntity.ok(ApiResponse.success("Successfully retrieved payments", paymentService.getAllPayments()));
    }

    @GetMapping("/me")
    @SecurityRequirement(name = "bearer-auth")
    @Operation(summary = "List my payments")
    public ResponseEntity<ApiResponse<List<PaymentResponse>>> getMyPayments(@AuthenticationPrincipal UserDetails currentUser) {
        User user = userService.findByEmail(currentUser.getUsername());
        return ResponseEntity.ok(ApiResponse.success("Successfully retrieved payments",
                paymentService.getUserPayments(user.getUserId(), user)));
    }

    @GetMapping("/user/{userId}")
    @SecurityRequirement(name = "bearer-auth")
    @Operation(summary = "List payments of a user", description = "The user themself or an admin")
    public ResponseEntity<ApiResponse<List<PaymentResponse>>> getUserPayments(
            @PathVariable Long userId,
            @AuthenticationPrincipal UserDetails currentUser) {
        User requester = userService.findByEmail(currentUser.getUsername());
        return ResponseEntity.ok(ApiResponse.success("Successfully retrieved payments",
                paymentService.getUserPayments(userId, requester)));
    }

    @GetMapping("/{id}")
    @SecurityRequirement(name = "bearer-auth")
    @Operation(summary = "Get payment by ID", description = "The owner or an admin")
    public ResponseEntity<ApiResponse<PaymentResponse>> getPaymentById(
            @PathVariable Long id,
            @AuthenticationPrincipal UserDetails currentUser) {
        User requester = userService.findByEmail(currentUser.getUsername());
        return paymentService.getPaymentById(id, requester)
                .map(payment -> ResponseEntity.ok(ApiResponse.success("Successfully retrieved payment", payment)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ApiResponse.error(HttpStatus.NOT_FOUND, "Payment not found with ID: " + id)));
    }

    @PostMapping("/{id}/process")
    @PreAuthorize("hasRole('ADMIN')")
    @SecurityRequirement(name = "bearer-auth")
    @Operation(summary = "Confirm a payment and apply its entitlement",
            description = "Admin-only. Marks a pending payment paid; grants at most once per payment.")
    public ResponseEntity<ApiResponse<Boolean>> processSuccessfulPayment(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Payment processed", paymentService.processSuccessfulPayment(id)));
    }
}
