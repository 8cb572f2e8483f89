package se.fishmarket_be.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import se.fishmarket_be.dto.request.PaymentCreateRequest;
import se.fishmarket_be.dto.response.PaymentResponse;
import se.fishmarket_be.exception.BusinessLogicException;
import se.fishmarket_be.exception.InvalidTokenException;
import se.fishmarket_be.exception.ResourceNotFoundException;
import se.fishmarket_be.exception.UnauthorizedException;
import se.fishmarket_be.mapper.ModelMapper;
import se.fishmarket_be.pojo.Ad;
import se.fishmarket_be.pojo.MembershipPackage;
import se.fishmarket_be.pojo.Payment;
import se.fishmarket_be.pojo.User;
import se.fishmarket_be.pojo.enums.PaymentStatus;
import se.fishmarket_be.pojo.enums.PaymentType;
import se.fishmarket_be.repository.AdRepository;
import se.fishmarket_be.repository.PaymentRepository;
import se.fishmarket_be.repository.UserRepository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PaymentService Unit Tests")
class PaymentServiceTest {

    @Mock
    private PaymentRepository paymentRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private AdRepository adRepository;

    @Mock
    private MembershipService membershipService;

    private PaymentService paymentService;

    private User buyer;
    private MembershipPackage proPackage;

    @BeforeEach
    void setUp() {
        paymentService = new PaymentService(paymentRepository, userRepository, adRepository,
                membershipService, new ModelMapper(), "");

        buyer = User.builder().userId(1L).email("buyer@fish.vn").fullName("Buyer").boostCredits(0).build();
        proPackage = MembershipPackage.builder()
                .packageId(5L)
                .name("Pro")
                .price(new BigDecimal("149000.00"))
                .durationDays(30)
                .maxAds(50)
                .boostCredits(5)
                .isActive(true)
                .build();
    }

    private Payment pendingMembershipPayment() {
        return Payment.builder()
                .paymentId(50L)
                .user(buyer)
                .membership(proPackage)
                .type(PaymentType.MEMBERSHIP)
                .amount(new BigDecimal("149000.00"))
                .status(PaymentStatus.PENDING)
                .gatewayTransactionId("FM-abc")
                .build();
    }

    private Payment pendingBoostPayment() {
        return Payment.builder()
                .paymentId(51L)
                .user(buyer)
                .ad(Ad.builder().adId(100L).build())
                .type(PaymentType.BOOST)
                .amount(new BigDecimal("50.00"))
                .status(PaymentStatus.PENDING)
                .gatewayTransactionId("FM-boost")
                .build();
    }

    // ========================================
    // createPayment()
    // ========================================

    @Test
    @DisplayName("createPayment - membership payment starts pending with a gateway transaction id")
    void createPayment_Membership() {
        // Given
        when(userRepository.findById(1L)).thenReturn(Optional.of(buyer));
        when(membershipService.findActivePackage(5L)).thenReturn(proPackage);
        when(paymentRepository.save(any(Payment.class))).thenAnswer(invocation -> invocation.getArgument(0));
        PaymentCreateRequest request = PaymentCreateRequest.builder()
                .type(PaymentType.MEMBERSHIP)
                .membershipId(5L)
                .amount(new BigDecimal("149000"))
                .build();

        // When
        PaymentResponse result = paymentService.createPayment(request, 1L);

        // Then
        assertThat(result.getStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(result.getMembershipId()).isEqualTo(5L);
        assertThat(result.getAmount()).isEqualByComparingTo("149000.00");
        assertThat(result.getAmount().scale()).isEqualTo(2);
        assertThat(result.getGatewayTransactionId()).startsWith("FM-");
    }

    @Test
    @DisplayName("createPayment - inactive package is NotFoundOrInactive")
    void createPayment_InactivePackage() {
        // Given
        when(userRepository.findById(1L)).thenReturn(Optional.of(buyer));
        when(membershipService.findActivePackage(5L))
                .thenThrow(new ResourceNotFoundException(MembershipService.NOT_FOUND_OR_INACTIVE));
        PaymentCreateRequest request = PaymentCreateRequest.builder()
                .type(PaymentType.MEMBERSHIP)
                .membershipId(5L)
                .amount(new BigDecimal("149000"))
                .build();

        // When / Then
        assertThatThrownBy(() -> paymentService.createPayment(request, 1L))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Membership package not found or inactive");
        verify(paymentRepository, never()).save(any());
    }

    @Test
    @DisplayName("createPayment - boost payment for someone else's ad is NotFoundOrUnauthorized")
    void createPayment_ForeignAd() {
        // Given
        when(userRepository.findById(1L)).thenReturn(Optional.of(buyer));
        when(adRepository.findByAdIdAndUserUserId(100L, 1L)).thenReturn(Optional.empty());
        PaymentCreateRequest request = PaymentCreateRequest.builder()
                .type(PaymentType.BOOST)
                .adId(100L)
                .amount(new BigDecimal("50"))
                .build();

        // When / Then
        assertThatThrownBy(() -> paymentService.createPayment(request, 1L))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Ad not found or not owned by user");
    }

    @Test
    @DisplayName("createPayment - unknown user is NotFound")
    void createPayment_UserMissing() {
        // Given
        when(userRepository.findById(9L)).thenReturn(Optional.empty());
        PaymentCreateRequest request = PaymentCreateRequest.builder()
                .type(PaymentType.BOOST).adId(100L).amount(BigDecimal.TEN).build();

        // When / Then
        assertThatThrownBy(() -> paymentService.createPayment(request, 9L))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    // ========================================
    // handleGatewayCallback()
    // ========================================

    @Test
    @DisplayName("handleGatewayCallback - settlement pays and grants membership plus credits")
    void callback_SettlementAppliesMembership() {
        // Given
        Payment payment = pendingMembershipPayment();
        buyer.setBoostCredits(2);
        when(paymentRepository.findByGatewayTransactionIdForUpdate("FM-abc")).thenReturn(Optional.of(payment));
        when(userRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(buyer));

        // When
        boolean result = paymentService.handleGatewayCallback("FM-abc", "settlement",
                "{\"transaction_status\":\"settlement\",\"gross_amount\":\"149000.00\"}");

        // Then
        assertThat(result).isTrue();
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.PAID);
        assertThat(payment.getEntitlementAppliedAt()).isNotNull();
        assertThat(payment.getGatewayResponse()).contains("\"gross_amount\":\"149000.00\"");
        assertThat(buyer.getMembership()).isSameAs(proPackage);
        assertThat(buyer.getBoostCredits()).isEqualTo(7);
        assertThat(buyer.getMembershipExpiresAt()).isAfter(LocalDateTime.now().plusDays(29));
        verify(userRepository).save(buyer);
        verify(paymentRepository).save(payment);
    }

    @Test
    @DisplayName("handleGatewayCallback - payload is stored exactly as received")
    void callback_StoresPayloadVerbatim() {
        // Given
        Payment payment = pendingBoostPayment();
        String raw = "{\"transaction_id\":\"57d5293c-gw\",\"transaction_status\":\"pending\","
                + "\"order_id\":\"FM-boost\",\"gross_amount\":\"50.00\"}";
        when(paymentRepository.findByGatewayTransactionIdForUpdate("FM-boost")).thenReturn(Optional.of(payment));

        // When
        paymentService.handleGatewayCallback("FM-boost", "pending", raw);

        // Then
        assertThat(payment.getGatewayResponse()).isEqualTo(raw);
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.PENDING);
        verify(paymentRepository).save(payment);
    }

    @Test
    @DisplayName("handleGatewayCallback - replayed settlement does not grant twice")
    void callback_ReplayIsIdempotent() {
        // Given
        Payment payment = pendingMembershipPayment();
        when(paymentRepository.findByGatewayTransactionIdForUpdate("FM-abc")).thenReturn(Optional.of(payment));
        when(userRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(buyer));

        // When
        paymentService.handleGatewayCallback("FM-abc", "settlement", "{\"n\":1}");
        paymentService.handleGatewayCallback("FM-abc", "settlement", "{\"n\":2}");

        // Then
        assertThat(buyer.getBoostCredits()).isEqualTo(5);
        verify(userRepository, times(1)).findByIdForUpdate(1L);
        assertThat(payment.getGatewayResponse()).isEqualTo("{\"n\":2}");
    }

    @Test
    @DisplayName("handleGatewayCallback - terminal status is never overwritten")
    void callback_TerminalStatusKept() {
        // Given
        Payment payment = pendingMembershipPayment();
        payment.setStatus(PaymentStatus.FAILED);
        when(paymentRepository.findByGatewayTransactionIdForUpdate("FM-abc")).thenReturn(Optional.of(payment));

        // When
        paymentService.handleGatewayCallback("FM-abc", "settlement", "{}");

        // Then
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.FAILED);
        verify(userRepository, never()).findByIdForUpdate(anyLong());
    }

    @Test
    @DisplayName("handleGatewayCallback - deny fails the payment without entitlement")
    void callback_DenyFails() {
        // Given
        Payment payment = pendingMembershipPayment();
        when(paymentRepository.findByGatewayTransactionIdForUpdate("FM-abc")).thenReturn(Optional.of(payment));

        // When
        paymentService.handleGatewayCallback("FM-abc", "deny", "{}");

        // Then
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.FAILED);
        assertThat(payment.getEntitlementAppliedAt()).isNull();
        verifyNoInteractions(userRepository);
    }

    @Test
    @DisplayName("handleGatewayCallback - unknown status keeps the payment pending but stores the payload")
    void callback_UnknownStatusStaysPending() {
        // Given
        Payment payment = pendingMembershipPayment();
        when(paymentRepository.findByGatewayTransactionIdForUpdate("FM-abc")).thenReturn(Optional.of(payment));

        // When
        paymentService.handleGatewayCallback("FM-abc", "authorize", "{\"transaction_status\":\"authorize\"}");

        // Then
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(payment.getGatewayResponse()).contains("authorize");
    }

    @Test
    @DisplayName("handleGatewayCallback - unknown transaction is NotFound")
    void callback_UnknownTransaction() {
        // Given
        when(paymentRepository.findByGatewayTransactionIdForUpdate("nope")).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> paymentService.handleGatewayCallback("nope", "settlement", "{}"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("handleGatewayCallback - entitlement failure propagates")
    void callback_EntitlementFailurePropagates() {
        // Given
        Payment payment = pendingMembershipPayment();
        when(paymentRepository.findByGatewayTransactionIdForUpdate("FM-abc")).thenReturn(Optional.of(payment));
        when(userRepository.findByIdForUpdate(1L)).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> paymentService.handleGatewayCallback("FM-abc", "capture", "{}"))
                .isInstanceOf(ResourceNotFoundException.class);
        verify(paymentRepository, never()).save(any());
    }

    // ========================================
    // processSuccessfulPayment()
    // ========================================

    @Test
    @DisplayName("processSuccessfulPayment - boost payment of 50.00 grants 50 credits")
    void process_BoostGrantsFloorOfAmount() {
        // Given
        Payment payment = pendingBoostPayment();
        when(paymentRepository.findByIdForUpdate(51L)).thenReturn(Optional.of(payment));
        when(userRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(buyer));

        // When
        boolean result = paymentService.processSuccessfulPayment(51L);

        // Then
        assertThat(result).isTrue();
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.PAID);
        assertThat(buyer.getBoostCredits()).isEqualTo(50);
    }

    @Test
    @DisplayName("processSuccessfulPayment - fractional amounts are floored")
    void process_BoostFloorsFraction() {
        // Given
        Payment payment = pendingBoostPayment();
        payment.setAmount(new BigDecimal("12.99"));
        when(paymentRepository.findByIdForUpdate(51L)).thenReturn(Optional.of(payment));
        when(userRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(buyer));

        // When
        paymentService.processSuccessfulPayment(51L);

        // Then
        assertThat(buyer.getBoostCredits()).isEqualTo(12);
    }

    @Test
    @DisplayName("processSuccessfulPayment - grant that would overflow the balance is refused")
    void process_BoostOverflowRefused() {
        // Given
        buyer.setBoostCredits(2_100_000_000);
        Payment payment = pendingBoostPayment();
        payment.setAmount(new BigDecimal("99999999.00"));
        when(paymentRepository.findByIdForUpdate(51L)).thenReturn(Optional.of(payment));
        when(userRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(buyer));

        // When / Then
        assertThatThrownBy(() -> paymentService.processSuccessfulPayment(51L))
                .isInstanceOf(BusinessLogicException.class)
                .hasMessageContaining("overflow");
        assertThat(buyer.getBoostCredits()).isEqualTo(2_100_000_000);
        assertThat(payment.getEntitlementAppliedAt()).isNull();
        verify(userRepository, never()).save(any(User.class));
        verify(paymentRepository, never()).save(any(Payment.class));
    }

    @Test
    @DisplayName("handleGatewayCallback - membership credits that would overflow the balance are refused")
    void callback_MembershipOverflowRefused() {
        // Given
        buyer.setBoostCredits(Integer.MAX_VALUE - 1);
        Payment payment = pendingMembershipPayment();
        when(paymentRepository.findByGatewayTransactionIdForUpdate("FM-abc")).thenReturn(Optional.of(payment));
        when(userRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(buyer));

        // When / Then
        assertThatThrownBy(() -> paymentService.handleGatewayCallback("FM-abc", "settlement", "{}"))
                .isInstanceOf(BusinessLogicException.class);
        assertThat(buyer.getBoostCredits()).isEqualTo(Integer.MAX_VALUE - 1);
        assertThat(payment.getEntitlementAppliedAt()).isNull();
        verify(userRepository, never()).save(any(User.class));
    }

    @Test
    @DisplayName("processSuccessfulPayment - second call grants nothing")
    void process_Twice() {
        // Given
        Payment payment = pendingMembershipPayment();
        when(paymentRepository.findByIdForUpdate(50L)).thenReturn(Optional.of(payment));
        when(userRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(buyer));

        // When
        paymentService.processSuccessfulPayment(50L);
        paymentService.processSuccessfulPayment(50L);

        // Then
        assertThat(buyer.getBoostCredits()).isEqualTo(5);
        assertThat(buyer.getMembership()).isSameAs(proPackage);
        verify(userRepository, times(1)).save(buyer);
    }

    @Test
    @DisplayName("processSuccessfulPayment - renewing the same package extends the expiry")
    void process_ExtendsSamePackage() {
        // Given
        LocalDateTime currentExpiry = LocalDateTime.now().plusDays(10);
        buyer.setMembership(proPackage);
        buyer.setMembershipExpiresAt(currentExpiry);
        Payment payment = pendingMembershipPayment();
        when(paymentRepository.findByIdForUpdate(50L)).thenReturn(Optional.of(payment));
        when(userRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(buyer));

        // When
        paymentService.processSuccessfulPayment(50L);

        // Then
        assertThat(buyer.getMembershipExpiresAt()).isEqualTo(currentExpiry.plusDays(30));
    }

    @Test
    @DisplayName("processSuccessfulPayment - cancelled payment is refused")
    void process_Cancelled() {
        // Given
        Payment payment = pendingMembershipPayment();
        payment.setStatus(PaymentStatus.CANCELLED);
        when(paymentRepository.findByIdForUpdate(50L)).thenReturn(Optional.of(payment));

        // When / Then
        assertThatThrownBy(() -> paymentService.processSuccessfulPayment(50L))
                .isInstanceOf(BusinessLogicException.class);
        verifyNoInteractions(userRepository);
    }

    @Test
    @DisplayName("processSuccessfulPayment - missing payment is NotFound")
    void process_Missing() {
        // Given
        when(paymentRepository.findByIdForUpdate(404L)).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> paymentService.processSuccessfulPayment(404L))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    // ========================================
    // reads and callback token
    // ========================================

    @Test
    @DisplayName("getUserPayments - other users' payments are off limits")
    void getUserPayments_Stranger() {
        User stranger = User.builder().userId(2L).isAdmin(false).build();

        assertThatThrownBy(() -> paymentService.getUserPayments(1L, stranger))
                .isInstanceOf(UnauthorizedException.class);
        verifyNoInteractions(paymentRepository);
    }

    @Test
    @DisplayName("getUserPayments - admins can read anyone's payments")
    void getUserPayments_Admin() {
        // Given
        User admin = User.builder().userId(3L).isAdmin(true).build();
        when(paymentRepository.findByUserUserIdOrderByCreatedAtDesc(1L)).thenReturn(List.of(pendingBoostPayment()));

        // When
        List<PaymentResponse> result = paymentService.getUserPayments(1L, admin);

        // Then
        assertThat(result).extracting(PaymentResponse::getPaymentId).containsExactly(51L);
    }

    @Test
    @DisplayName("verifyCallbackToken - configured secret must match")
    void verifyCallbackToken_Configured() {
        PaymentService guarded = new PaymentService(paymentRepository, userRepository, adRepository,
                membershipService, new ModelMapper(), "s3cret");

        assertThatCode(() -> guarded.verifyCallbackToken("s3cret")).doesNotThrowAnyException();
        assertThatThrownBy(() -> guarded.verifyCallbackToken("wrong")).isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> guarded.verifyCallbackToken(null)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    @DisplayName("verifyCallbackToken - no secret configured accepts anything")
    void verifyCallbackToken_Disabled() {
        assertThatCode(() -> paymentService.verifyCallbackToken(null)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("createPayment - stored amount keeps two decimals")
    void createPayment_AmountScale() {
        // Given
        Ad ad = Ad.builder().adId(100L).user(buyer).build();
        when(userRepository.findById(1L)).thenReturn(Optional.of(buyer));
        when(adRepository.findByAdIdAndUserUserId(100L, 1L)).thenReturn(Optional.of(ad));
        when(paymentRepository.save(any(Payment.class))).thenAnswer(invocation -> invocation.getArgument(0));
        PaymentCreateRequest request = PaymentCreateRequest.builder()
                .type(PaymentType.BOOST).adId(100L).amount(new BigDecimal("50.5")).build();

        // When
        paymentService.createPayment(request, 1L);

        // Then
        ArgumentCaptor<Payment> saved = ArgumentCaptor.forClass(Payment.class);
        verify(paymentRepository).save(saved.capture());
        assertThat(saved.getValue().getAmount()).isEqualTo(new BigDecimal("50.50"));
        assertThat(saved.getValue().getAd()).isSameAs(ad);
    }
}
