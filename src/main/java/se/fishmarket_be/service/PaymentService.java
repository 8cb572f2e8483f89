package se.fishmarket_be.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
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

import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@Transactional(readOnly = true)
@Slf4j
public class PaymentService {

    static final String AD_NOT_FOUND_OR_UNAUTHORIZED = "Ad not found or not owned by user";
    static final String TRANSACTION_PREFIX = "FM-";

    private final PaymentRepository paymentRepository;
    private final UserRepository userRepository;
    private final AdRepository adRepository;
    private final MembershipService membershipService;
    private final ModelMapper modelMapper;
    private final String callbackToken;

    public PaymentService(PaymentRepository paymentRepository,
                          UserRepository userRepository,
                          AdRepository adRepository,
                          MembershipService membershipService,
                          ModelMapper modelMapper,
                          @Value("${payment.gateway.callback-token:}") String callbackToken) {
        this.paymentRepository = paymentRepository;
        this.userRepository = userRepository;
        this.adRepository = adRepository;
        this.membershipService = membershipService;
        this.modelMapper = modelMapper;
        this.callbackToken = callbackToken;
    }

    @Transactional
    public PaymentResponse createPayment(PaymentCreateRequest request, Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> {
                    log.warn("createPayment: user {} not found", userId);
                    return new ResourceNotFoundException("User not found with ID: " + userId);
                });

        Payment.PaymentBuilder builder = Payment.builder()
                .user(user)
                .type(request.getType())
                .amount(request.getAmount().setScale(2, RoundingMode.HALF_UP))
                .status(PaymentStatus.PENDING)
                .gatewayTransactionId(TRANSACTION_PREFIX + UUID.randomUUID());

        if (request.getType() == PaymentType.MEMBERSHIP) {
            if (request.getMembershipId() == null) {
                throw new BusinessLogicException("Membership payments require a membershipId");
            }
            MembershipPackage membershipPackage;
            try {
                membershipPackage = membershipService.findActivePackage(request.getMembershipId());
            } catch (ResourceNotFoundException e) {
                log.warn("createPayment: package {} not found or inactive for user {}", request.getMembershipId(), userId);
                throw e;
            }
            if (membershipPackage.getPrice().compareTo(request.getAmount()) != 0) {
                log.warn("createPayment: amount {} differs from price {} of package {}",
                        request.getAmount(), membershipPackage.getPrice(), membershipPackage.getPackageId());
            }
            builder.membership(membershipPackage);
        } else {
            if (request.getAdId() == null) {
                throw new BusinessLogicException("Boost payments require an adId");
            }
            Ad ad = adRepository.findByAdIdAndUserUserId(request.getAdId(), userId)
                    .orElseThrow(() -> {
                        log.warn("createPayment: ad {} not found or not owned by user {}", request.getAdId(), userId);
                        return new ResourceNotFoundException(AD_NOT_FOUND_OR_UNAUTHORIZED);
                    });
            builder.ad(ad);
        }

        Payment saved = paymentRepository.save(builder.build());
        log.info("User {} created {} payment {} for {} ({})", userId, saved.getType(), saved.getPaymentId(),
                saved.getAmount(), saved.getGatewayTransactionId());
        return modelMapper.toPaymentResponse(saved);
    }

    /**
     * Ingests a gateway notification. The raw payload is stored exactly as received. A payment already in a
     * terminal state keeps its status, so replayed notifications never grant twice. On a paid
     * outcome the entitlement is applied in the same transaction; if that fails nothing is kept.
     */
    @Transactional
    public boolean handleGatewayCallback(String transactionId, String gatewayStatus, String rawResponse) {
        Payment payment = paymentRepository.findByGatewayTransactionIdForUpdate(transactionId)
                .orElseThrow(() -> {
                    log.warn("handleGatewayCallback: no payment for transaction {}", transactionId);
                    return new ResourceNotFoundException("Payment not found with transaction ID: " + transactionId);
                });

        payment.setGatewayResponse(rawResponse);
        PaymentStatus mapped = PaymentStatus.fromGatewayStatus(gatewayStatus);

        if (payment.getStatus().isTerminal()) {
            if (mapped != payment.getStatus()) {
                log.warn("handleGatewayCallback: payment {} is already {}, ignoring gateway status '{}'",
                        payment.getPaymentId(), payment.getStatus(), gatewayStatus);
            } else {
                log.info("handleGatewayCallback: replayed '{}' for payment {}", gatewayStatus, payment.getPaymentId());
            }
        } else if (mapped != PaymentStatus.PENDING) {
            payment.setStatus(mapped);
            log.info("Payment {} moved to {} by gateway status '{}'", payment.getPaymentId(), mapped, gatewayStatus);
            if (mapped == PaymentStatus.PAID) {
                applyEntitlement(payment);
            }
        } else {
            log.info("handleGatewayCallback: payment {} still pending (gateway status '{}')",
                    payment.getPaymentId(), gatewayStatus);
        }

        paymentRepository.save(payment);
        return true;
    }

    /**
     * Manual confirmation. A pending payment is marked paid; failed or cancelled ones are refused.
     * The grant happens at most once per payment.
     */
    @Transactional
    public boolean processSuccessfulPayment(Long paymentId) {
        Payment payment = paymentRepository.findByIdForUpdate(paymentId)
                .orElseThrow(() -> {
                    log.warn("processSuccessfulPayment: payment {} not found", paymentId);
                    return new ResourceNotFoundException("Payment not found with ID: " + paymentId);
                });

        if (payment.getStatus() == PaymentStatus.FAILED || payment.getStatus() == PaymentStatus.CANCELLED) {
            log.warn("processSuccessfulPayment: payment {} is {}", paymentId, payment.getStatus());
            throw new BusinessLogicException("Payment " + paymentId + " is " + payment.getStatus() + " and cannot be processed");
        }
        if (payment.getStatus() == PaymentStatus.PENDING) {
            payment.setStatus(PaymentStatus.PAID);
            log.info("Payment {} confirmed as PAID manually", paymentId);
        }

        applyEntitlement(payment);
        paymentRepository.save(payment);
        return true;
    }

    public List<PaymentResponse> getUserPayments(Long userId, User requester) {
        if (!requester.getUserId().equals(userId) && !Boolean.TRUE.equals(requester.getIsAdmin())) {
            log.warn("getUserPayments: user {} may not read payments of user {}", requester.getUserId(), userId);
            throw new UnauthorizedException("You can only view your own payments");
        }
        return modelMapper.toPaymentResponses(paymentRepository.findByUserUserIdOrderByCreatedAtDesc(userId));
    }

    public List<PaymentResponse> getAllPayments() {
        return modelMapper.toPaymentResponses(paymentRepository.findAllByOrderByCreatedAtDesc());
    }

    public Optional<PaymentResponse> getPaymentById(Long paymentId, User requester) {
        Optional<Payment> found = paymentRepository.findById(paymentId);
        if (found.isPresent()
                && !found.get().getUser().getUserId().equals(requester.getUserId())
                && !Boolean.TRUE.equals(requester.getIsAdmin())) {
            log.warn("getPaymentById: user {} may not read payment {}", requester.getUserId(), paymentId);
            throw new UnauthorizedException("You can only view your own payments");
        }
        return found.map(modelMapper::toPaymentResponse);
    }

    /**
     * Checks the shared secret sent by the gateway. No secret configured means no check.
     */
    public void verifyCallbackToken(String providedToken) {
        if (callbackToken == null || callbackToken.isBlank()) {
            return;
        }
        byte[] expected = callbackToken.getBytes(StandardCharsets.UTF_8);
        byte[] provided = providedToken == null ? new byte[0] : providedToken.getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(expected, provided)) {
            log.warn("handleGatewayCallback: rejected notification with a bad callback token");
            throw new InvalidTokenException("Invalid callback token");
        }
    }

    /**
     * Grants what the payment bought. Returns false when it was granted before.
     */
    private boolean applyEntitlement(Payment payment) {
        if (payment.getEntitlementAppliedAt() != null) {
            log.info("Entitlement for payment {} already applied at {}", payment.getPaymentId(), payment.getEntitlementAppliedAt());
            return false;
        }

        Long userId = payment.getUser().getUserId();
        User user = userRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> {
                    log.error("applyEntitlement: user {} of payment {} not found", userId, payment.getPaymentId());
                    return new ResourceNotFoundException("User not found with ID: " + userId);
                });
        LocalDateTime now = LocalDateTime.now();

        switch (payment.getType()) {
            case MEMBERSHIP -> {
                MembershipPackage membershipPackage = payment.getMembership();
                if (membershipPackage == null) {
                    log.error("applyEntitlement: membership payment {} has no package", payment.getPaymentId());
                    throw new BusinessLogicException("Membership payment " + payment.getPaymentId() + " has no package");
                }
                boolean extending = user.getMembership() != null
                        && user.getMembership().getPackageId().equals(membershipPackage.getPackageId())
                        && user.getMembershipExpiresAt() != null
                        && user.getMembershipExpiresAt().isAfter(now);
                LocalDateTime base = extending ? user.getMembershipExpiresAt() : now;

                user.setMembership(membershipPackage);
                user.setMembershipExpiresAt(base.plusDays(membershipPackage.getDurationDays()));
                grantCredits(user, membershipPackage.getBoostCredits(), payment);
                log.info("User {} granted membership {} until {} (+{} boost credits) by payment {}",
                        userId, membershipPackage.getPackageId(), user.getMembershipExpiresAt(),
                        membershipPackage.getBoostCredits(), payment.getPaymentId());
            }
            case BOOST -> {
                int credits = payment.getAmount().setScale(0, RoundingMode.FLOOR).intValueExact();
                grantCredits(user, credits, payment);
                log.info("User {} granted {} boost credits by payment {}", userId, credits, payment.getPaymentId());
            }
        }

        userRepository.save(user);
        payment.setEntitlementAppliedAt(now);
        return true;
    }

    private void grantCredits(User user, int credits, Payment payment) {
        try {
            user.setBoostCredits(Math.addExact(user.getBoostCredits(), credits));
        } catch (ArithmeticException e) {
            log.error("applyEntitlement: granting {} credits to user {} by payment {} overflows the balance of {}",
                    credits, user.getUserId(), payment.getPaymentId(), user.getBoostCredits());
            throw new BusinessLogicException("Boost credit balance of user " + user.getUserId() + " would overflow");
        }
    }
}
