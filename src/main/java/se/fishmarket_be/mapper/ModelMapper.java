package se.fishmarket_be.mapper;

import org.springframework.stereotype.Component;
import se.fishmarket_be.dto.response.*;
import se.fishmarket_be.pojo.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Component
public class ModelMapper {

    public UserResponse toUserResponse(User user) {
        if (user == null) return null;
        MembershipPackage membership = user.getMembership();
        return UserResponse.builder()
                .userId(user.getUserId())
                .email(user.getEmail())
                .fullName(user.getFullName())
                .phone(user.getPhone())
                .avatarUrl(user.getAvatarUrl())
                .membershipId(membership != null ? membership.getPackageId() : null)
                .membershipName(membership != null ? membership.getName() : null)
                .membershipExpiresAt(user.getMembershipExpiresAt())
                .boostCredits(user.getBoostCredits())
                .isAdmin(user.getIsAdmin())
                .isActive(user.getIsActive())
                .createdAt(user.getCreatedAt())
                .updatedAt(user.getUpdatedAt())
                .build();
    }

    public CategoryResponse toCategoryResponse(Category category) {
        if (category == null) return null;
        return CategoryResponse.builder()
                .categoryId(category.getCategoryId())
                .name(category.getName())
                .description(category.getDescription())
                .iconUrl(category.getIconUrl())
                .isActive(category.isActive())
                .createdAt(category.getCreatedAt())
                .build();
    }

    public MembershipPackageResponse toMembershipPackageResponse(MembershipPackage membershipPackage) {
        if (membershipPackage == null) return null;
        return MembershipPackageResponse.builder()
                .packageId(membershipPackage.getPackageId())
                .name(membershipPackage.getName())
                .description(membershipPackage.getDescription())
                .price(membershipPackage.getPrice())
                .durationDays(membershipPackage.getDurationDays())
                .maxAds(membershipPackage.getMaxAds())
                .boostCredits(membershipPackage.getBoostCredits())
                .features(new ArrayList<>(membershipPackage.getFeatures()))
                .isActive(membershipPackage.isActive())
                .createdAt(membershipPackage.getCreatedAt())
                .build();
    }

    public AdResponse toAdResponse(Ad ad) {
        if (ad == null) return null;
        User owner = ad.getUser();
        Category category = ad.getCategory();
        return AdResponse.builder()
                .adId(ad.getAdId())
                .userId(owner != null ? owner.getUserId() : null)
                .sellerName(owner != null ? owner.getFullName() : null)
                .categoryId(category != null ? category.getCategoryId() : null)
                .categoryName(category != null ? category.getName() : null)
                .title(ad.getTitle())
                .description(ad.getDescription())
                .price(ad.getPrice())
                .location(ad.getLocation())
                .contactInfo(ad.getContactInfo())
                .images(new ArrayList<>(ad.getImages()))
                .isBoosted(ad.getIsBoosted())
                .boostExpiresAt(ad.getBoostExpiresAt())
                .effectivelyBoosted(ad.isEffectivelyBoosted(LocalDateTime.now()))
                .viewCount(ad.getViewCount())
                .contactCount(ad.getContactCount())
                .status(ad.getStatus())
                .rejectionReason(ad.getRejectionReason())
                .createdAt(ad.getCreatedAt())
                .updatedAt(ad.getUpdatedAt())
                .build();
    }

    public PaymentResponse toPaymentResponse(Payment payment) {
        if (payment == null) return null;
        return PaymentResponse.builder()
                .paymentId(payment.getPaymentId())
                .userId(payment.getUser() != null ? payment.getUser().getUserId() : null)
                .membershipId(payment.getMembership() != null ? payment.getMembership().getPackageId() : null)
                .adId(payment.getAd() != null ? payment.getAd().getAdId() : null)
                .type(payment.getType())
                .amount(payment.getAmount())
                .status(payment.getStatus())
                .gatewayTransactionId(payment.getGatewayTransactionId())
                .gatewayResponse(payment.getGatewayResponse())
                .entitlementAppliedAt(payment.getEntitlementAppliedAt())
                .createdAt(payment.getCreatedAt())
                .updatedAt(payment.getUpdatedAt())
                .build();
    }

    public List<AdResponse> toAdResponses(List<Ad> ads) {
        return ads.stream().map(this::toAdResponse).toList();
    }

    public List<PaymentResponse> toPaymentResponses(List<Payment> payments) {
        return payments.stream().map(this::toPaymentResponse).toList();
    }
}
