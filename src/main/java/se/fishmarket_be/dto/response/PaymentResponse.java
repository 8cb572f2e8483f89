package se.fishmarket_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.fishmarket_be.pojo.enums.PaymentStatus;
import se.fishmarket_be.pojo.enums.PaymentType;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentResponse {
    private Long paymentId;
    private Long userId;
    private Long membershipId;
    private Long adId;
    private PaymentType type;
    private BigDecimal amount;
    private PaymentStatus status;
    private String gatewayTransactionId;
    private String gatewayResponse;
    private LocalDateTime entitlementAppliedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
