package se.fishmarket_be.dto.request;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.fishmarket_be.pojo.enums.PaymentType;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentCreateRequest {
    private Long membershipId;

    private Long adId;

    @NotNull(message = "Payment type is required")
    private PaymentType type;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @Digits(integer = 8, fraction = 2, message = "Amount must have at most 2 decimal places")
    private BigDecimal amount;

    @AssertTrue(message = "Membership payments require a membershipId and boost payments require an adId")
    public boolean isTargetPresent() {
        if (type == null) return true;
        return switch (type) {
            case MEMBERSHIP -> membershipId != null;
            case BOOST -> adId != null;
        };
    }
}
