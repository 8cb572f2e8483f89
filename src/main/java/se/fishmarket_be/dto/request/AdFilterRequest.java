package se.fishmarket_be.dto.request;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.fishmarket_be.pojo.enums.AdStatus;

import java.math.BigDecimal;

/**
 * Query-string filters for ad listings. Every filter is optional and they combine with AND.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdFilterRequest {
    private Long categoryId;
    private Long userId;
    private String search;
    private String location;

    @DecimalMin(value = "0", message = "Minimum price cannot be negative")
    private BigDecimal minPrice;

    @DecimalMin(value = "0", message = "Maximum price cannot be negative")
    private BigDecimal maxPrice;

    @Positive(message = "Limit must be positive")
    private Integer limit;

    @PositiveOrZero(message = "Offset cannot be negative")
    private Integer offset;

    /** Only honoured on the admin listing. */
    private AdStatus status;

    @AssertTrue(message = "Minimum price cannot exceed maximum price")
    public boolean isPriceRangeValid() {
        return minPrice == null || maxPrice == null || minPrice.compareTo(maxPrice) <= 0;
    }
}
