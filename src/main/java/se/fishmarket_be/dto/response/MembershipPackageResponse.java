package se.fishmarket_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MembershipPackageResponse {
    private Long packageId;
    private String name;
    private String description;
    private BigDecimal price;
    private Integer durationDays;
    private Integer maxAds;
    private Integer boostCredits;
    private List<String> features;
    private Boolean isActive;
    private LocalDateTime createdAt;
}
