package se.fishmarket_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.fishmarket_be.pojo.enums.AdStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdResponse {
    private Long adId;
    private Long userId;
    private String sellerName;
    private Long categoryId;
    private String categoryName;
    private String title;
    private String description;
    private BigDecimal price;
    private String location;
    private String contactInfo;
    private List<String> images;
    private Boolean isBoosted;
    private LocalDateTime boostExpiresAt;
    private Boolean effectivelyBoosted;
    private Integer viewCount;
    private Integer contactCount;
    private AdStatus status;
    private String rejectionReason;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
