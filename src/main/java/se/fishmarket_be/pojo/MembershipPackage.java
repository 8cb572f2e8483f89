package se.fishmarket_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "membership_packages")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MembershipPackage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long packageId;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(columnDefinition = "text")
    private String description;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "duration_days", nullable = false)
    private Integer durationDays;

    @Column(name = "max_ads", nullable = false)
    private Integer maxAds;

    @Column(name = "boost_credits", nullable = false)
    @Builder.Default
    private Integer boostCredits = 0;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "membership_package_features", joinColumns = @JoinColumn(name = "package_id"))
    @OrderColumn(name = "feature_order")
    @Column(name = "feature", nullable = false)
    @Builder.Default
    private List<String> features = new ArrayList<>();

    @Column(nullable = false)
    @Builder.Default
    private boolean isActive = true;

    @CreationTimestamp
    private LocalDateTime createdAt;
}
