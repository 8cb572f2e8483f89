package se.fishmarket_be.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.*;
import lombok.AccessLevel;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.List;

@Data
@NoArgsConstructor
public class MembershipPackageRequest {

    @NotBlank(message = "Package name cannot be blank", groups = OnCreate.class)
    @Pattern(regexp = "(?s).*\\S.*", message = "Package name cannot be blank")
    @Size(min = 1, max = 100, message = "Package name must be between 1 and 100 characters")
    private String name;

    private String description;

    @NotNull(message = "Price cannot be null", groups = OnCreate.class)
    @Positive(message = "Price must be positive")
    @Digits(integer = 8, fraction = 2, message = "Price must have at most 2 decimal places")
    private BigDecimal price;

    @NotNull(message = "Duration cannot be null", groups = OnCreate.class)
    @Positive(message = "Duration must be positive")
    private Integer durationDays;

    @NotNull(message = "Max ads cannot be null", groups = OnCreate.class)
    @Positive(message = "Max ads must be positive")
    private Integer maxAds;

    @PositiveOrZero(message = "Boost credits cannot be negative")
    private Integer boostCredits;

    private List<@NotBlank(message = "Feature cannot be blank") String> features;

    @JsonIgnore
    @Setter(AccessLevel.NONE)
    private boolean descriptionSet;

    public void setDescription(String description) {
        this.description = description;
        this.descriptionSet = true;
    }

    public boolean hasName() { return name != null; }
    public boolean hasDescription() { return descriptionSet; }
    public boolean hasPrice() { return price != null; }
    public boolean hasDurationDays() { return durationDays != null; }
    public boolean hasMaxAds() { return maxAds != null; }
    public boolean hasBoostCredits() { return boostCredits != null; }
    public boolean hasFeatures() { return features != null; }
}
