package se.fishmarket_be.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BoostAdRequest {
    @NotNull(message = "Duration is required")
    @Positive(message = "Duration must be positive")
    @Max(value = 365, message = "Duration cannot exceed 365 days")
    private Integer durationDays;
}
