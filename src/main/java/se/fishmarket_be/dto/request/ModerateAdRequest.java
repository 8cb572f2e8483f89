package se.fishmarket_be.dto.request;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.fishmarket_be.pojo.enums.AdStatus;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ModerateAdRequest {
    @NotNull(message = "Status is required")
    private AdStatus status;

    private String rejectionReason;

    @AssertTrue(message = "Moderation status must be ACTIVE or REJECTED")
    public boolean isModerationStatus() {
        return status == null || status == AdStatus.ACTIVE || status == AdStatus.REJECTED;
    }
}
