package se.fishmarket_be.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AssignMembershipRequest {
    @NotNull(message = "User ID is required")
    private Long userId;

    @NotNull(message = "Membership ID is required")
    private Long membershipId;
}
