package se.fishmarket_be.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AccessLevel;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Field mask for a profile update. A field that is absent from the JSON body is left
 * untouched, while an explicit {@code null} clears the nullable ones (phone, avatar).
 */
@Data
@NoArgsConstructor
public class UpdateUserRequest {
    @Pattern(regexp = "(?s).*\\S.*", message = "Full name cannot be blank")
    @Size(min = 1, max = 100, message = "Full name must be between 1 and 100 characters")
    private String fullName;

    @Size(max = 20, message = "Phone cannot exceed 20 characters")
    private String phone;

    @Size(max = 255, message = "Avatar URL cannot exceed 255 characters")
    private String avatarUrl;

    @JsonIgnore
    @Setter(AccessLevel.NONE)
    private boolean phoneSet;

    @JsonIgnore
    @Setter(AccessLevel.NONE)
    private boolean avatarUrlSet;

    public void setPhone(String phone) {
        this.phone = phone;
        this.phoneSet = true;
    }

    public void setAvatarUrl(String avatarUrl) {
        this.avatarUrl = avatarUrl;
        this.avatarUrlSet = true;
    }

    public boolean hasFullName() { return fullName != null; }
    public boolean hasPhone() { return phoneSet; }
    public boolean hasAvatarUrl() { return avatarUrlSet; }
}
