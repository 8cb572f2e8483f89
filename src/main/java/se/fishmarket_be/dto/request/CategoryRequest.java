package se.fishmarket_be.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AccessLevel;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Data
@NoArgsConstructor
public class CategoryRequest {

    @NotBlank(message = "Category name cannot be blank", groups = OnCreate.class)
    @Pattern(regexp = "(?s).*\\S.*", message = "Category name cannot be blank")
    @Size(min = 1, max = 50, message = "Category name must be between 1 and 50 characters")
    private String name;

    private String description;

    @Size(max = 255, message = "Icon URL cannot exceed 255 characters")
    private String iconUrl;

    @JsonIgnore
    @Setter(AccessLevel.NONE)
    private boolean descriptionSet;

    @JsonIgnore
    @Setter(AccessLevel.NONE)
    private boolean iconUrlSet;

    public void setDescription(String description) {
        this.description = description;
        this.descriptionSet = true;
    }

    public void setIconUrl(String iconUrl) {
        this.iconUrl = iconUrl;
        this.iconUrlSet = true;
    }

    public boolean hasName() { return name != null; }
    public boolean hasDescription() { return descriptionSet; }
    public boolean hasIconUrl() { return iconUrlSet; }
}
