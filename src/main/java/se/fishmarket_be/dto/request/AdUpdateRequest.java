package se.fishmarket_be.dto.request;

import jakarta.validation.constraints.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdUpdateRequest {
    private Long categoryId;

    @Pattern(regexp = "(?s).*\\S.*", message = "Title cannot be blank")
    @Size(min = 1, max = 150, message = "Title must be between 1 and 150 characters")
    private String title;

    @Pattern(regexp = "(?s).*\\S.*", message = "Description cannot be blank")
    @Size(min = 1, message = "Description cannot be empty")
    private String description;

    @DecimalMin(value = "0.01", message = "Price must be greater than 0")
    @Digits(integer = 8, fraction = 2, message = "Price must have at most 2 decimal places")
    private BigDecimal price;

    @Pattern(regexp = "(?s).*\\S.*", message = "Location cannot be blank")
    @Size(min = 1, max = 150, message = "Location must be between 1 and 150 characters")
    private String location;

    @Pattern(regexp = "(?s).*\\S.*", message = "Contact info cannot be blank")
    @Size(min = 1, max = 150, message = "Contact info must be between 1 and 150 characters")
    private String contactInfo;

    @Size(max = 10, message = "An ad can have at most 10 images")
    private List<@NotBlank(message = "Image URL cannot be blank") String> images;

    public boolean hasCategoryId() { return categoryId != null; }
    public boolean hasTitle() { return title != null; }
    public boolean hasDescription() { return description != null; }
    public boolean hasPrice() { return price != null; }
    public boolean hasLocation() { return location != null; }
    public boolean hasContactInfo() { return contactInfo != null; }
    public boolean hasImages() { return images != null; }
}
