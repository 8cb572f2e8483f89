package se.fishmarket_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import se.fishmarket_be.dto.request.CategoryRequest;
import se.fishmarket_be.dto.request.OnCreate;
import se.fishmarket_be.dto.response.ApiResponse;
import se.fishmarket_be.dto.response.CategoryResponse;
import se.fishmarket_be.service.CategoryService;

import java.util.List;

@RestController
@RequestMapping("/api/categories")
@Tag(name = "Category", description = "API for category management")
@RequiredArgsConstructor
public class CategoryController {

    private final CategoryService categoryService;

    @GetMapping
    @Operation(summary = "Get active categories", description = "Public endpoint to retrieve all active categories")
    public ResponseEntity<ApiResponse<List<CategoryResponse>>> getCategories() {
        return ResponseEntity.ok(ApiResponse.success("Successfully retrieved categories", categoryService.getCategories()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get category by ID", description = "Also returns deactivated categories")
    public ResponseEntity<ApiResponse<CategoryResponse>> getCategoryById(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Successfully retrieved category", categoryService.getCategoryById(id)));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Create new category", description = "Admin-only endpoint to create a new category")
    @SecurityRequirement(name = "bearer-auth")
    public ResponseEntity<ApiResponse<CategoryResponse>> createCategory(
            @Validated(OnCreate.class) @RequestBody CategoryRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.created("Category created", categoryService.createCategory(request)));
    }

    @PatchMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Update category", description = "Admin-only; only the fields present in the body change")
    @SecurityRequirement(name = "bearer-auth")
    public ResponseEntity<ApiResponse<CategoryResponse>> updateCategory(
            @PathVariable Long id, @Valid @RequestBody CategoryRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Category updated", categoryService.updateCategory(id, request)));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Deactivate category", description = "Soft delete; the category stays fetchable by ID")
    @SecurityRequirement(name = "bearer-auth")
    public ResponseEntity<ApiResponse<Boolean>> deleteCategory(@PathVariable Long id) {
        if (!categoryService.deleteCategory(id)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ApiResponse.<Boolean>builder()
                            .status(HttpStatus.NOT_FOUND.toString())
                            .message("Category not found with ID: " + id)
                            .data(false)
                            .build());
        }
        return ResponseEntity.ok(ApiResponse.success("Category deactivated", true));
    }
}
