package se.fishmarket_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.fishmarket_be.dto.request.CategoryRequest;
import se.fishmarket_be.dto.response.CategoryResponse;
import se.fishmarket_be.exception.ResourceNotFoundException;
import se.fishmarket_be.mapper.ModelMapper;
import se.fishmarket_be.pojo.Category;
import se.fishmarket_be.repository.CategoryRepository;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class CategoryService {

    private final CategoryRepository categoryRepository;
    private final ModelMapper modelMapper;

    public List<CategoryResponse> getCategories() {
        return categoryRepository.findByIsActiveTrueOrderByNameAsc().stream()
                .map(modelMapper::toCategoryResponse)
                .toList();
    }

    /**
     * Deactivated categories stay visible here.
     */
    public CategoryResponse getCategoryById(Long id) {
        return modelMapper.toCategoryResponse(findById(id));
    }

    public Category findById(Long id) {
        return categoryRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Category not found with ID: " + id));
    }

    @Transactional
    public CategoryResponse createCategory(CategoryRequest request) {
        Category category = Category.builder()
                .name(request.getName().trim())
                .description(request.getDescription())
                .iconUrl(request.getIconUrl())
                .isActive(true)
                .build();
        Category saved = categoryRepository.save(category);
        log.info("Category '{}' created with id {}", saved.getName(), saved.getCategoryId());
        return modelMapper.toCategoryResponse(saved);
    }

    @Transactional
    public CategoryResponse updateCategory(Long id, CategoryRequest request) {
        Category category = categoryRepository.findById(id)
                .orElseThrow(() -> {
                    log.warn("updateCategory: category {} not found", id);
                    return new ResourceNotFoundException("Category not found with ID: " + id);
                });

        if (request.hasName()) category.setName(request.getName().trim());
        if (request.hasDescription()) category.setDescription(request.getDescription());
        if (request.hasIconUrl()) category.setIconUrl(request.getIconUrl());

        return modelMapper.toCategoryResponse(categoryRepository.save(category));
    }

    @Transactional
    public boolean deleteCategory(Long id) {
        Optional<Category> found = categoryRepository.findById(id);
        if (found.isEmpty()) {
            log.warn("deleteCategory: category {} not found", id);
            return false;
        }
        Category category = found.get();
        if (category.isActive()) {
            category.setActive(false);
            categoryRepository.save(category);
            log.info("Category {} deactivated", id);
        }
        return true;
    }
}
