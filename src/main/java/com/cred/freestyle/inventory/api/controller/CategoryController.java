package com.cred.freestyle.inventory.api.controller;

import com.cred.freestyle.inventory.api.dto.CategoryRequest;
import com.cred.freestyle.inventory.api.dto.CategoryResponse;
import com.cred.freestyle.inventory.api.dto.CategoryUpdateRequest;
import com.cred.freestyle.inventory.domain.model.Category;
import com.cred.freestyle.inventory.service.CategoryService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for category operations.
 *
 * @author Inventory Team
 */
@RestController
@RequestMapping("/api/v1/categories")
public class CategoryController {

    private static final Logger logger = LoggerFactory.getLogger(CategoryController.class);

    private final CategoryService categoryService;

    public CategoryController(CategoryService categoryService) {
        this.categoryService = categoryService;
    }

    @PostMapping
    public ResponseEntity<CategoryResponse> createCategory(@Valid @RequestBody CategoryRequest request) {
        Category category = categoryService.createCategory(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(CategoryResponse.fromEntity(category));
    }

    @GetMapping
    public ResponseEntity<List<CategoryResponse>> listCategories(
            @RequestParam(defaultValue = "0") int skip,
            @RequestParam(defaultValue = "${inventory.pagination.default-limit:100}") int limit
    ) {
        List<CategoryResponse> responses = categoryService.listCategories(skip, limit).stream()
                .map(CategoryResponse::fromEntity)
                .collect(Collectors.toList());

        logger.debug("Found {} categories", responses.size());
        return ResponseEntity.ok(responses);
    }

    @GetMapping("/{categoryId}")
    public ResponseEntity<CategoryResponse> getCategory(@PathVariable Long categoryId) {
        return ResponseEntity.ok(CategoryResponse.fromEntity(categoryService.getCategory(categoryId)));
    }

    @PutMapping("/{categoryId}")
    public ResponseEntity<CategoryResponse> updateCategory(
            @PathVariable Long categoryId,
            @Valid @RequestBody CategoryUpdateRequest request
    ) {
        Category category = categoryService.updateCategory(categoryId, request);
        return ResponseEntity.ok(CategoryResponse.fromEntity(category));
    }

    /**
     * Delete a category. Fails with 409 while products still reference it.
     */
    @DeleteMapping("/{categoryId}")
    public ResponseEntity<Void> deleteCategory(@PathVariable Long categoryId) {
        categoryService.deleteCategory(categoryId);
        return ResponseEntity.noContent().build();
    }
}
