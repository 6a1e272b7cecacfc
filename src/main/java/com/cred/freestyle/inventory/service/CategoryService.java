package com.cred.freestyle.inventory.service;

import com.cred.freestyle.inventory.api.dto.CategoryRequest;
import com.cred.freestyle.inventory.api.dto.CategoryUpdateRequest;
import com.cred.freestyle.inventory.domain.model.Category;
import com.cred.freestyle.inventory.exception.DuplicateResourceException;
import com.cred.freestyle.inventory.exception.ResourceInUseException;
import com.cred.freestyle.inventory.exception.ResourceNotFoundException;
import com.cred.freestyle.inventory.exception.ValidationFailedException;
import com.cred.freestyle.inventory.repository.CategoryRepository;
import com.cred.freestyle.inventory.repository.ProductRepository;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.util.Collections;
import java.util.List;

/**
 * Service for managing product categories.
 * Owns category name uniqueness and refuses to delete a category that products still reference.
 *
 * @author Inventory Team
 */
@Service
@Validated
public class CategoryService {

    static final String RESOURCE_TYPE = "Category";
    static final String NAME_CONSTRAINT = "uk_categories_name";

    private static final Logger logger = LoggerFactory.getLogger(CategoryService.class);

    private final CategoryRepository categoryRepository;
    private final ProductRepository productRepository;

    public CategoryService(CategoryRepository categoryRepository, ProductRepository productRepository) {
        this.categoryRepository = categoryRepository;
        this.productRepository = productRepository;
    }

    /**
     * Create a new category.
     *
     * @param request Category fields
     * @return Persisted category with its assigned ID
     * @throws DuplicateResourceException if a category with the same name exists
     */
    @Transactional
    public Category createCategory(@Valid CategoryRequest request) {
        logger.info("Creating category: {}", request.getName());

        if (categoryRepository.existsByName(request.getName())) {
            throw new DuplicateResourceException(RESOURCE_TYPE, "name", request.getName());
        }

        Category category = Category.builder()
                .name(request.getName())
                .description(request.getDescription())
                .build();

        category = save(category);
        logger.info("Created category: {} with ID: {}", category.getName(), category.getId());
        return category;
    }

    /**
     * List categories in insertion order.
     *
     * @param skip Number of categories to skip
     * @param limit Maximum number of categories to return
     * @return Page of categories
     */
    @Transactional(readOnly = true)
    public List<Category> listCategories(int skip, int limit) {
        Pagination.validate(RESOURCE_TYPE, skip, limit);
        if (limit == 0) {
            return Collections.emptyList();
        }

        logger.debug("Listing categories, skip: {}, limit: {}", skip, limit);
        return categoryRepository.findAll(Pagination.of(skip, limit)).getContent();
    }

    /**
     * Find category by ID.
     *
     * @param categoryId Category ID
     * @return Category
     * @throws ResourceNotFoundException if no category has that ID
     */
    @Transactional(readOnly = true)
    public Category getCategory(Long categoryId) {
        return categoryRepository.findById(categoryId)
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE_TYPE, categoryId));
    }

    /**
     * Apply the fields present in the request to an existing category.
     * A changed name is checked for uniqueness before anything is applied.
     *
     * @param categoryId Category ID
     * @param request Partial category fields
     * @return Updated category
     */
    @Transactional
    public Category updateCategory(Long categoryId, @Valid CategoryUpdateRequest request) {
        if (request.hasName() && request.getName() == null) {
            throw new ValidationFailedException(RESOURCE_TYPE, "name", "must not be null");
        }

        Category category = getCategory(categoryId);

        if (request.hasName() && !request.getName().equals(category.getName())
                && categoryRepository.existsByName(request.getName())) {
            throw new DuplicateResourceException(RESOURCE_TYPE, "name", request.getName());
        }

        if (request.hasName()) {
            category.setName(request.getName());
        }
        if (request.hasDescription()) {
            category.setDescription(request.getDescription());
        }

        category = save(category);
        logger.info("Updated category: {}", categoryId);
        return category;
    }

    /**
     * Delete a category that no product references.
     *
     * @param categoryId Category ID
     * @throws ResourceInUseException if any product references the category
     */
    @Transactional
    public void deleteCategory(Long categoryId) {
        Category category = getCategory(categoryId);

        long productCount = productRepository.countByCategoryId(categoryId);
        if (productCount > 0) {
            throw new ResourceInUseException(RESOURCE_TYPE, categoryId, category.getName(), productCount);
        }

        try {
            categoryRepository.delete(category);
            categoryRepository.flush();
        } catch (DataIntegrityViolationException e) {
            // A product was assigned concurrently
            throw new ResourceInUseException(RESOURCE_TYPE, categoryId, category.getName(), 1);
        }
        logger.info("Deleted category: {} ({})", categoryId, category.getName());
    }

    private Category save(Category category) {
        try {
            return categoryRepository.saveAndFlush(category);
        } catch (DataIntegrityViolationException e) {
            if (ConstraintViolations.violates(e, NAME_CONSTRAINT)) {
                throw new DuplicateResourceException(RESOURCE_TYPE, "name", category.getName(), e);
            }
            throw e;
        }
    }
}
