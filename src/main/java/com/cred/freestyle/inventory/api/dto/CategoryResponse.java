package com.cred.freestyle.inventory.api.dto;

import com.cred.freestyle.inventory.domain.model.Category;

/**
 * Response DTO for a category.
 *
 * @author Inventory Team
 */
public class CategoryResponse {

    private Long id;
    private String name;
    private String description;

    public CategoryResponse() {
    }

    /**
     * Create response from Category entity.
     *
     * @param category Category entity
     * @return CategoryResponse
     */
    public static CategoryResponse fromEntity(Category category) {
        CategoryResponse response = new CategoryResponse();
        response.setId(category.getId());
        response.setName(category.getName());
        response.setDescription(category.getDescription());
        return response;
    }

    // Getters and setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }
}
