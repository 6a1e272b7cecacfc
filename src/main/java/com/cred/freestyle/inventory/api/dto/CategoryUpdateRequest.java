package com.cred.freestyle.inventory.api.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.HashSet;
import java.util.Set;

/**
 * Request DTO for a partial category update.
 * Jackson only calls setters for properties present in the request body, so each
 * setter records its field as present. A present property may still carry {@code null}.
 *
 * @author Inventory Team
 */
public class CategoryUpdateRequest {

    static final String NOT_BLANK = "(?s).*\\S.*";

    private final Set<String> presentFields = new HashSet<>();

    @Pattern(regexp = NOT_BLANK, message = "Category name must not be blank")
    @Size(min = 2, max = 100, message = "Category name must be between 2 and 100 characters")
    private String name;

    @Size(max = 500, message = "Description must be at most 500 characters")
    private String description;

    public boolean hasName() {
        return presentFields.contains("name");
    }

    public boolean hasDescription() {
        return presentFields.contains("description");
    }

    // Getters and setters
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
        presentFields.add("name");
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
        presentFields.add("description");
    }
}
