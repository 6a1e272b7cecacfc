package com.cred.freestyle.inventory.exception;

/**
 * Exception thrown when a create or update would break a uniqueness rule
 * (product SKU, category name, supplier email).
 *
 * @author Inventory Team
 */
public class DuplicateResourceException extends RuntimeException {

    private final String resourceType;
    private final String field;
    private final String value;

    public DuplicateResourceException(String resourceType, String field, String value) {
        this(resourceType, field, value, null);
    }

    public DuplicateResourceException(String resourceType, String field, String value, Throwable cause) {
        super(String.format("%s with %s '%s' already exists", resourceType, field, value), cause);
        this.resourceType = resourceType;
        this.field = field;
        this.value = value;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getField() {
        return field;
    }

    public String getValue() {
        return value;
    }
}
