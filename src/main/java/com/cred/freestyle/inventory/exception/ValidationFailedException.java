package com.cred.freestyle.inventory.exception;

/**
 * Exception thrown when input violates a field constraint that is checked in the
 * service layer, before any storage access.
 *
 * @author Inventory Team
 */
public class ValidationFailedException extends RuntimeException {

    private final String resourceType;
    private final String field;

    public ValidationFailedException(String resourceType, String field, String reason) {
        super(String.format("Invalid %s %s: %s", resourceType, field, reason));
        this.resourceType = resourceType;
        this.field = field;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getField() {
        return field;
    }
}
