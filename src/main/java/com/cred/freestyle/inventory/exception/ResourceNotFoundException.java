package com.cred.freestyle.inventory.exception;

/**
 * Exception thrown when a requested resource (product, category, supplier) is not found,
 * either by its own ID or as the target of a foreign key in a product payload.
 *
 * @author Inventory Team
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, Object resourceId) {
        super(String.format("%s with ID %s not found", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = String.valueOf(resourceId);
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
