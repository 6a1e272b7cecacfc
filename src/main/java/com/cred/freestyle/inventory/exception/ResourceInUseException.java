package com.cred.freestyle.inventory.exception;

/**
 * Exception thrown when deleting a category or supplier that products still reference.
 *
 * @author Inventory Team
 */
public class ResourceInUseException extends RuntimeException {

    private final String resourceType;
    private final String resourceId;
    private final long dependentCount;

    public ResourceInUseException(String resourceType, Object resourceId, String resourceName, long dependentCount) {
        super(String.format("Cannot delete %s '%s' as it has associated products. "
                        + "Please reassign or delete them first.",
                resourceType.toLowerCase(), resourceName));
        this.resourceType = resourceType;
        this.resourceId = String.valueOf(resourceId);
        this.dependentCount = dependentCount;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }

    public long getDependentCount() {
        return dependentCount;
    }
}
