package com.cred.freestyle.inventory.api.dto;

import com.cred.freestyle.inventory.domain.model.Product;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.Set;

/**
 * Request DTO for a partial product update.
 * Setters mark their field as present, so a request can tell an omitted
 * {@code categoryId} (leave as is) from an explicit {@code null} (clear the association).
 *
 * @author Inventory Team
 */
public class ProductUpdateRequest {

    private final Set<String> presentFields = new HashSet<>();

    @Size(min = 3, max = 50, message = "SKU must be between 3 and 50 characters")
    private String sku;

    @Size(min = 3, max = 200, message = "Product name must be between 3 and 200 characters")
    private String name;

    @Size(max = 1000, message = "Description must be at most 1000 characters")
    private String description;

    @DecimalMin(value = "0", inclusive = false, message = "Purchase price must be greater than 0")
    @Digits(integer = Product.PRICE_INTEGER_DIGITS, fraction = Product.PRICE_FRACTION_DIGITS,
            message = "Purchase price must have at most 10 integer digits and 2 decimal places")
    private BigDecimal purchasePrice;

    @DecimalMin(value = "0", inclusive = false, message = "Sale price must be greater than 0")
    @Digits(integer = Product.PRICE_INTEGER_DIGITS, fraction = Product.PRICE_FRACTION_DIGITS,
            message = "Sale price must have at most 10 integer digits and 2 decimal places")
    private BigDecimal salePrice;

    @Min(value = 0, message = "Quantity on hand must not be negative")
    private Integer quantityOnHand;

    @Min(value = 0, message = "Reorder level must not be negative")
    private Integer reorderLevel;

    @Size(max = 100, message = "Location must be at most 100 characters")
    private String location;

    @Size(max = 2048, message = "Image URL must be at most 2048 characters")
    private String imageUrl;

    private Boolean isActive;

    private Long categoryId;

    private Long supplierId;

    public boolean hasSku() {
        return presentFields.contains("sku");
    }

    public boolean hasName() {
        return presentFields.contains("name");
    }

    public boolean hasDescription() {
        return presentFields.contains("description");
    }

    public boolean hasPurchasePrice() {
        return presentFields.contains("purchasePrice");
    }

    public boolean hasSalePrice() {
        return presentFields.contains("salePrice");
    }

    public boolean hasQuantityOnHand() {
        return presentFields.contains("quantityOnHand");
    }

    public boolean hasReorderLevel() {
        return presentFields.contains("reorderLevel");
    }

    public boolean hasLocation() {
        return presentFields.contains("location");
    }

    public boolean hasImageUrl() {
        return presentFields.contains("imageUrl");
    }

    public boolean hasIsActive() {
        return presentFields.contains("isActive");
    }

    public boolean hasCategoryId() {
        return presentFields.contains("categoryId");
    }

    public boolean hasSupplierId() {
        return presentFields.contains("supplierId");
    }

    // Getters and setters
    public String getSku() {
        return sku;
    }

    public void setSku(String sku) {
        this.sku = sku;
        presentFields.add("sku");
    }

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

    public BigDecimal getPurchasePrice() {
        return purchasePrice;
    }

    public void setPurchasePrice(BigDecimal purchasePrice) {
        this.purchasePrice = purchasePrice;
        presentFields.add("purchasePrice");
    }

    public BigDecimal getSalePrice() {
        return salePrice;
    }

    public void setSalePrice(BigDecimal salePrice) {
        this.salePrice = salePrice;
        presentFields.add("salePrice");
    }

    public Integer getQuantityOnHand() {
        return quantityOnHand;
    }

    public void setQuantityOnHand(Integer quantityOnHand) {
        this.quantityOnHand = quantityOnHand;
        presentFields.add("quantityOnHand");
    }

    public Integer getReorderLevel() {
        return reorderLevel;
    }

    public void setReorderLevel(Integer reorderLevel) {
        this.reorderLevel = reorderLevel;
        presentFields.add("reorderLevel");
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
        presentFields.add("location");
    }

    public String getImageUrl() {
        return imageUrl;
    }

    public void setImageUrl(String imageUrl) {
        this.imageUrl = imageUrl;
        presentFields.add("imageUrl");
    }

    public Boolean getIsActive() {
        return isActive;
    }

    public void setIsActive(Boolean isActive) {
        this.isActive = isActive;
        presentFields.add("isActive");
    }

    public Long getCategoryId() {
        return categoryId;
    }

    public void setCategoryId(Long categoryId) {
        this.categoryId = categoryId;
        presentFields.add("categoryId");
    }

    public Long getSupplierId() {
        return supplierId;
    }

    public void setSupplierId(Long supplierId) {
        this.supplierId = supplierId;
        presentFields.add("supplierId");
    }
}
