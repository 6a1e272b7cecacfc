package com.cred.freestyle.inventory.api.dto;

import com.cred.freestyle.inventory.domain.model.Product;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Request DTO for creating a product.
 * Omitted {@code quantityOnHand}, {@code reorderLevel} and {@code isActive} are
 * filled with their defaults when the product is created.
 *
 * @author Inventory Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductRequest {

    @NotBlank(message = "SKU is required")
    @Size(min = 3, max = 50, message = "SKU must be between 3 and 50 characters")
    private String sku;

    @NotBlank(message = "Product name is required")
    @Size(min = 3, max = 200, message = "Product name must be between 3 and 200 characters")
    private String name;

    @Size(max = 1000, message = "Description must be at most 1000 characters")
    private String description;

    @NotNull(message = "Purchase price is required")
    @DecimalMin(value = "0", inclusive = false, message = "Purchase price must be greater than 0")
    @Digits(integer = Product.PRICE_INTEGER_DIGITS, fraction = Product.PRICE_FRACTION_DIGITS,
            message = "Purchase price must have at most 10 integer digits and 2 decimal places")
    private BigDecimal purchasePrice;

    @NotNull(message = "Sale price is required")
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
}
