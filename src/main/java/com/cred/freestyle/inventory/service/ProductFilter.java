package com.cred.freestyle.inventory.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional, conjunctive filters for product listing. A null field imposes no constraint.
 *
 * @author Inventory Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductFilter {

    /**
     * Case-insensitive substring of the product name.
     */
    private String name;

    /**
     * Exact SKU.
     */
    private String sku;

    private Long categoryId;

    private Long supplierId;

    public static ProductFilter none() {
        return new ProductFilter();
    }
}
