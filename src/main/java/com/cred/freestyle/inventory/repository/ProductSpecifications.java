package com.cred.freestyle.inventory.repository;

import com.cred.freestyle.inventory.domain.model.Product;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * Query predicates for filtered product listing.
 * Each factory returns {@code null} when its argument is absent, which
 * {@link Specification#where(Specification)} and {@code and(...)} treat as "no constraint".
 *
 * @author Inventory Team
 */
public final class ProductSpecifications {

    private ProductSpecifications() {
    }

    /**
     * Case-insensitive substring match on product name.
     */
    public static Specification<Product> nameContains(String name) {
        if (!StringUtils.hasText(name)) {
            return null;
        }
        String pattern = "%" + escapeLike(name.toLowerCase(Locale.ROOT)) + "%";
        return (root, query, cb) -> cb.like(cb.lower(root.get("name")), pattern, '\\');
    }

    public static Specification<Product> skuEquals(String sku) {
        if (!StringUtils.hasText(sku)) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get("sku"), sku);
    }

    public static Specification<Product> categoryIdEquals(Long categoryId) {
        if (categoryId == null) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get("category").get("id"), categoryId);
    }

    public static Specification<Product> supplierIdEquals(Long supplierId) {
        if (supplierId == null) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get("supplier").get("id"), supplierId);
    }

    private static String escapeLike(String value) {
        return value
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }
}
