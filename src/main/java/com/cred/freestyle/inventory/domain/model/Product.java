package com.cred.freestyle.inventory.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Product entity representing a stock-kept item.
 * A product optionally belongs to one category and one supplier; neither
 * relation implies ownership.
 *
 * @author Inventory Team
 */
@Entity
@Table(name = "products", uniqueConstraints = {
    @UniqueConstraint(name = "uk_products_sku", columnNames = "sku")
}, indexes = {
    @Index(name = "idx_products_name", columnList = "name"),
    @Index(name = "idx_products_category", columnList = "category_id"),
    @Index(name = "idx_products_supplier", columnList = "supplier_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Product {

    public static final int DEFAULT_QUANTITY_ON_HAND = 0;
    public static final int DEFAULT_REORDER_LEVEL = 10;

    /** Prices are NUMERIC(12, 2). */
    public static final int PRICE_INTEGER_DIGITS = 10;
    public static final int PRICE_FRACTION_DIGITS = 2;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    /**
     * Stock keeping unit, unique across all products (e.g., "T-001").
     */
    @Column(name = "sku", nullable = false, length = 50)
    private String sku;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "description", length = 1000)
    private String description;

    /**
     * Price the product was bought at. Always greater than zero.
     */
    @Column(name = "purchase_price", nullable = false, precision = 12, scale = 2)
    private BigDecimal purchasePrice;

    /**
     * Price the product is sold at. Always greater than zero.
     */
    @Column(name = "sale_price", nullable = false, precision = 12, scale = 2)
    private BigDecimal salePrice;

    @Column(name = "quantity_on_hand", nullable = false)
    private Integer quantityOnHand;

    /**
     * Stock level at or below which the product should be reordered.
     */
    @Column(name = "reorder_level", nullable = false)
    private Integer reorderLevel;

    /**
     * Storage location, e.g. "Warehouse A, Shelf B2".
     */
    @Column(name = "location", length = 100)
    private String location;

    @Column(name = "image_url", length = 2048)
    private String imageUrl;

    /**
     * Plain data flag; it does not gate any validation or deletion rule.
     */
    @Column(name = "is_active", nullable = false)
    private Boolean isActive;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "category_id", foreignKey = @ForeignKey(name = "fk_products_category"))
    private Category category;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "supplier_id", foreignKey = @ForeignKey(name = "fk_products_supplier"))
    private Supplier supplier;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Id of the assigned category, or null when unassigned.
     */
    public Long getCategoryId() {
        return category != null ? category.getId() : null;
    }

    /**
     * Id of the assigned supplier, or null when unassigned.
     */
    public Long getSupplierId() {
        return supplier != null ? supplier.getId() : null;
    }

    /**
     * Set timestamps before the first insert if the caller has not.
     */
    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }
}
