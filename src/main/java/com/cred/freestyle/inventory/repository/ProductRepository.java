package com.cred.freestyle.inventory.repository;

import com.cred.freestyle.inventory.domain.model.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for Product entity.
 * Filtered listing goes through {@link JpaSpecificationExecutor} with
 * {@link ProductSpecifications}.
 *
 * @author Inventory Team
 */
@Repository
public interface ProductRepository extends JpaRepository<Product, Long>, JpaSpecificationExecutor<Product> {

    /**
     * Find product by SKU (exact match).
     *
     * @param sku Product SKU
     * @return Optional containing the product if found
     */
    Optional<Product> findBySku(String sku);

    boolean existsBySku(String sku);

    /**
     * Count products assigned to a category.
     * Used to guard category deletion.
     *
     * @param categoryId Category ID
     * @return Number of referencing products
     */
    @Query("SELECT COUNT(p) FROM Product p WHERE p.category.id = :categoryId")
    long countByCategoryId(@Param("categoryId") Long categoryId);

    /**
     * Count products sourced from a supplier.
     * Used to guard supplier deletion.
     *
     * @param supplierId Supplier ID
     * @return Number of referencing products
     */
    @Query("SELECT COUNT(p) FROM Product p WHERE p.supplier.id = :supplierId")
    long countBySupplierId(@Param("supplierId") Long supplierId);
}
