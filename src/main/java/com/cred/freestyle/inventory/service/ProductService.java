package com.cred.freestyle.inventory.service;

import com.cred.freestyle.inventory.api.dto.ProductRequest;
import com.cred.freestyle.inventory.api.dto.ProductUpdateRequest;
import com.cred.freestyle.inventory.domain.model.Category;
import com.cred.freestyle.inventory.domain.model.Product;
import com.cred.freestyle.inventory.domain.model.Supplier;
import com.cred.freestyle.inventory.exception.DuplicateResourceException;
import com.cred.freestyle.inventory.exception.ResourceNotFoundException;
import com.cred.freestyle.inventory.exception.ValidationFailedException;
import com.cred.freestyle.inventory.repository.ProductRepository;
import com.cred.freestyle.inventory.repository.ProductSpecifications;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Service for managing products.
 *
 * Every mutating operation validates in a fixed order and stops at the first failure:
 * 1. SKU uniqueness
 * 2. Category existence (when a category ID is given)
 * 3. Supplier existence (when a supplier ID is given)
 * 4. Persist
 *
 * Category and supplier lookups go through their services, read-only.
 *
 * @author Inventory Team
 */
@Service
@Validated
public class ProductService {

    static final String RESOURCE_TYPE = "Product";
    static final String SKU_CONSTRAINT = "uk_products_sku";
    static final String CATEGORY_FK = "fk_products_category";
    static final String SUPPLIER_FK = "fk_products_supplier";

    private static final Logger logger = LoggerFactory.getLogger(ProductService.class);

    private final ProductRepository productRepository;
    private final CategoryService categoryService;
    private final SupplierService supplierService;

    public ProductService(
            ProductRepository productRepository,
            CategoryService categoryService,
            SupplierService supplierService
    ) {
        this.productRepository = productRepository;
        this.categoryService = categoryService;
        this.supplierService = supplierService;
    }

    /**
     * Create a new product.
     * Omitted quantity on hand, reorder level and active flag get their defaults (0, 10, true).
     *
     * @param request Product fields
     * @return Persisted product with assigned ID and timestamps
     * @throws DuplicateResourceException if the SKU already exists
     * @throws ResourceNotFoundException if the referenced category or supplier does not exist
     */
    @Transactional
    public Product createProduct(@Valid ProductRequest request) {
        logger.info("Creating product with SKU: {}", request.getSku());

        // Step 1: SKU must be unique
        if (productRepository.existsBySku(request.getSku())) {
            throw new DuplicateResourceException(RESOURCE_TYPE, "sku", request.getSku());
        }

        // Step 2-3: Referenced category and supplier must exist
        Category category = request.getCategoryId() != null
                ? categoryService.getCategory(request.getCategoryId())
                : null;
        Supplier supplier = request.getSupplierId() != null
                ? supplierService.getSupplier(request.getSupplierId())
                : null;

        // Step 4: Persist with defaults for omitted fields
        Instant now = Instant.now();
        Product product = Product.builder()
                .sku(request.getSku())
                .name(request.getName())
                .description(request.getDescription())
                .purchasePrice(request.getPurchasePrice())
                .salePrice(request.getSalePrice())
                .quantityOnHand(request.getQuantityOnHand() != null
                        ? request.getQuantityOnHand()
                        : Product.DEFAULT_QUANTITY_ON_HAND)
                .reorderLevel(request.getReorderLevel() != null
                        ? request.getReorderLevel()
                        : Product.DEFAULT_REORDER_LEVEL)
                .location(request.getLocation())
                .imageUrl(request.getImageUrl())
                .isActive(request.getIsActive() != null ? request.getIsActive() : Boolean.TRUE)
                .category(category)
                .supplier(supplier)
                .createdAt(now)
                .updatedAt(now)
                .build();

        product = save(product);
        logger.info("Created product: {} with ID: {}", product.getSku(), product.getId());
        return product;
    }

    /**
     * List products matching all given filters, in insertion order.
     *
     * @param filter Optional filters; null fields are ignored
     * @param skip Number of matching products to skip
     * @param limit Maximum number of products to return
     * @return Page of matching products
     */
    @Transactional(readOnly = true)
    public List<Product> listProducts(ProductFilter filter, int skip, int limit) {
        Pagination.validate(RESOURCE_TYPE, skip, limit);
        if (limit == 0) {
            return Collections.emptyList();
        }

        ProductFilter criteria = filter != null ? filter : ProductFilter.none();
        logger.debug("Listing products, filter: {}, skip: {}, limit: {}", criteria, skip, limit);

        Specification<Product> spec = Specification
                .where(ProductSpecifications.nameContains(criteria.getName()))
                .and(ProductSpecifications.skuEquals(criteria.getSku()))
                .and(ProductSpecifications.categoryIdEquals(criteria.getCategoryId()))
                .and(ProductSpecifications.supplierIdEquals(criteria.getSupplierId()));

        return productRepository.findAll(spec, Pagination.of(skip, limit)).getContent();
    }

    /**
     * Find product by ID.
     *
     * @param productId Product ID
     * @return Product
     * @throws ResourceNotFoundException if no product has that ID
     */
    @Transactional(readOnly = true)
    public Product getProduct(Long productId) {
        return findProduct(productId);
    }

    /**
     * Apply the fields present in the request to an existing product.
     * A present {@code null} category or supplier ID clears the association.
     * {@code createdAt} is never touched; {@code updatedAt} is always refreshed.
     *
     * @param productId Product ID
     * @param request Partial product fields
     * @return Updated product
     */
    @Transactional
    public Product updateProduct(Long productId, @Valid ProductUpdateRequest request) {
        rejectNullRequiredFields(request);

        Product product = findProduct(productId);
        logger.info("Updating product: {} ({})", productId, product.getSku());

        // Step 1: A changed SKU must still be unique
        if (request.hasSku() && !request.getSku().equals(product.getSku())
                && productRepository.existsBySku(request.getSku())) {
            throw new DuplicateResourceException(RESOURCE_TYPE, "sku", request.getSku());
        }

        // Step 2-3: Re-resolve associations that are present in the request
        Category category = product.getCategory();
        if (request.hasCategoryId()) {
            category = request.getCategoryId() != null
                    ? categoryService.getCategory(request.getCategoryId())
                    : null;
        }
        Supplier supplier = product.getSupplier();
        if (request.hasSupplierId()) {
            supplier = request.getSupplierId() != null
                    ? supplierService.getSupplier(request.getSupplierId())
                    : null;
        }

        // Step 4: Apply present fields
        if (request.hasSku()) {
            product.setSku(request.getSku());
        }
        if (request.hasName()) {
            product.setName(request.getName());
        }
        if (request.hasDescription()) {
            product.setDescription(request.getDescription());
        }
        if (request.hasPurchasePrice()) {
            product.setPurchasePrice(request.getPurchasePrice());
        }
        if (request.hasSalePrice()) {
            product.setSalePrice(request.getSalePrice());
        }
        if (request.hasQuantityOnHand()) {
            product.setQuantityOnHand(request.getQuantityOnHand());
        }
        if (request.hasReorderLevel()) {
            product.setReorderLevel(request.getReorderLevel());
        }
        if (request.hasLocation()) {
            product.setLocation(request.getLocation());
        }
        if (request.hasImageUrl()) {
            product.setImageUrl(request.getImageUrl());
        }
        if (request.hasIsActive()) {
            product.setIsActive(request.getIsActive());
        }
        product.setCategory(category);
        product.setSupplier(supplier);
        product.setUpdatedAt(Instant.now());

        product = save(product);
        logger.info("Updated product: {}", productId);
        return product;
    }

    /**
     * Delete a product. Products have no dependents, so this is unconditional.
     *
     * @param productId Product ID
     * @throws ResourceNotFoundException if no product has that ID
     */
    @Transactional
    public void deleteProduct(Long productId) {
        Product product = findProduct(productId);
        productRepository.delete(product);
        logger.info("Deleted product: {} ({})", productId, product.getSku());
    }

    private Product findProduct(Long productId) {
        return productRepository.findById(productId)
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE_TYPE, productId));
    }

    /**
     * Translate constraint violations raised at flush time (concurrent writers) into
     * the same outcome as the pre-checks.
     */
    private Product save(Product product) {
        try {
            return productRepository.saveAndFlush(product);
        } catch (DataIntegrityViolationException e) {
            if (ConstraintViolations.violates(e, SKU_CONSTRAINT)) {
                throw new DuplicateResourceException(RESOURCE_TYPE, "sku", product.getSku(), e);
            }
            if (ConstraintViolations.violates(e, CATEGORY_FK)) {
                throw new ResourceNotFoundException(CategoryService.RESOURCE_TYPE, product.getCategoryId());
            }
            if (ConstraintViolations.violates(e, SUPPLIER_FK)) {
                throw new ResourceNotFoundException(SupplierService.RESOURCE_TYPE, product.getSupplierId());
            }
            throw e;
        }
    }

    private static void rejectNullRequiredFields(ProductUpdateRequest request) {
        if (request.hasSku() && request.getSku() == null) {
            throw nullField("sku");
        }
        if (request.hasName() && request.getName() == null) {
            throw nullField("name");
        }
        if (request.hasPurchasePrice() && request.getPurchasePrice() == null) {
            throw nullField("purchase_price");
        }
        if (request.hasSalePrice() && request.getSalePrice() == null) {
            throw nullField("sale_price");
        }
        if (request.hasQuantityOnHand() && request.getQuantityOnHand() == null) {
            throw nullField("quantity_on_hand");
        }
        if (request.hasReorderLevel() && request.getReorderLevel() == null) {
            throw nullField("reorder_level");
        }
        if (request.hasIsActive() && request.getIsActive() == null) {
            throw nullField("is_active");
        }
    }

    private static ValidationFailedException nullField(String field) {
        return new ValidationFailedException(RESOURCE_TYPE, field, "must not be null");
    }
}
