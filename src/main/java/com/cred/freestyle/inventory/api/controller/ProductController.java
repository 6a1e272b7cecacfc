package com.cred.freestyle.inventory.api.controller;

import com.cred.freestyle.inventory.api.dto.ProductRequest;
import com.cred.freestyle.inventory.api.dto.ProductResponse;
import com.cred.freestyle.inventory.api.dto.ProductUpdateRequest;
import com.cred.freestyle.inventory.domain.model.Product;
import com.cred.freestyle.inventory.service.ProductFilter;
import com.cred.freestyle.inventory.service.ProductService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for product operations.
 * Errors raised by {@link ProductService} are rendered by the global exception handler.
 *
 * @author Inventory Team
 */
@RestController
@RequestMapping("/api/v1/products")
public class ProductController {

    private static final Logger logger = LoggerFactory.getLogger(ProductController.class);

    private final ProductService productService;

    public ProductController(ProductService productService) {
        this.productService = productService;
    }

    /**
     * Create a new product.
     *
     * @param request Product fields; SKU must be unique
     * @return Created product (201)
     */
    @PostMapping
    public ResponseEntity<ProductResponse> createProduct(@Valid @RequestBody ProductRequest request) {
        Product product = productService.createProduct(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ProductResponse.fromEntity(product));
    }

    /**
     * List products with optional filtering and pagination.
     *
     * @param skip Number of records to skip
     * @param limit Maximum number of records to return
     * @param name Case-insensitive partial name match
     * @param sku Exact SKU match
     * @param categoryId Category ID
     * @param supplierId Supplier ID
     * @return Matching products
     */
    @GetMapping
    public ResponseEntity<List<ProductResponse>> listProducts(
            @RequestParam(defaultValue = "0") int skip,
            @RequestParam(defaultValue = "${inventory.pagination.default-limit:100}") int limit,
            @RequestParam(required = false) String name,
            @RequestParam(required = false) String sku,
            @RequestParam(name = "category_id", required = false) Long categoryId,
            @RequestParam(name = "supplier_id", required = false) Long supplierId
    ) {
        ProductFilter filter = ProductFilter.builder()
                .name(name)
                .sku(sku)
                .categoryId(categoryId)
                .supplierId(supplierId)
                .build();

        List<ProductResponse> responses = productService.listProducts(filter, skip, limit).stream()
                .map(ProductResponse::fromEntity)
                .collect(Collectors.toList());

        logger.debug("Found {} products", responses.size());
        return ResponseEntity.ok(responses);
    }

    @GetMapping("/{productId}")
    public ResponseEntity<ProductResponse> getProduct(@PathVariable Long productId) {
        return ResponseEntity.ok(ProductResponse.fromEntity(productService.getProduct(productId)));
    }

    /**
     * Update a product. Only fields present in the body are changed.
     *
     * @param productId Product ID
     * @param request Partial product fields
     * @return Updated product
     */
    @PutMapping("/{productId}")
    public ResponseEntity<ProductResponse> updateProduct(
            @PathVariable Long productId,
            @Valid @RequestBody ProductUpdateRequest request
    ) {
        Product product = productService.updateProduct(productId, request);
        return ResponseEntity.ok(ProductResponse.fromEntity(product));
    }

    @DeleteMapping("/{productId}")
    public ResponseEntity<Void> deleteProduct(@PathVariable Long productId) {
        productService.deleteProduct(productId);
        return ResponseEntity.noContent().build();
    }
}
