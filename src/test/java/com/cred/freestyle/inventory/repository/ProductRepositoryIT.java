package com.cred.freestyle.inventory.repository;

import com.cred.freestyle.inventory.domain.model.Category;
import com.cred.freestyle.inventory.domain.model.Product;
import com.cred.freestyle.inventory.domain.model.Supplier;
import com.cred.freestyle.inventory.testutil.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for ProductRepository using Testcontainers.
 * Tests filtering, paging, reference counts and the named constraints against a real PostgreSQL database.
 */
@DataJpaTest
@Testcontainers
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@DisplayName("ProductRepository Integration Tests")
class ProductRepositoryIT {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("inventory_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private CategoryRepository categoryRepository;

    @Autowired
    private SupplierRepository supplierRepository;

    private Category tools;
    private Supplier acme;

    @BeforeEach
    void setUp() {
        productRepository.deleteAll();
        categoryRepository.deleteAll();
        supplierRepository.deleteAll();

        tools = categoryRepository.save(TestDataBuilder.category().name("Tools").build());
        acme = supplierRepository.save(TestDataBuilder.supplier().build());

        productRepository.save(TestDataBuilder.product().sku("HAM-001").name("Claw Hammer")
                .category(tools).supplier(acme).build());
        productRepository.save(TestDataBuilder.product().sku("HAM-002").name("Sledge Hammer")
                .category(tools).build());
        productRepository.save(TestDataBuilder.product().sku("TAPE-50%").name("Tape 50% off").build());
    }

    // ========================================
    // Count queries
    // ========================================

    @Test
    @DisplayName("countByCategoryId / countBySupplierId - Count referencing products")
    void countReferences() {
        assertThat(productRepository.countByCategoryId(tools.getId())).isEqualTo(2);
        assertThat(productRepository.countBySupplierId(acme.getId())).isEqualTo(1);
        assertThat(productRepository.countByCategoryId(-1L)).isZero();
    }

    // ========================================
    // Specification filtering
    // ========================================

    @Test
    @DisplayName("nameContains - Case-insensitive substring match")
    void nameContains() {
        List<Product> result = productRepository.findAll(
                Specification.where(ProductSpecifications.nameContains("HAMMER")),
                OffsetLimitPageRequest.of(0, 10)).getContent();

        assertThat(result).extracting(Product::getSku).containsExactly("HAM-001", "HAM-002");
    }

    @Test
    @DisplayName("nameContains - LIKE wildcards in the search text match literally")
    void nameContains_EscapesWildcards() {
        List<Product> result = productRepository.findAll(
                Specification.where(ProductSpecifications.nameContains("50%")),
                OffsetLimitPageRequest.of(0, 10)).getContent();

        assertThat(result).extracting(Product::getSku).containsExactly("TAPE-50%");
    }

    @Test
    @DisplayName("Combined filters - All present filters must match")
    void combinedFilters() {
        Specification<Product> spec = Specification
                .where(ProductSpecifications.categoryIdEquals(tools.getId()))
                .and(ProductSpecifications.supplierIdEquals(acme.getId()));

        List<Product> result = productRepository.findAll(spec, OffsetLimitPageRequest.of(0, 10)).getContent();

        assertThat(result).extracting(Product::getSku).containsExactly("HAM-001");
    }

    @Test
    @DisplayName("OffsetLimitPageRequest - Offset need not be a multiple of the limit")
    void offsetPaging() {
        List<Product> result = productRepository.findAll(OffsetLimitPageRequest.of(1, 2)).getContent();

        assertThat(result).extracting(Product::getSku).containsExactly("HAM-002", "TAPE-50%");
    }

    // ========================================
    // Constraints
    // ========================================

    @Test
    @DisplayName("uk_products_sku - Duplicate SKU is rejected by the database")
    void duplicateSkuRejected() {
        assertThatThrownBy(() -> productRepository.saveAndFlush(
                TestDataBuilder.product().sku("HAM-001").build()))
                .isInstanceOf(DataIntegrityViolationException.class)
                .hasMessageContaining("uk_products_sku");
    }
}
