package com.cred.freestyle.inventory.api;

import com.cred.freestyle.inventory.repository.CategoryRepository;
import com.cred.freestyle.inventory.repository.ProductRepository;
import com.cred.freestyle.inventory.repository.SupplierRepository;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Full-stack API integration tests against an in-memory H2 database.
 * Covers the integrity rules end to end: uniqueness, reference checks and guarded deletes.
 * Every request commits on its own, so failed writes are checked against committed state.
 */
@SpringBootTest(properties = {
    "spring.datasource.url=jdbc:h2:mem:inventorydb;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1",
    "spring.datasource.driver-class-name=org.h2.Driver",
    "spring.jpa.hibernate.ddl-auto=create-drop",
    "spring.jpa.show-sql=false"
})
@AutoConfigureMockMvc
@DisplayName("Inventory API Integration Tests")
class InventoryApiIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private CategoryRepository categoryRepository;

    @Autowired
    private SupplierRepository supplierRepository;

    @BeforeEach
    void setUp() {
        // Clean up
        productRepository.deleteAll();
        categoryRepository.deleteAll();
        supplierRepository.deleteAll();
    }

    private long create(String path, String json) throws Exception {
        MvcResult result = mockMvc.perform(post(path)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json))
                .andExpect(status().isCreated())
                .andReturn();
        Number id = JsonPath.read(result.getResponse().getContentAsString(), "$.id");
        return id.longValue();
    }

    private static String productJson(String sku, String name, Long categoryId) {
        return "{\"sku\": \"" + sku + "\", \"name\": \"" + name + "\", "
                + "\"purchase_price\": 5.00, \"sale_price\": 9.99"
                + (categoryId != null ? ", \"category_id\": " + categoryId : "")
                + "}";
    }

    // ========================================
    // Category lifecycle
    // ========================================

    @Test
    @DisplayName("Category with products cannot be deleted until the products are gone")
    void categoryDeleteGuard_ToolsAndHammer() throws Exception {
        // Given
        long toolsId = create("/api/v1/categories", "{\"name\": \"Tools\"}");
        long hammerId = create("/api/v1/products", productJson("HAM-001", "Hammer", toolsId));

        // When / Then
        mockMvc.perform(delete("/api/v1/categories/{id}", toolsId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value(
                        "Cannot delete category 'Tools' as it has associated products. "
                                + "Please reassign or delete them first."));

        mockMvc.perform(delete("/api/v1/products/{id}", hammerId))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/v1/categories/{id}", toolsId))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/v1/categories/{id}", toolsId))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Category names are unique across create and update")
    void categoryNameUniqueness() throws Exception {
        create("/api/v1/categories", "{\"name\": \"Tools\"}");
        long gardenId = create("/api/v1/categories", "{\"name\": \"Garden\"}");

        mockMvc.perform(post("/api/v1/categories")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Tools\"}"))
                .andExpect(status().isConflict());

        mockMvc.perform(put("/api/v1/categories/{id}", gardenId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Tools\"}"))
                .andExpect(status().isConflict());

        // Renaming to its own name is allowed
        mockMvc.perform(put("/api/v1/categories/{id}", gardenId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Garden\", \"description\": \"Outdoor\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.description").value("Outdoor"));

        assertThat(categoryRepository.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("Category listing pages by skip and limit in creation order")
    void categoryPagination() throws Exception {
        create("/api/v1/categories", "{\"name\": \"Alpha\"}");
        create("/api/v1/categories", "{\"name\": \"Beta\"}");
        create("/api/v1/categories", "{\"name\": \"Gamma\"}");

        mockMvc.perform(get("/api/v1/categories").param("skip", "1").param("limit", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].name").value("Beta"));

        mockMvc.perform(get("/api/v1/categories").param("skip", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));

        mockMvc.perform(get("/api/v1/categories").param("limit", "-1"))
                .andExpect(status().isBadRequest());
    }

    // ========================================
    // Supplier lifecycle
    // ========================================

    @Test
    @DisplayName("Supplier email is unique only among suppliers that have one")
    void supplierEmailUniqueness() throws Exception {
        create("/api/v1/suppliers", "{\"name\": \"Acme\", \"email\": \"sales@acme.example\"}");
        create("/api/v1/suppliers", "{\"name\": \"No Mail One\"}");
        create("/api/v1/suppliers", "{\"name\": \"No Mail Two\"}");

        mockMvc.perform(post("/api/v1/suppliers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Copycat\", \"email\": \"sales@acme.example\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.details.field").value("email"));

        assertThat(supplierRepository.count()).isEqualTo(3);
    }

    @Test
    @DisplayName("Supplier referenced by a product cannot be deleted until the product is gone")
    void supplierDeleteGuard() throws Exception {
        long supplierId = create("/api/v1/suppliers", "{\"name\": \"Acme\"}");
        long sawId = create("/api/v1/products", "{\"sku\": \"SAW-001\", \"name\": \"Saw\", "
                + "\"purchase_price\": 7, \"sale_price\": 15, \"supplier_id\": " + supplierId + "}");

        mockMvc.perform(delete("/api/v1/suppliers/{id}", supplierId))
                .andExpect(status().isConflict());
        assertThat(supplierRepository.existsById(supplierId)).isTrue();

        mockMvc.perform(delete("/api/v1/products/{id}", sawId))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/v1/suppliers/{id}", supplierId))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/v1/suppliers/{id}", supplierId))
                .andExpect(status().isNotFound());
        mockMvc.perform(delete("/api/v1/suppliers/{id}", supplierId))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Whitespace-only name is rejected on update as on create")
    void blankNameOnUpdate() throws Exception {
        long toolsId = create("/api/v1/categories", "{\"name\": \"Tools\"}");
        long supplierId = create("/api/v1/suppliers", "{\"name\": \"Acme\"}");

        mockMvc.perform(put("/api/v1/categories/{id}", toolsId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"   \"}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(put("/api/v1/suppliers/{id}", supplierId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"   \"}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/v1/categories/{id}", toolsId))
                .andExpect(jsonPath("$.name").value("Tools"));
        mockMvc.perform(get("/api/v1/suppliers/{id}", supplierId))
                .andExpect(jsonPath("$.name").value("Acme"));
    }

    // ========================================
    // Product lifecycle
    // ========================================

    @Test
    @DisplayName("Created product reads back with defaults and nested category")
    void productCreateAndGet() throws Exception {
        long toolsId = create("/api/v1/categories", "{\"name\": \"Tools\"}");
        long hammerId = create("/api/v1/products", productJson("HAM-001", "Hammer", toolsId));

        mockMvc.perform(get("/api/v1/products/{id}", hammerId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sku").value("HAM-001"))
                .andExpect(jsonPath("$.quantity_on_hand").value(0))
                .andExpect(jsonPath("$.reorder_level").value(10))
                .andExpect(jsonPath("$.is_active").value(true))
                .andExpect(jsonPath("$.sale_price").value(9.99))
                .andExpect(jsonPath("$.category_id").value((int) toolsId))
                .andExpect(jsonPath("$.category.name").value("Tools"))
                .andExpect(jsonPath("$.created_at").exists());
    }

    @Test
    @DisplayName("Product create with unknown category fails and writes nothing")
    void productCreateUnknownCategory() throws Exception {
        mockMvc.perform(post("/api/v1/products")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(productJson("HAM-001", "Hammer", 999L)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Category with ID 999 not found"));

        assertThat(productRepository.count()).isZero();
    }

    @Test
    @DisplayName("Prices that do not fit two decimal places or ten integer digits are rejected, not rounded")
    void productPriceScale() throws Exception {
        mockMvc.perform(post("/api/v1/products")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sku\": \"HAM-001\", \"name\": \"Hammer\", "
                                + "\"purchase_price\": 0.001, \"sale_price\": 0.004}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/v1/products")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sku\": \"HAM-002\", \"name\": \"Hammer\", "
                                + "\"purchase_price\": 1e12, \"sale_price\": 9.99}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"));

        assertThat(productRepository.count()).isZero();

        long hammerId = create("/api/v1/products", productJson("HAM-003", "Hammer", null));
        mockMvc.perform(put("/api/v1/products/{id}", hammerId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sale_price\": 0.001}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/v1/products/{id}", hammerId))
                .andExpect(jsonPath("$.sale_price").value(9.99));
    }

    @Test
    @DisplayName("Product SKU is unique across create and update")
    void productSkuUniqueness() throws Exception {
        create("/api/v1/products", productJson("HAM-001", "Hammer", null));
        long sawId = create("/api/v1/products", productJson("SAW-001", "Saw", null));

        mockMvc.perform(post("/api/v1/products")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(productJson("HAM-001", "Other Hammer", null)))
                .andExpect(status().isConflict());

        mockMvc.perform(put("/api/v1/products/{id}", sawId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sku\": \"HAM-001\"}"))
                .andExpect(status().isConflict());

        assertThat(productRepository.findBySku("SAW-001")).isPresent();
        assertThat(productRepository.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("Description-only update leaves every other field unchanged")
    void productDescriptionOnlyUpdate() throws Exception {
        long toolsId = create("/api/v1/categories", "{\"name\": \"Tools\"}");
        long hammerId = create("/api/v1/products", productJson("HAM-001", "Hammer", toolsId));

        mockMvc.perform(put("/api/v1/products/{id}", hammerId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\": \"Heavier\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.description").value("Heavier"))
                .andExpect(jsonPath("$.sku").value("HAM-001"))
                .andExpect(jsonPath("$.name").value("Hammer"))
                .andExpect(jsonPath("$.purchase_price").value(5.0))
                .andExpect(jsonPath("$.category_id").value((int) toolsId));
    }

    @Test
    @DisplayName("Product listing filters by name, SKU, category and supplier")
    void productFilters() throws Exception {
        long toolsId = create("/api/v1/categories", "{\"name\": \"Tools\"}");
        create("/api/v1/products", productJson("HAM-001", "Claw Hammer", toolsId));
        long acmeId = create("/api/v1/suppliers", "{\"name\": \"Acme\"}");
        create("/api/v1/products", "{\"sku\": \"HAM-002\", \"name\": \"Sledge HAMMER\", "
                + "\"purchase_price\": 5.00, \"sale_price\": 9.99, \"supplier_id\": " + acmeId + "}");
        create("/api/v1/products", productJson("SAW-001", "Saw", toolsId));

        mockMvc.perform(get("/api/v1/products").param("name", "hammer"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)));

        mockMvc.perform(get("/api/v1/products").param("category_id", String.valueOf(toolsId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].sku", contains("HAM-001", "SAW-001")));

        mockMvc.perform(get("/api/v1/products")
                        .param("name", "hammer")
                        .param("category_id", String.valueOf(toolsId)))
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].sku").value("HAM-001"));

        mockMvc.perform(get("/api/v1/products").param("sku", "SAW-001"))
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].name").value("Saw"));

        mockMvc.perform(get("/api/v1/products").param("supplier_id", String.valueOf(acmeId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].sku").value("HAM-002"));

        mockMvc.perform(get("/api/v1/products")
                        .param("supplier_id", String.valueOf(acmeId))
                        .param("category_id", String.valueOf(toolsId)))
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    @DisplayName("Product update can clear its category")
    void productClearCategory() throws Exception {
        long toolsId = create("/api/v1/categories", "{\"name\": \"Tools\"}");
        long hammerId = create("/api/v1/products", productJson("HAM-001", "Hammer", toolsId));

        mockMvc.perform(put("/api/v1/products/{id}", hammerId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"category_id\": null}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.category_id").value(nullValue()))
                .andExpect(jsonPath("$.category").value(nullValue()));

        mockMvc.perform(delete("/api/v1/categories/{id}", toolsId))
                .andExpect(status().isNoContent());
    }
}
