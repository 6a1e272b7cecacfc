package com.cred.freestyle.inventory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the Inventory API.
 *
 * System Overview:
 * - CRUD over Products, Categories and Suppliers under /api/v1
 * - SKU, category name and supplier email are unique
 * - Products may reference a category and a supplier that must exist
 * - Categories and suppliers cannot be deleted while products reference them
 * - Partial updates change only the fields present in the request body
 *
 * Architecture:
 * - API Layer: REST controllers with request validation and a global exception handler
 * - Service Layer: Integrity rules, checked in a fixed order before anything is written
 * - Data Access Layer: Spring Data JPA repositories with specification-based filtering
 *
 * @author Inventory Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
public class InventoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(InventoryApplication.class, args);
    }
}
