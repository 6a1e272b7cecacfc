package com.cred.freestyle.inventory.api.controller;

import com.cred.freestyle.inventory.api.dto.SupplierRequest;
import com.cred.freestyle.inventory.api.dto.SupplierResponse;
import com.cred.freestyle.inventory.api.dto.SupplierUpdateRequest;
import com.cred.freestyle.inventory.domain.model.Supplier;
import com.cred.freestyle.inventory.service.SupplierService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for supplier operations.
 *
 * @author Inventory Team
 */
@RestController
@RequestMapping("/api/v1/suppliers")
public class SupplierController {

    private static final Logger logger = LoggerFactory.getLogger(SupplierController.class);

    private final SupplierService supplierService;

    public SupplierController(SupplierService supplierService) {
        this.supplierService = supplierService;
    }

    @PostMapping
    public ResponseEntity<SupplierResponse> createSupplier(@Valid @RequestBody SupplierRequest request) {
        Supplier supplier = supplierService.createSupplier(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(SupplierResponse.fromEntity(supplier));
    }

    @GetMapping
    public ResponseEntity<List<SupplierResponse>> listSuppliers(
            @RequestParam(defaultValue = "0") int skip,
            @RequestParam(defaultValue = "${inventory.pagination.default-limit:100}") int limit
    ) {
        List<SupplierResponse> responses = supplierService.listSuppliers(skip, limit).stream()
                .map(SupplierResponse::fromEntity)
                .collect(Collectors.toList());

        logger.debug("Found {} suppliers", responses.size());
        return ResponseEntity.ok(responses);
    }

    @GetMapping("/{supplierId}")
    public ResponseEntity<SupplierResponse> getSupplier(@PathVariable Long supplierId) {
        return ResponseEntity.ok(SupplierResponse.fromEntity(supplierService.getSupplier(supplierId)));
    }

    @PutMapping("/{supplierId}")
    public ResponseEntity<SupplierResponse> updateSupplier(
            @PathVariable Long supplierId,
            @Valid @RequestBody SupplierUpdateRequest request
    ) {
        Supplier supplier = supplierService.updateSupplier(supplierId, request);
        return ResponseEntity.ok(SupplierResponse.fromEntity(supplier));
    }

    /**
     * Delete a supplier. Fails with 409 while products still reference it.
     */
    @DeleteMapping("/{supplierId}")
    public ResponseEntity<Void> deleteSupplier(@PathVariable Long supplierId) {
        supplierService.deleteSupplier(supplierId);
        return ResponseEntity.noContent().build();
    }
}
