package com.cred.freestyle.inventory.service;

import com.cred.freestyle.inventory.api.dto.SupplierRequest;
import com.cred.freestyle.inventory.api.dto.SupplierUpdateRequest;
import com.cred.freestyle.inventory.domain.model.Supplier;
import com.cred.freestyle.inventory.exception.DuplicateResourceException;
import com.cred.freestyle.inventory.exception.ResourceInUseException;
import com.cred.freestyle.inventory.exception.ResourceNotFoundException;
import com.cred.freestyle.inventory.exception.ValidationFailedException;
import com.cred.freestyle.inventory.repository.ProductRepository;
import com.cred.freestyle.inventory.repository.SupplierRepository;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.util.Collections;
import java.util.List;

/**
 * Service for managing suppliers.
 * Email is unique only when present; suppliers without an email never collide.
 * A supplier that products still reference cannot be deleted.
 *
 * @author Inventory Team
 */
@Service
@Validated
public class SupplierService {

    static final String RESOURCE_TYPE = "Supplier";
    static final String EMAIL_CONSTRAINT = "uk_suppliers_email";

    private static final Logger logger = LoggerFactory.getLogger(SupplierService.class);

    private final SupplierRepository supplierRepository;
    private final ProductRepository productRepository;

    public SupplierService(SupplierRepository supplierRepository, ProductRepository productRepository) {
        this.supplierRepository = supplierRepository;
        this.productRepository = productRepository;
    }

    /**
     * Create a new supplier.
     *
     * @param request Supplier fields
     * @return Persisted supplier with its assigned ID
     * @throws DuplicateResourceException if the email is already used by another supplier
     */
    @Transactional
    public Supplier createSupplier(@Valid SupplierRequest request) {
        logger.info("Creating supplier: {}", request.getName());

        String email = normalizeEmail(request.getEmail());
        if (email != null && supplierRepository.existsByEmail(email)) {
            throw new DuplicateResourceException(RESOURCE_TYPE, "email", email);
        }

        Supplier supplier = Supplier.builder()
                .name(request.getName())
                .contactPerson(request.getContactPerson())
                .email(email)
                .phoneNumber(request.getPhoneNumber())
                .address(request.getAddress())
                .build();

        supplier = save(supplier);
        logger.info("Created supplier: {} with ID: {}", supplier.getName(), supplier.getId());
        return supplier;
    }

    @Transactional(readOnly = true)
    public List<Supplier> listSuppliers(int skip, int limit) {
        Pagination.validate(RESOURCE_TYPE, skip, limit);
        if (limit == 0) {
            return Collections.emptyList();
        }

        logger.debug("Listing suppliers, skip: {}, limit: {}", skip, limit);
        return supplierRepository.findAll(Pagination.of(skip, limit)).getContent();
    }

    /**
     * Find supplier by ID.
     *
     * @param supplierId Supplier ID
     * @return Supplier
     * @throws ResourceNotFoundException if no supplier has that ID
     */
    @Transactional(readOnly = true)
    public Supplier getSupplier(Long supplierId) {
        return supplierRepository.findById(supplierId)
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE_TYPE, supplierId));
    }

    /**
     * Apply the fields present in the request to an existing supplier.
     * The email is re-checked only when the new value is non-empty and differs from the stored one.
     *
     * @param supplierId Supplier ID
     * @param request Partial supplier fields
     * @return Updated supplier
     */
    @Transactional
    public Supplier updateSupplier(Long supplierId, @Valid SupplierUpdateRequest request) {
        if (request.hasName() && request.getName() == null) {
            throw new ValidationFailedException(RESOURCE_TYPE, "name", "must not be null");
        }

        Supplier supplier = getSupplier(supplierId);

        String email = normalizeEmail(request.getEmail());
        if (request.hasEmail() && email != null && !email.equals(supplier.getEmail())
                && supplierRepository.existsByEmail(email)) {
            throw new DuplicateResourceException(RESOURCE_TYPE, "email", email);
        }

        if (request.hasName()) {
            supplier.setName(request.getName());
        }
        if (request.hasContactPerson()) {
            supplier.setContactPerson(request.getContactPerson());
        }
        if (request.hasEmail()) {
            supplier.setEmail(email);
        }
        if (request.hasPhoneNumber()) {
            supplier.setPhoneNumber(request.getPhoneNumber());
        }
        if (request.hasAddress()) {
            supplier.setAddress(request.getAddress());
        }

        supplier = save(supplier);
        logger.info("Updated supplier: {}", supplierId);
        return supplier;
    }

    /**
     * Delete a supplier that no product references.
     *
     * @param supplierId Supplier ID
     * @throws ResourceInUseException if any product references the supplier
     */
    @Transactional
    public void deleteSupplier(Long supplierId) {
        Supplier supplier = getSupplier(supplierId);

        long productCount = productRepository.countBySupplierId(supplierId);
        if (productCount > 0) {
            throw new ResourceInUseException(RESOURCE_TYPE, supplierId, supplier.getName(), productCount);
        }

        try {
            supplierRepository.delete(supplier);
            supplierRepository.flush();
        } catch (DataIntegrityViolationException e) {
            // A product was assigned concurrently
            throw new ResourceInUseException(RESOURCE_TYPE, supplierId, supplier.getName(), 1);
        }
        logger.info("Deleted supplier: {} ({})", supplierId, supplier.getName());
    }

    private Supplier save(Supplier supplier) {
        try {
            return supplierRepository.saveAndFlush(supplier);
        } catch (DataIntegrityViolationException e) {
            if (ConstraintViolations.violates(e, EMAIL_CONSTRAINT)) {
                throw new DuplicateResourceException(RESOURCE_TYPE, "email", supplier.getEmail(), e);
            }
            throw e;
        }
    }

    /**
     * Blank emails are stored as null so they never take part in the uniqueness rule.
     */
    private static String normalizeEmail(String email) {
        return StringUtils.hasText(email) ? email : null;
    }
}
