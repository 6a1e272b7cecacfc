package com.cred.freestyle.inventory.repository;

import com.cred.freestyle.inventory.domain.model.Supplier;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository interface for Supplier entity.
 *
 * @author Inventory Team
 */
@Repository
public interface SupplierRepository extends JpaRepository<Supplier, Long> {

    boolean existsByEmail(String email);
}
