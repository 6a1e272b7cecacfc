package com.cred.freestyle.inventory.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Supplier entity representing where products are sourced from.
 *
 * @author Inventory Team
 */
@Entity
@Table(name = "suppliers", uniqueConstraints = {
    @UniqueConstraint(name = "uk_suppliers_email", columnNames = "email")
}, indexes = {
    @Index(name = "idx_suppliers_name", columnList = "name")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Supplier {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "name", nullable = false, length = 150)
    private String name;

    @Column(name = "contact_person", length = 100)
    private String contactPerson;

    /**
     * Optional contact email. Unique when present; several suppliers may have none.
     */
    @Column(name = "email")
    private String email;

    @Column(name = "phone_number", length = 20)
    private String phoneNumber;

    @Column(name = "address", length = 255)
    private String address;
}
