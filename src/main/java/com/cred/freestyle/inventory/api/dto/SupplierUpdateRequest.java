package com.cred.freestyle.inventory.api.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.HashSet;
import java.util.Set;

/**
 * Request DTO for a partial supplier update.
 * Setters mark their field as present; see {@link CategoryUpdateRequest}.
 *
 * @author Inventory Team
 */
public class SupplierUpdateRequest {

    private final Set<String> presentFields = new HashSet<>();

    @Pattern(regexp = CategoryUpdateRequest.NOT_BLANK, message = "Supplier name must not be blank")
    @Size(min = 2, max = 150, message = "Supplier name must be between 2 and 150 characters")
    private String name;

    @Size(max = 100, message = "Contact person must be at most 100 characters")
    private String contactPerson;

    @Pattern(regexp = SupplierRequest.EMAIL_PATTERN, message = "Please provide a valid email address")
    private String email;

    @Size(max = 20, message = "Phone number must be at most 20 characters")
    private String phoneNumber;

    @Size(max = 255, message = "Address must be at most 255 characters")
    private String address;

    public boolean hasName() {
        return presentFields.contains("name");
    }

    public boolean hasContactPerson() {
        return presentFields.contains("contactPerson");
    }

    public boolean hasEmail() {
        return presentFields.contains("email");
    }

    public boolean hasPhoneNumber() {
        return presentFields.contains("phoneNumber");
    }

    public boolean hasAddress() {
        return presentFields.contains("address");
    }

    // Getters and setters
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
        presentFields.add("name");
    }

    public String getContactPerson() {
        return contactPerson;
    }

    public void setContactPerson(String contactPerson) {
        this.contactPerson = contactPerson;
        presentFields.add("contactPerson");
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
        presentFields.add("email");
    }

    public String getPhoneNumber() {
        return phoneNumber;
    }

    public void setPhoneNumber(String phoneNumber) {
        this.phoneNumber = phoneNumber;
        presentFields.add("phoneNumber");
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
        presentFields.add("address");
    }
}
