package com.cred.freestyle.inventory.service;

import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.Locale;

/**
 * Identifies which named database constraint a {@link DataIntegrityViolationException} came from.
 * Constraint names are matched case-insensitively since databases differ in how they report them.
 */
final class ConstraintViolations {

    private ConstraintViolations() {
    }

    static boolean violates(DataIntegrityViolationException ex, String constraintName) {
        String expected = constraintName.toLowerCase(Locale.ROOT);

        Throwable cause = ex.getCause();
        if (cause instanceof ConstraintViolationException) {
            String reported = ((ConstraintViolationException) cause).getConstraintName();
            if (reported != null && reported.toLowerCase(Locale.ROOT).contains(expected)) {
                return true;
            }
        }

        String message = ex.getMostSpecificCause().getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains(expected);
    }
}
