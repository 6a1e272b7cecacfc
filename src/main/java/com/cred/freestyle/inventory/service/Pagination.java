package com.cred.freestyle.inventory.service;

import com.cred.freestyle.inventory.exception.ValidationFailedException;
import com.cred.freestyle.inventory.repository.OffsetLimitPageRequest;
import org.springframework.data.domain.Pageable;

/**
 * Turns {@code skip}/{@code limit} list arguments into an id-ordered {@link Pageable}.
 * No upper bound is applied to {@code limit}.
 */
final class Pagination {

    private Pagination() {
    }

    /**
     * Reject negative bounds before any storage access.
     */
    static void validate(String resourceType, int skip, int limit) {
        if (skip < 0) {
            throw new ValidationFailedException(resourceType, "skip", "must not be negative");
        }
        if (limit < 0) {
            throw new ValidationFailedException(resourceType, "limit", "must not be negative");
        }
    }

    /**
     * Callers must short-circuit {@code limit == 0} to an empty result first.
     */
    static Pageable of(int skip, int limit) {
        return OffsetLimitPageRequest.of(skip, limit);
    }
}
