package com.growfolio.common.model;

/*
 * 09/18/2026 - 10:43 AM
 * @author Growfolio Engineering
 */

import java.util.List;

/**
 * One page of a paginated API listing.
 */
public record Page<T>(List<T> data, Pagination pagination) {

    public Page {
        data = data != null ? List.copyOf(data) : List.of();
    }

    public boolean hasNextPage() {
        return pagination != null && pagination.page() < pagination.totalPages();
    }

    public record Pagination(int page, int limit, int totalPages, int totalItems) {
    }
}
