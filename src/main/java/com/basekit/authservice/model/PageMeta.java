package com.basekit.authservice.model;

import org.springframework.data.domain.Page;

/** Pagination block of a list envelope. {@code page} is reported 1-based. */
public record PageMeta(int page, int size, long totalItems, int totalPages) {

    public static PageMeta of(Page<?> page) {
        return new PageMeta(page.getNumber() + 1, page.getSize(), page.getTotalElements(), page.getTotalPages());
    }
}
