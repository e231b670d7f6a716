package com.legalai.docversion.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Paging and projection options for a version history request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VersionHistoryOptions {

    public static final int MAX_LIMIT = 50;

    @Builder.Default
    private int limit = 10;

    @Builder.Default
    private int offset = 0;

    @Builder.Default
    private boolean includeAnalysis = false;

    public static VersionHistoryOptions defaults() {
        return VersionHistoryOptions.builder().build();
    }

    public void validate() {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT + ", was " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative, was " + offset);
        }
    }
}
