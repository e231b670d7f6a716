package com.legalai.docversion.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A high-severity change that matched one of the legal categories.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignificantChange {
    private String changeId;
    private ChangeCategory category;
    private Impact impact;
    private String description;
    private String recommendation;
}
