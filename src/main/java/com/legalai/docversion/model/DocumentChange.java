package com.legalai.docversion.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single sentence-level change, embedded in its owning comparison.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentChange {

    private String id;
    private ChangeType type;
    private String originalText;    // DELETION and MODIFICATION only
    private String newText;         // ADDITION and MODIFICATION only
    private TextLocation location;
    private Severity severity;
    private String description;
}
