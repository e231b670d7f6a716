package com.legalai.docversion.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Text-extraction output attached to a version.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class VersionMetadata {
    private int pageCount;
    private int wordCount;
    private String language;
    private String extractedText;
}
