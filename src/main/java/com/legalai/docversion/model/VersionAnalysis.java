package com.legalai.docversion.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Analysis produced by the external analysis service. Only the risk score is
 * read here; every other field is carried through untouched in {@code details}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class VersionAnalysis {

    private String riskScore;       // low, medium, high (anything else is tolerated)

    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();
}
