package com.legalai.docversion.dto;

import com.legalai.docversion.model.Impact;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Comparison summary for one consecutive pair of versions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VersionDifference {
    private int fromVersion;
    private int toVersion;
    private String fromVersionId;
    private String toVersionId;
    private int changesCount;
    private int significantChangesCount;
    private Impact overallImpact;
    private int riskScoreChange;
    private Instant comparedAt;
}
