package com.legalai.docversion.dto;

import com.legalai.docversion.model.DocumentVersion;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VersionStatistics {
    private String documentId;
    private int totalVersions;
    private int totalChanges;
    private int totalSignificantChanges;
    private RiskTrend riskTrend;

    // toVersion of the busiest consecutive pair; null with fewer than two versions
    private Integer mostActiveVersion;

    private double averageChangesPerVersion;
    private DocumentVersion firstVersion;
    private DocumentVersion latestVersion;
}
