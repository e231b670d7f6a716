package com.legalai.docversion.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImpactAnalysis {

    private Impact overallImpact;

    // Signed delta over low=1, medium=2, high=3
    private int riskScoreChange;

    @Builder.Default
    private List<SignificantChange> significantChanges = new ArrayList<>();

    private String summary;
}
