package com.legalai.docversion.service.impact;

import com.legalai.docversion.model.ChangeCategory;
import com.legalai.docversion.model.DocumentChange;
import com.legalai.docversion.model.Impact;
import com.legalai.docversion.model.ImpactAnalysis;
import com.legalai.docversion.model.Severity;
import com.legalai.docversion.model.SignificantChange;
import com.legalai.docversion.model.VersionAnalysis;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Derives the legal impact of a set of changes.
 * Combines the risk score movement between two analyses with the polarity of each
 * categorized high-severity change.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ImpactAnalyzer {

    private static final double RISK_CHANGE_THRESHOLD = 0.5;

    private final ChangeCategorizer changeCategorizer;

    public ImpactAnalysis analyze(List<DocumentChange> changes,
                                  VersionAnalysis originalAnalysis,
                                  VersionAnalysis comparedAnalysis) {
        int riskScoreChange = 0;
        if (originalAnalysis != null && comparedAnalysis != null) {
            riskScoreChange = riskScoreToNumber(comparedAnalysis.getRiskScore())
                    - riskScoreToNumber(originalAnalysis.getRiskScore());
        }

        List<SignificantChange> significantChanges = new ArrayList<>();
        for (DocumentChange change : changes) {
            if (change.getSeverity() == Severity.HIGH) {
                changeCategorizer.categorize(change).ifPresent(significantChanges::add);
            }
        }

        Impact overallImpact = determineOverallImpact(significantChanges, riskScoreChange);
        String summary = generateSummary(changes, significantChanges, riskScoreChange);

        log.debug("Impact analysis: {} changes, {} significant, riskScoreChange={}, overall={}",
                changes.size(), significantChanges.size(), riskScoreChange, overallImpact);

        return ImpactAnalysis.builder()
                .overallImpact(overallImpact)
                .riskScoreChange(riskScoreChange)
                .significantChanges(significantChanges)
                .summary(summary)
                .build();
    }

    /**
     * low=1, medium=2, high=3; unknown or missing labels count as low.
     */
    public static int riskScoreToNumber(String riskScore) {
        if (riskScore == null) {
            return 1;
        }
        return switch (riskScore) {
            case "medium" -> 2;
            case "high" -> 3;
            default -> 1;
        };
    }

    Impact determineOverallImpact(List<SignificantChange> significantChanges, int riskScoreChange) {
        if (riskScoreChange > RISK_CHANGE_THRESHOLD) {
            return Impact.UNFAVORABLE;
        }
        if (riskScoreChange < -RISK_CHANGE_THRESHOLD) {
            return Impact.FAVORABLE;
        }

        long favorable = significantChanges.stream().filter(c -> c.getImpact() == Impact.FAVORABLE).count();
        long unfavorable = significantChanges.stream().filter(c -> c.getImpact() == Impact.UNFAVORABLE).count();

        if (unfavorable > favorable) {
            return Impact.UNFAVORABLE;
        }
        if (favorable > unfavorable) {
            return Impact.FAVORABLE;
        }
        return Impact.NEUTRAL;
    }

    String generateSummary(List<DocumentChange> changes, List<SignificantChange> significantChanges, int riskScoreChange) {
        long highSeverity = changes.stream().filter(c -> c.getSeverity() == Severity.HIGH).count();

        StringBuilder summary = new StringBuilder()
                .append("Found ").append(changes.size()).append(" changes between document versions");

        if (highSeverity > 0) {
            summary.append(", including ").append(highSeverity).append(" high-severity changes");
        }

        if (riskScoreChange != 0) {
            summary.append(". Overall risk level has ").append(riskScoreChange > 0 ? "increased" : "decreased");
        }

        if (!significantChanges.isEmpty()) {
            Set<ChangeCategory> categories = significantChanges.stream()
                    .map(SignificantChange::getCategory)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            summary.append(". Significant changes affect: ")
                    .append(categories.stream().map(ChangeCategory::getValue).collect(Collectors.joining(", ")));
        }

        return summary.append('.').toString();
    }
}
