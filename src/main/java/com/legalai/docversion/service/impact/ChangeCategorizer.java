package com.legalai.docversion.service.impact;

import com.legalai.docversion.model.ChangeCategory;
import com.legalai.docversion.model.ChangeType;
import com.legalai.docversion.model.DocumentChange;
import com.legalai.docversion.model.Impact;
import com.legalai.docversion.model.SignificantChange;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Ordered keyword rules mapping a change to a legal category.
 * Rules are evaluated top to bottom and the first match wins.
 */
@Component
public class ChangeCategorizer {

    /**
     * Direction of a category: whether adding such a clause helps or hurts the reader.
     */
    enum Polarity {
        ADDITION_UNFAVORABLE,
        ADDITION_FAVORABLE,
        ALWAYS_NEUTRAL
    }

    record CategoryRule(ChangeCategory category, List<String> keywords, Polarity polarity, String recommendation) {

        boolean matches(String lowerText) {
            return keywords.stream().anyMatch(lowerText::contains);
        }
    }

    static final List<CategoryRule> RULES = List.of(
            new CategoryRule(ChangeCategory.FINANCIAL, List.of("payment", "fee", "cost"),
                    Polarity.ADDITION_UNFAVORABLE,
                    "Review financial implications carefully before agreeing."),
            new CategoryRule(ChangeCategory.RIGHTS, List.of("right", "privilege"),
                    Polarity.ADDITION_FAVORABLE,
                    "Ensure you understand how this affects your rights."),
            new CategoryRule(ChangeCategory.OBLIGATIONS, List.of("obligation", "responsibility", "must"),
                    Polarity.ADDITION_UNFAVORABLE,
                    "Consider whether you can fulfill these obligations."),
            new CategoryRule(ChangeCategory.PRIVACY, List.of("confidential", "privacy", "data"),
                    Polarity.ALWAYS_NEUTRAL,
                    "Review privacy implications and data handling requirements."),
            new CategoryRule(ChangeCategory.LEGAL, List.of("liability", "damages", "indemnify"),
                    Polarity.ADDITION_UNFAVORABLE,
                    "Consider consulting a legal professional about liability implications."));

    /**
     * Categorize a change, or return empty when no rule matches.
     */
    public Optional<SignificantChange> categorize(DocumentChange change) {
        String lower = judgedText(change).toLowerCase(Locale.ROOT);

        for (CategoryRule rule : RULES) {
            if (rule.matches(lower)) {
                return Optional.of(SignificantChange.builder()
                        .changeId(change.getId())
                        .category(rule.category())
                        .impact(impactOf(rule.polarity(), change.getType()))
                        .description(change.getDescription())
                        .recommendation(rule.recommendation())
                        .build());
            }
        }
        return Optional.empty();
    }

    // The new wording when there is one, otherwise the removed wording
    private static String judgedText(DocumentChange change) {
        if (change.getNewText() != null && !change.getNewText().isEmpty()) {
            return change.getNewText();
        }
        return change.getOriginalText() != null ? change.getOriginalText() : "";
    }

    // Modifications are judged like additions: the new wording is what the reader signs
    static Impact impactOf(Polarity polarity, ChangeType type) {
        boolean removed = type == ChangeType.DELETION;
        return switch (polarity) {
            case ADDITION_UNFAVORABLE -> removed ? Impact.FAVORABLE : Impact.UNFAVORABLE;
            case ADDITION_FAVORABLE -> removed ? Impact.UNFAVORABLE : Impact.FAVORABLE;
            case ALWAYS_NEUTRAL -> Impact.NEUTRAL;
        };
    }
}
