package com.legalai.docversion.service.diff;

import com.legalai.docversion.model.Severity;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Keyword-based severity lookup. Tables are checked in order, first match wins,
 * and unmatched text is LOW.
 */
@Component
public class SeverityAssessor {

    static final List<String> HIGH_RISK_KEYWORDS = List.of(
            "liability", "penalty", "termination", "breach", "damages", "indemnify",
            "payment", "fee", "cost", "price", "amount", "obligation", "responsibility");

    static final List<String> MEDIUM_RISK_KEYWORDS = List.of(
            "notice", "consent", "approval", "right", "privilege", "access",
            "confidential", "proprietary", "intellectual property");

    public Severity assess(String text) {
        if (text == null || text.isEmpty()) {
            return Severity.LOW;
        }
        String lower = text.toLowerCase(Locale.ROOT);

        if (containsAny(lower, HIGH_RISK_KEYWORDS)) {
            return Severity.HIGH;
        }
        if (containsAny(lower, MEDIUM_RISK_KEYWORDS)) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    private boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
