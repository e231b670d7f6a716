package com.legalai.docversion.service.diff;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits legal text into sentence-level units for comparison.
 *
 * Boundaries:
 *   - end punctuation followed by whitespace and a capital letter
 *   - a blank line
 *   - a numbered clause marker ("12. ")
 *   - a lettered sub-item marker ("(a) ")
 *
 * Segments are trimmed and empty ones are dropped. No LLM or NLP involved.
 */
@Component
public class SentenceSegmenter {

    // \s covers Unicode spaces such as NBSP, frequent in text extracted from PDFs
    private static final Pattern BOUNDARY = Pattern.compile(
            "(?<=[.!?])\\s+(?=[A-Z])"         // sentence end
                    + "|(?<=\\n\\n)"          // blank line
                    + "|(?<=[0-9]{1,6}\\.\\s)" // numbered clause
                    + "|(?<=\\([a-z]\\)\\s)",  // lettered sub-item
            Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern EDGE_WHITESPACE = Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);

    public List<String> segment(String text) {
        List<String> sentences = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return sentences;
        }

        for (String part : BOUNDARY.split(text)) {
            String trimmed = EDGE_WHITESPACE.matcher(part).replaceAll("");
            if (!trimmed.isEmpty()) {
                sentences.add(trimmed);
            }
        }
        return sentences;
    }
}
