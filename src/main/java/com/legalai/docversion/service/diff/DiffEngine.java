package com.legalai.docversion.service.diff;

import com.legalai.docversion.exception.DiffCancelledException;
import com.legalai.docversion.model.ChangeType;
import com.legalai.docversion.model.DocumentChange;
import com.legalai.docversion.model.TextLocation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Computes sentence-level changes between two texts.
 *
 * Sentences are aligned with an LCS table where two sentences count as the same unit
 * when their word-set Jaccard similarity exceeds {@link #EQUIVALENCE_THRESHOLD}.
 * Equivalent but not identical sentences become modifications.
 *
 * Stateless and storage-free. Long alignments honour thread interruption and
 * abort with {@link DiffCancelledException}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DiffEngine {

    static final double EQUIVALENCE_THRESHOLD = 0.8;
    static final int DESCRIPTION_MAX_LENGTH = 100;
    static final int MODIFICATION_SIDE_MAX_LENGTH = 50;

    private static final Pattern WORD_SEPARATOR = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final SentenceSegmenter segmenter;
    private final SeverityAssessor severityAssessor;

    /**
     * Detect changes between two full texts. Empty or identical inputs yield no changes.
     */
    public List<DocumentChange> detectChanges(String originalText, String comparedText) {
        String original = originalText != null ? originalText : "";
        String compared = comparedText != null ? comparedText : "";

        List<String> originalSentences = segmenter.segment(original);
        List<String> comparedSentences = segmenter.segment(compared);

        List<DiffOperation> operations = computeDiff(originalSentences, comparedSentences);
        List<DocumentChange> changes = materialize(operations, original, compared);

        log.debug("Diff produced {} changes from {} original and {} compared sentences",
                changes.size(), originalSentences.size(), comparedSentences.size());
        return changes;
    }

    // ========================= ALIGNMENT =========================

    /**
     * Align two sentence sequences. Operations are returned in document order.
     */
    public List<DiffOperation> computeDiff(List<String> original, List<String> compared) {
        int n = original.size();
        int m = compared.size();
        List<Set<String>> originalWords = original.stream().map(this::words).toList();
        List<Set<String>> comparedWords = compared.stream().map(this::words).toList();
        int[][] dp = new int[n + 1][m + 1];

        for (int i = 1; i <= n; i++) {
            checkInterrupted();
            for (int j = 1; j <= m; j++) {
                if ((j & 0xFF) == 0) {
                    checkInterrupted();
                }
                if (isEquivalent(originalWords.get(i - 1), comparedWords.get(j - 1))) {
                    dp[i][j] = dp[i - 1][j - 1] + 1;
                } else {
                    dp[i][j] = Math.max(dp[i - 1][j], dp[i][j - 1]);
                }
            }
        }

        // Backtrack from the bottom-right corner, collecting in reverse
        List<DiffOperation> operations = new ArrayList<>();
        int i = n;
        int j = m;
        while (i > 0 || j > 0) {
            if (((i + j) & 0xFF) == 0) {
                checkInterrupted();
            }
            if (i > 0 && j > 0 && isEquivalent(originalWords.get(i - 1), comparedWords.get(j - 1))) {
                String before = original.get(i - 1);
                String after = compared.get(j - 1);
                operations.add(before.equals(after)
                        ? DiffOperation.equal(before)
                        : DiffOperation.modification(before, after));
                i--;
                j--;
            } else if (i > 0 && (j == 0 || dp[i - 1][j] >= dp[i][j - 1])) {
                operations.add(DiffOperation.deletion(original.get(i - 1)));
                i--;
            } else {
                operations.add(DiffOperation.addition(compared.get(j - 1)));
                j--;
            }
        }
        Collections.reverse(operations);
        return operations;
    }

    /**
     * Jaccard similarity of the case-insensitive, whitespace-separated word sets.
     */
    public double textSimilarity(String first, String second) {
        return similarity(words(first), words(second));
    }

    private double similarity(Set<String> words1, Set<String> words2) {
        if (words1.isEmpty() && words2.isEmpty()) {
            return 0.0;
        }

        Set<String> intersection = new HashSet<>(words1);
        intersection.retainAll(words2);
        Set<String> union = new HashSet<>(words1);
        union.addAll(words2);

        return (double) intersection.size() / union.size();
    }

    private boolean isEquivalent(Set<String> first, Set<String> second) {
        return similarity(first, second) > EQUIVALENCE_THRESHOLD;
    }

    private Set<String> words(String text) {
        Set<String> words = new HashSet<>();
        if (text == null) {
            return words;
        }
        for (String word : WORD_SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }

    // ========================= MATERIALIZATION =========================

    private List<DocumentChange> materialize(List<DiffOperation> operations, String originalText, String comparedText) {
        List<DocumentChange> changes = new ArrayList<>();
        int originalIndex = 0;
        int comparedIndex = 0;

        for (DiffOperation op : operations) {
            switch (op.kind()) {
                case DELETION -> {
                    changes.add(DocumentChange.builder()
                            .id(UUID.randomUUID().toString())
                            .type(ChangeType.DELETION)
                            .originalText(op.originalText())
                            .location(locate(originalText, op.originalText(), originalIndex))
                            .severity(severityAssessor.assess(op.originalText()))
                            .description("Deleted text: \"" + truncate(op.originalText(), DESCRIPTION_MAX_LENGTH) + "\"")
                            .build());
                    originalIndex++;
                }
                case ADDITION -> {
                    changes.add(DocumentChange.builder()
                            .id(UUID.randomUUID().toString())
                            .type(ChangeType.ADDITION)
                            .newText(op.newText())
                            .location(locate(comparedText, op.newText(), comparedIndex))
                            .severity(severityAssessor.assess(op.newText()))
                            .description("Added text: \"" + truncate(op.newText(), DESCRIPTION_MAX_LENGTH) + "\"")
                            .build());
                    comparedIndex++;
                }
                case MODIFICATION -> {
                    changes.add(DocumentChange.builder()
                            .id(UUID.randomUUID().toString())
                            .type(ChangeType.MODIFICATION)
                            .originalText(op.originalText())
                            .newText(op.newText())
                            .location(locate(comparedText, op.newText(), comparedIndex))
                            .severity(severityAssessor.assess(op.newText()))
                            .description("Modified text from \""
                                    + truncate(op.originalText(), MODIFICATION_SIDE_MAX_LENGTH) + "\" to \""
                                    + truncate(op.newText(), MODIFICATION_SIDE_MAX_LENGTH) + "\"")
                            .build());
                    originalIndex++;
                    comparedIndex++;
                }
                case EQUAL -> {
                    originalIndex++;
                    comparedIndex++;
                }
            }
        }
        return changes;
    }

    /**
     * Exact substring position, or a proportional estimate from the operation index when
     * the sentence no longer appears verbatim (segmentation trims whitespace).
     */
    TextLocation locate(String fullText, String searchText, int approximateIndex) {
        int start = fullText.indexOf(searchText);
        if (start < 0) {
            int approximate = (int) Math.floor((approximateIndex / 100.0) * fullText.length());
            return new TextLocation(approximate, approximate + searchText.length());
        }
        return new TextLocation(start, start + searchText.length());
    }

    static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "...";
    }

    private void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new DiffCancelledException("Diff computation interrupted");
        }
    }
}
