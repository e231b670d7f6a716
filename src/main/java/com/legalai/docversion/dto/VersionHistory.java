package com.legalai.docversion.dto;

import com.legalai.docversion.model.DocumentComparison;
import com.legalai.docversion.model.DocumentVersion;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One page of a document's versions together with its comparisons and merged timeline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VersionHistory {

    private String documentId;

    @Builder.Default
    private List<DocumentVersion> versions = new ArrayList<>();

    @Builder.Default
    private List<DocumentComparison> comparisons = new ArrayList<>();

    @Builder.Default
    private List<TimelineEvent> timeline = new ArrayList<>();

    private DocumentVersion currentVersion;

    private int total;
    private int limit;
    private int offset;
    private boolean hasMore;

    private DocumentVersion latestVersion;
    private DocumentVersion firstVersion;
    private int totalComparisons;
}
