package com.legalai.docversion.service;

import com.legalai.docversion.dto.RiskTrend;
import com.legalai.docversion.dto.TimelineEvent;
import com.legalai.docversion.dto.VersionDifference;
import com.legalai.docversion.dto.VersionHistory;
import com.legalai.docversion.dto.VersionHistoryOptions;
import com.legalai.docversion.dto.VersionStatistics;
import com.legalai.docversion.model.DocumentComparison;
import com.legalai.docversion.model.DocumentVersion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Walks a document's version chain to produce per-pair differences, aggregate
 * statistics and the paged history view.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class VersionStatisticsService {

    private final VersionStoreService versionStore;
    private final ComparisonCacheService comparisonCache;

    /**
     * Differences between every consecutive pair of versions, ordered by version number.
     * Missing comparisons are computed and cached on the way.
     */
    public List<VersionDifference> getVersionDifferences(String documentId) {
        return differencesOf(versionStore.getVersionsByDocumentId(documentId));
    }

    public VersionStatistics getVersionStatistics(String documentId) {
        List<DocumentVersion> versions = versionStore.getVersionsByDocumentId(documentId);
        List<VersionDifference> differences = differencesOf(versions);

        int totalChanges = differences.stream().mapToInt(VersionDifference::getChangesCount).sum();
        int totalSignificant = differences.stream().mapToInt(VersionDifference::getSignificantChangesCount).sum();
        long cumulativeRisk = differences.stream().mapToLong(VersionDifference::getRiskScoreChange).sum();

        VersionStatistics statistics = VersionStatistics.builder()
                .documentId(documentId)
                .totalVersions(versions.size())
                .totalChanges(totalChanges)
                .totalSignificantChanges(totalSignificant)
                .riskTrend(RiskTrend.fromCumulativeChange(cumulativeRisk))
                .mostActiveVersion(findMostActiveVersion(differences))
                .averageChangesPerVersion((double) totalChanges / Math.max(1, differences.size()))
                .firstVersion(versions.isEmpty() ? null : versions.get(0))
                .latestVersion(versions.isEmpty() ? null : versions.get(versions.size() - 1))
                .build();

        log.debug("Statistics for document {}: {} versions, {} changes, trend {}",
                documentId, versions.size(), totalChanges, statistics.getRiskTrend());
        return statistics;
    }

    /**
     * Paged versions plus every comparison touching the document and a merged timeline.
     */
    public VersionHistory getVersionHistory(String documentId, VersionHistoryOptions options) {
        VersionHistoryOptions opts = options != null ? options : VersionHistoryOptions.defaults();
        opts.validate();

        List<DocumentVersion> allVersions = versionStore.getVersionsByDocumentId(documentId);
        List<DocumentComparison> comparisons = versionStore.getComparisonsForVersions(
                allVersions.stream().map(DocumentVersion::getId).toList());

        int total = allVersions.size();
        int from = Math.min(opts.getOffset(), total);
        int to = Math.min(from + opts.getLimit(), total);
        List<DocumentVersion> page = allVersions.subList(from, to).stream()
                .map(v -> opts.isIncludeAnalysis() ? v : v.toBuilder().analysis(null).build())
                .toList();

        DocumentVersion first = allVersions.isEmpty() ? null : allVersions.get(0);
        DocumentVersion latest = allVersions.isEmpty() ? null : allVersions.get(total - 1);

        return VersionHistory.builder()
                .documentId(documentId)
                .versions(page)
                .comparisons(comparisons)
                .timeline(buildTimeline(allVersions, comparisons))
                .currentVersion(latest)
                .total(total)
                .limit(opts.getLimit())
                .offset(opts.getOffset())
                .hasMore(to < total)
                .latestVersion(latest)
                .firstVersion(first)
                .totalComparisons(comparisons.size())
                .build();
    }

    // ========================= HELPERS =========================

    private List<VersionDifference> differencesOf(List<DocumentVersion> versions) {
        List<VersionDifference> differences = new ArrayList<>();
        for (int i = 1; i < versions.size(); i++) {
            DocumentVersion previous = versions.get(i - 1);
            DocumentVersion current = versions.get(i);
            DocumentComparison comparison = comparisonCache.compare(previous.getId(), current.getId());

            differences.add(VersionDifference.builder()
                    .fromVersion(previous.getVersionNumber())
                    .toVersion(current.getVersionNumber())
                    .fromVersionId(previous.getId())
                    .toVersionId(current.getId())
                    .changesCount(comparison.getChanges().size())
                    .significantChangesCount(comparison.getImpactAnalysis().getSignificantChanges().size())
                    .overallImpact(comparison.getImpactAnalysis().getOverallImpact())
                    .riskScoreChange(comparison.getImpactAnalysis().getRiskScoreChange())
                    .comparedAt(comparison.getComparedAt())
                    .build());
        }
        return differences;
    }

    // Strict comparison keeps the earliest pair on ties
    private Integer findMostActiveVersion(List<VersionDifference> differences) {
        VersionDifference mostActive = null;
        for (VersionDifference difference : differences) {
            if (mostActive == null || difference.getChangesCount() > mostActive.getChangesCount()) {
                mostActive = difference;
            }
        }
        return mostActive != null ? mostActive.getToVersion() : null;
    }

    private List<TimelineEvent> buildTimeline(List<DocumentVersion> versions, List<DocumentComparison> comparisons) {
        List<TimelineEvent> events = new ArrayList<>();

        for (DocumentVersion version : versions) {
            events.add(TimelineEvent.builder()
                    .type(TimelineEvent.EventType.VERSION_CREATED)
                    .timestamp(version.getUploadedAt())
                    .versionId(version.getId())
                    .versionNumber(version.getVersionNumber())
                    .description("Version " + version.getVersionNumber() + " created: " + version.getFilename())
                    .build());
        }

        Map<String, DocumentVersion> byId = versions.stream()
                .collect(Collectors.toMap(DocumentVersion::getId, Function.identity(), (a, b) -> a));

        for (DocumentComparison comparison : comparisons) {
            DocumentVersion original = byId.get(comparison.getOriginalVersionId());
            DocumentVersion compared = byId.get(comparison.getComparedVersionId());
            // One side may have been swept by retention or belong to another document
            if (original == null || compared == null) {
                continue;
            }

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("changesCount", comparison.getChanges().size());
            metadata.put("overallImpact", comparison.getImpactAnalysis().getOverallImpact().getValue());

            events.add(TimelineEvent.builder()
                    .type(TimelineEvent.EventType.COMPARISON_MADE)
                    .timestamp(comparison.getComparedAt())
                    .comparisonId(comparison.getId())
                    .description("Compared version " + original.getVersionNumber()
                            + " with version " + compared.getVersionNumber())
                    .metadata(metadata)
                    .build());
        }

        events.sort(Comparator.comparing(TimelineEvent::getTimestamp,
                Comparator.nullsFirst(Comparator.naturalOrder())));
        return events;
    }
}
