package com.legalai.docversion.service;

import com.legalai.docversion.dto.CleanupResult;
import com.legalai.docversion.dto.VersionDifference;
import com.legalai.docversion.dto.VersionHistory;
import com.legalai.docversion.dto.VersionHistoryOptions;
import com.legalai.docversion.dto.VersionStatistics;
import com.legalai.docversion.exception.VersionNotFoundException;
import com.legalai.docversion.exception.VersionOwnershipException;
import com.legalai.docversion.model.DocumentComparison;
import com.legalai.docversion.model.DocumentVersion;
import com.legalai.docversion.model.VersionAnalysis;
import com.legalai.docversion.model.VersionMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for the surrounding service layer: version lifecycle, comparisons,
 * statistics, rollback and retention.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentVersioningService {

    private final VersionStoreService versionStore;
    private final ComparisonCacheService comparisonCache;
    private final VersionStatisticsService statisticsService;
    private final RetentionService retentionService;

    public DocumentVersion createVersion(String documentId,
                                         String filename,
                                         VersionMetadata metadata,
                                         VersionAnalysis analysis,
                                         String parentVersionId) {
        return versionStore.createVersion(documentId, filename, metadata, analysis, parentVersionId);
    }

    public int getNextVersionNumber(String documentId) {
        return versionStore.getNextVersionNumber(documentId);
    }

    public VersionHistory getVersionHistory(String documentId, VersionHistoryOptions options) {
        return statisticsService.getVersionHistory(documentId, options);
    }

    public Optional<DocumentVersion> getVersion(String versionId) {
        return versionStore.getVersionById(versionId);
    }

    public Optional<DocumentVersion> getLatestVersion(String documentId) {
        return versionStore.getLatestVersion(documentId);
    }

    public DocumentComparison compareVersions(String originalVersionId, String comparedVersionId) {
        return comparisonCache.compare(originalVersionId, comparedVersionId);
    }

    public DocumentComparison getComparison(String comparisonId) {
        return comparisonCache.getComparison(comparisonId);
    }

    public List<DocumentComparison> getComparisonsForDocument(String documentId) {
        return comparisonCache.getComparisonsForDocument(documentId);
    }

    public List<VersionDifference> getVersionDifferences(String documentId) {
        return statisticsService.getVersionDifferences(documentId);
    }

    public VersionStatistics getVersionStatistics(String documentId) {
        return statisticsService.getVersionStatistics(documentId);
    }

    /**
     * Create a new version whose content is copied from an earlier one of the same document.
     * The new version points back at the target through parentVersionId.
     */
    public DocumentVersion rollbackToVersion(String documentId, String targetVersionId, String filename) {
        DocumentVersion target = versionStore.getVersionById(targetVersionId)
                .orElseThrow(() -> new VersionNotFoundException("Target version not found: " + targetVersionId));

        if (!target.getDocumentId().equals(documentId)) {
            throw new VersionOwnershipException(targetVersionId, documentId);
        }

        DocumentVersion restored = versionStore.createVersion(
                documentId, filename, target.getMetadata(), target.getAnalysis(), targetVersionId);
        log.info("Rolled back document {} to version {} as version {}",
                documentId, target.getVersionNumber(), restored.getVersionNumber());
        return restored;
    }

    public CleanupResult cleanupOldVersions(int retentionDays) {
        return retentionService.cleanupOldVersions(retentionDays);
    }
}
