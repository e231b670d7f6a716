package com.legalai.docversion.service;

import com.legalai.docversion.exception.VersionNotFoundException;
import com.legalai.docversion.exception.VersionOwnershipException;
import com.legalai.docversion.model.DocumentComparison;
import com.legalai.docversion.model.DocumentVersion;
import com.legalai.docversion.model.VersionAnalysis;
import com.legalai.docversion.model.VersionMetadata;
import com.legalai.docversion.repository.DocumentComparisonRepository;
import com.legalai.docversion.repository.DocumentVersionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for versions and their cached comparisons.
 * Versions are written once and only ever removed by the retention sweep.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class VersionStoreService {

    private final DocumentVersionRepository versionRepository;
    private final DocumentComparisonRepository comparisonRepository;
    private final VersionNumberAllocator versionNumberAllocator;
    private final Clock clock;

    /**
     * Create a new version with the next number in the document's sequence.
     *
     * @param parentVersionId optional; must name an existing version of the same document
     */
    public DocumentVersion createVersion(String documentId,
                                         String filename,
                                         VersionMetadata metadata,
                                         VersionAnalysis analysis,
                                         String parentVersionId) {
        requireId(documentId, "documentId");
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("filename must not be blank");
        }
        if (parentVersionId != null) {
            validateParent(documentId, parentVersionId);
        }

        int versionNumber = versionNumberAllocator.allocate(documentId);

        DocumentVersion version = DocumentVersion.builder()
                .documentId(documentId)
                .versionNumber(versionNumber)
                .filename(filename)
                .uploadedAt(Instant.now(clock))
                .metadata(metadata)
                .analysis(analysis)
                .parentVersionId(parentVersionId)
                .build();

        DocumentVersion saved = versionRepository.save(version);
        log.info("Created version {} ({}) for document {}", versionNumber, saved.getId(), documentId);
        return saved;
    }

    public int getNextVersionNumber(String documentId) {
        requireId(documentId, "documentId");
        return versionNumberAllocator.peekNext(documentId);
    }

    public Optional<DocumentVersion> getVersionById(String versionId) {
        requireId(versionId, "versionId");
        return versionRepository.findById(versionId);
    }

    /**
     * All versions of a document, ascending by version number.
     */
    public List<DocumentVersion> getVersionsByDocumentId(String documentId) {
        requireId(documentId, "documentId");
        return versionRepository.findByDocumentIdOrderByVersionNumberAsc(documentId);
    }

    public Optional<DocumentVersion> getLatestVersion(String documentId) {
        requireId(documentId, "documentId");
        return versionRepository.findTopByDocumentIdOrderByVersionNumberDesc(documentId);
    }

    // ========================= COMPARISONS =========================

    public Optional<DocumentComparison> findComparison(String originalVersionId, String comparedVersionId) {
        return comparisonRepository.findFirstByOriginalVersionIdAndComparedVersionIdOrderByComparedAtAsc(
                originalVersionId, comparedVersionId);
    }

    public Optional<DocumentComparison> getComparisonById(String comparisonId) {
        requireId(comparisonId, "comparisonId");
        return comparisonRepository.findById(comparisonId);
    }

    public DocumentComparison saveComparison(DocumentComparison comparison) {
        return comparisonRepository.save(comparison);
    }

    /**
     * Every comparison touching any of the given versions, newest first.
     */
    public List<DocumentComparison> getComparisonsForVersions(List<String> versionIds) {
        if (versionIds.isEmpty()) {
            return List.of();
        }
        return comparisonRepository.findByOriginalVersionIdInOrComparedVersionIdInOrderByComparedAtDesc(
                versionIds, versionIds);
    }

    // ========================= RETENTION =========================

    public long deleteVersionsOlderThan(Instant cutoff) {
        return versionRepository.deleteByUploadedAtBefore(cutoff);
    }

    public long deleteComparisonsOlderThan(Instant cutoff) {
        return comparisonRepository.deleteByComparedAtBefore(cutoff);
    }

    public List<String> findVersionIdsOlderThan(Instant cutoff) {
        return versionRepository.findIdsByUploadedAtBefore(cutoff).stream()
                .map(DocumentVersion::getId)
                .toList();
    }

    /**
     * Removes every comparison referencing one of the given versions on either side.
     */
    public long deleteComparisonsForVersions(Collection<String> versionIds) {
        if (versionIds.isEmpty()) {
            return 0;
        }
        return comparisonRepository.deleteByOriginalVersionIdInOrComparedVersionIdIn(versionIds, versionIds);
    }

    private void validateParent(String documentId, String parentVersionId) {
        DocumentVersion parent = versionRepository.findById(parentVersionId)
                .orElseThrow(() -> VersionNotFoundException.forId(parentVersionId));
        if (!documentId.equals(parent.getDocumentId())) {
            throw new VersionOwnershipException(parentVersionId, documentId);
        }
    }

    private static void requireId(String id, String name) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
