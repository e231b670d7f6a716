package com.legalai.docversion.service;

import com.legalai.docversion.model.DocumentChange;
import com.legalai.docversion.model.DocumentComparison;
import com.legalai.docversion.model.DocumentVersion;
import com.legalai.docversion.model.ImpactAnalysis;
import com.legalai.docversion.service.diff.DiffEngine;
import com.legalai.docversion.service.impact.ImpactAnalyzer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Builds a comparison for two loaded versions: diff of the extracted text, then impact
 * analysis over the changes and both versions' risk scores. Touches no storage.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentComparisonService {

    private final DiffEngine diffEngine;
    private final ImpactAnalyzer impactAnalyzer;
    private final Clock clock;

    public DocumentComparison compareDocuments(DocumentVersion originalVersion, DocumentVersion comparedVersion) {
        log.debug("Comparing version {} -> {}", originalVersion.getId(), comparedVersion.getId());

        List<DocumentChange> changes = diffEngine.detectChanges(
                textOf(originalVersion), textOf(comparedVersion));

        ImpactAnalysis impactAnalysis = impactAnalyzer.analyze(
                changes, originalVersion.getAnalysis(), comparedVersion.getAnalysis());

        return DocumentComparison.builder()
                .id(UUID.randomUUID().toString())
                .originalVersionId(originalVersion.getId())
                .comparedVersionId(comparedVersion.getId())
                .comparedAt(Instant.now(clock))
                .changes(changes)
                .impactAnalysis(impactAnalysis)
                .build();
    }

    private static String textOf(DocumentVersion version) {
        if (version.getMetadata() == null || version.getMetadata().getExtractedText() == null) {
            return "";
        }
        return version.getMetadata().getExtractedText();
    }
}
