package com.legalai.docversion.service;

import com.legalai.docversion.model.DocumentVersion;
import com.legalai.docversion.model.VersionCounter;
import com.legalai.docversion.repository.DocumentVersionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

/**
 * Issues version numbers through an atomic per-document counter in MongoDB.
 *
 * Each allocation is a single findAndModify with $inc, so concurrent writers for the
 * same document never observe the same number and writers for different documents
 * never contend. The unique (documentId, versionNumber) index on document_versions
 * is the backstop.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class VersionNumberAllocator {

    private final MongoTemplate mongoTemplate;
    private final DocumentVersionRepository versionRepository;

    /**
     * Reserve the next version number for a document.
     */
    public int allocate(String documentId) {
        seedIfMissing(documentId);

        VersionCounter counter = mongoTemplate.findAndModify(
                byDocument(documentId),
                new Update().inc("seq", 1),
                FindAndModifyOptions.options().returnNew(true).upsert(true),
                VersionCounter.class);

        if (counter == null) {
            throw new IllegalStateException("Version counter upsert returned nothing for document " + documentId);
        }
        log.debug("Allocated version {} for document {}", counter.getSeq(), documentId);
        return counter.getSeq();
    }

    /**
     * The number the next allocation would return. Advisory only: another writer may take it first.
     */
    public int peekNext(String documentId) {
        VersionCounter counter = mongoTemplate.findOne(byDocument(documentId), VersionCounter.class);
        if (counter != null) {
            return counter.getSeq() + 1;
        }
        return currentMaxVersion(documentId) + 1;
    }

    // Versions written before the counter existed must not be renumbered
    private void seedIfMissing(String documentId) {
        if (mongoTemplate.exists(byDocument(documentId), VersionCounter.class)) {
            return;
        }
        int max = currentMaxVersion(documentId);
        if (max == 0) {
            return;
        }
        try {
            mongoTemplate.insert(new VersionCounter(documentId, max));
            log.info("Seeded version counter for document {} at {}", documentId, max);
        } catch (DuplicateKeyException e) {
            log.debug("Version counter for document {} was seeded concurrently", documentId);
        }
    }

    private int currentMaxVersion(String documentId) {
        return versionRepository.findTopByDocumentIdOrderByVersionNumberDesc(documentId)
                .map(DocumentVersion::getVersionNumber)
                .orElse(0);
    }

    private Query byDocument(String documentId) {
        return Query.query(Criteria.where("_id").is(documentId));
    }
}
