package com.legalai.docversion.repository;

import com.legalai.docversion.model.DocumentVersion;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface DocumentVersionRepository extends MongoRepository<DocumentVersion, String> {

    List<DocumentVersion> findByDocumentIdOrderByVersionNumberAsc(String documentId);

    Optional<DocumentVersion> findTopByDocumentIdOrderByVersionNumberDesc(String documentId);

    // Ids only, extracted text can be large
    @Query(value = "{ 'uploadedAt': { $lt: ?0 } }", fields = "{ '_id': 1 }")
    List<DocumentVersion> findIdsByUploadedAtBefore(Instant cutoff);

    long deleteByUploadedAtBefore(Instant cutoff);
}
