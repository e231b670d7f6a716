package com.legalai.docversion.repository;

import com.legalai.docversion.model.DocumentComparison;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface DocumentComparisonRepository extends MongoRepository<DocumentComparison, String> {

    // Oldest first so a duplicate written by a racing instance never changes the returned id
    Optional<DocumentComparison> findFirstByOriginalVersionIdAndComparedVersionIdOrderByComparedAtAsc(
            String originalVersionId, String comparedVersionId);

    List<DocumentComparison> findByOriginalVersionIdInOrComparedVersionIdInOrderByComparedAtDesc(
            Collection<String> originalVersionIds, Collection<String> comparedVersionIds);

    long deleteByComparedAtBefore(Instant cutoff);

    long deleteByOriginalVersionIdInOrComparedVersionIdIn(
            Collection<String> originalVersionIds, Collection<String> comparedVersionIds);
}
