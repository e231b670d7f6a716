package com.legalai.docversion.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Cached diff and impact result for one ordered pair of versions.
 * A to B and B to A are stored independently.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "document_comparisons")
@CompoundIndex(name = "version_pair_idx", def = "{'originalVersionId': 1, 'comparedVersionId': 1}")
public class DocumentComparison {

    @Id
    private String id;

    @Indexed
    private String originalVersionId;

    @Indexed
    private String comparedVersionId;

    @Indexed
    private Instant comparedAt;

    @Builder.Default
    private List<DocumentChange> changes = new ArrayList<>();

    private ImpactAnalysis impactAnalysis;
}
