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

/**
 * MongoDB document holding one immutable snapshot of a document's content.
 * Version numbers are unique per documentId and never reused.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "document_versions")
@CompoundIndex(name = "document_version_idx", def = "{'documentId': 1, 'versionNumber': 1}", unique = true)
public class DocumentVersion {

    @Id
    private String id;

    @Indexed
    private String documentId;

    private int versionNumber;
    private String filename;

    @Indexed
    private Instant uploadedAt;

    private VersionMetadata metadata;

    // Null when the document was never analyzed
    private VersionAnalysis analysis;

    // Weak reference: the parent may have been removed by retention
    @Indexed
    private String parentVersionId;
}
