package com.legalai.docversion.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Highest version number ever issued for a document. Incremented atomically,
 * never decremented, so numbers freed by retention are not handed out again.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "version_counters")
public class VersionCounter {

    @Id
    private String documentId;

    private int seq;
}
