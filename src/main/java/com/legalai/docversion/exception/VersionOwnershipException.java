package com.legalai.docversion.exception;

/**
 * Thrown when a referenced version belongs to a different document than the one being written.
 */
public class VersionOwnershipException extends RuntimeException {

    private final String versionId;
    private final String expectedDocumentId;

    public VersionOwnershipException(String versionId, String expectedDocumentId) {
        super("Version " + versionId + " does not belong to document " + expectedDocumentId);
        this.versionId = versionId;
        this.expectedDocumentId = expectedDocumentId;
    }

    public String getVersionId() {
        return versionId;
    }

    public String getExpectedDocumentId() {
        return expectedDocumentId;
    }
}
