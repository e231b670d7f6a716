package com.legalai.docversion.exception;

public class VersionNotFoundException extends NotFoundException {

    public VersionNotFoundException(String message) {
        super(message);
    }

    public static VersionNotFoundException forId(String versionId) {
        return new VersionNotFoundException("Version not found with id: " + versionId);
    }
}
