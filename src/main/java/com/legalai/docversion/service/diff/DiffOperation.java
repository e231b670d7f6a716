package com.legalai.docversion.service.diff;

/**
 * One step of a sentence alignment. For EQUAL, ADDITION and DELETION only one side is
 * meaningful; MODIFICATION carries both.
 */
public record DiffOperation(Kind kind, String originalText, String newText) {

    public enum Kind {
        EQUAL,
        ADDITION,
        DELETION,
        MODIFICATION
    }

    public static DiffOperation equal(String text) {
        return new DiffOperation(Kind.EQUAL, text, text);
    }

    public static DiffOperation deletion(String text) {
        return new DiffOperation(Kind.DELETION, text, null);
    }

    public static DiffOperation addition(String text) {
        return new DiffOperation(Kind.ADDITION, null, text);
    }

    public static DiffOperation modification(String originalText, String newText) {
        return new DiffOperation(Kind.MODIFICATION, originalText, newText);
    }
}
