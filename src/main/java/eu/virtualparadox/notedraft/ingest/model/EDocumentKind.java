package eu.virtualparadox.notedraft.ingest.model;

import java.nio.file.Path;
import java.util.Locale;

public enum EDocumentKind {
    TEXT,
    WORD,
    PDF,
    UNKNOWN;

    public static EDocumentKind fromFileName(final String name) {
        if (name == null) {
            return UNKNOWN;
        }
        final String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".pdf")) {
            return PDF;
        }
        if (lower.endsWith(".docx") || lower.endsWith(".doc")) {
            return WORD;
        }
        if (lower.endsWith(".txt") || lower.endsWith(".md") || lower.endsWith(".text")) {
            return TEXT;
        }
        return UNKNOWN;
    }

    public static EDocumentKind fromPath(final Path path) {
        return fromFileName(path.getFileName() == null ? null : path.getFileName().toString());
    }
}
