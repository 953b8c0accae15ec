package eu.virtualparadox.notedraft.ingest.chunker;

/**
 * Ingestion privacy setting. {@link #REDACT} scrubs identifiers before chunking,
 * {@link #FRAGMENT} keeps text intact but uses the narrower window.
 */
public enum EPrivacyMode {
    STANDARD,
    REDACT,
    FRAGMENT
}
