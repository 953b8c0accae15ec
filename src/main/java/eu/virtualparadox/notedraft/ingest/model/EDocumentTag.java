package eu.virtualparadox.notedraft.ingest.model;

/**
 * Whether a document belongs to the initial upload or arrived later as an update.
 */
public enum EDocumentTag {
    INITIAL,
    FOLLOWUP
}
