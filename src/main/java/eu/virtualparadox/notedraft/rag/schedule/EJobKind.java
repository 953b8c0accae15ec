package eu.virtualparadox.notedraft.rag.schedule;

/**
 * {@link #FULL} replaces the section text, {@link #UPDATE} appends an update note to it.
 */
public enum EJobKind {
    FULL,
    UPDATE
}
