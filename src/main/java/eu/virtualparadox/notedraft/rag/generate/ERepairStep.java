package eu.virtualparadox.notedraft.rag.generate;

/**
 * How an accepted result got its citations, in ladder order.
 */
public enum ERepairStep {
    NONE,
    INLINE_MARKERS,
    RECOVERY_CALL,
    STRICT_RETRY,
    WIDENED_EVIDENCE
}
