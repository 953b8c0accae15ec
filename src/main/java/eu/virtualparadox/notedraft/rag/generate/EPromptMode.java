package eu.virtualparadox.notedraft.rag.generate;

/**
 * Strength of the citation wording in a section request.
 */
public enum EPromptMode {
    STANDARD,
    /** forbids any uncited claim */
    STRICT,
    /** strict wording plus the instruction to omit unsupported statements, used with widened evidence */
    CITATION_BOUND
}
