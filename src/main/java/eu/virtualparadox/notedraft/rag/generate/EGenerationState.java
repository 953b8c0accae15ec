package eu.virtualparadox.notedraft.rag.generate;

public enum EGenerationState {
    IDLE,
    REQUESTING,
    STREAMING_PARTIAL,
    VALIDATING,
    REPAIRING,
    ACCEPTED,
    REJECTED
}
