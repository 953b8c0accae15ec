package eu.virtualparadox.notedraft.rag.generate;

/**
 * Citation as the model wrote it, before it is checked against the evidence.
 */
public record RawCitation(String chunkId, String excerpt) {
}
