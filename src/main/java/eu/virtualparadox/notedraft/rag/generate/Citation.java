package eu.virtualparadox.notedraft.rag.generate;

/**
 * Link from generated text to the evidence chunk supporting it.
 */
public record Citation(String sourceId, String sourceName, String chunkId, String excerpt) {

    public String asString() {
        return sourceName + " [" + chunkId + "]: " + excerpt;
    }
}
