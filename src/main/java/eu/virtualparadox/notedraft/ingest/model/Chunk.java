package eu.virtualparadox.notedraft.ingest.model;

/**
 * Addressable slice of a source document's normalized text.
 *
 * @param id           stable identifier, {@code sourceId + "_chunk_" + ordinal}
 * @param sourceId     owning document id
 * @param sourceName   owning document display name
 * @param text         chunk text
 * @param startOffset  inclusive start offset in the normalized document text
 * @param endOffset    exclusive end offset in the normalized document text
 * @param documentType classification of the owning document
 * @param episodeDate  ISO date ({@code YYYY-MM-DD}) of the owning document, or {@code null}
 * @param docWeight    ranking weight of the owning document
 */
public record Chunk(String id,
                    String sourceId,
                    String sourceName,
                    String text,
                    int startOffset,
                    int endOffset,
                    EDocumentType documentType,
                    String episodeDate,
                    double docWeight) {
}
