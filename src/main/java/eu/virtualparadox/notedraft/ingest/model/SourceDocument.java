package eu.virtualparadox.notedraft.ingest.model;

import java.time.Instant;
import java.util.List;

/**
 * An uploaded document together with its chunks. Instances are immutable; a
 * classification correction produces a new instance through {@link #withChunks}.
 */
public record SourceDocument(String id,
                             String name,
                             EDocumentKind kind,
                             String rawText,
                             EDocumentType documentType,
                             String episodeDate,
                             Long chronologicalOrder,
                             String episodeId,
                             EDocumentTag tag,
                             Instant addedAt,
                             List<Chunk> chunks,
                             List<String> warnings) {

    public SourceDocument {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public double weight() {
        return documentType.weight();
    }

    public SourceDocument withChunks(final EDocumentType type,
                                     final String date,
                                     final Long order,
                                     final List<Chunk> newChunks) {
        return new SourceDocument(id, name, kind, rawText, type, date, order, episodeId, tag, addedAt,
                newChunks, warnings);
    }

    public SourceDocument withEpisodeId(final String newEpisodeId) {
        return new SourceDocument(id, name, kind, rawText, documentType, episodeDate, chronologicalOrder,
                newEpisodeId, tag, addedAt, chunks, warnings);
    }
}
