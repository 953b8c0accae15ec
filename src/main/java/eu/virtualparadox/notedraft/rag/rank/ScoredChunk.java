package eu.virtualparadox.notedraft.rag.rank;

import eu.virtualparadox.notedraft.ingest.model.Chunk;

import java.util.Comparator;

/**
 * @param chunk    the chunk
 * @param matched  whether the chunk passed the relevance cutoff
 * @param score    ordering score, higher first
 * @param position index in the candidate pool, used as tie breaker
 */
record ScoredChunk(Chunk chunk, boolean matched, double score, int position) {

    static final Comparator<ScoredChunk> BY_SCORE = Comparator
            .comparingDouble(ScoredChunk::score).reversed()
            .thenComparingInt(ScoredChunk::position);

    String sourceId() {
        return chunk.sourceId();
    }
}
