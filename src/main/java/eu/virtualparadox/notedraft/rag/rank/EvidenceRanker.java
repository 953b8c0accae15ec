package eu.virtualparadox.notedraft.rag.rank;

import eu.virtualparadox.notedraft.ingest.model.Chunk;

import java.util.List;

/**
 * Selects the chunks most relevant to a query.
 */
public interface EvidenceRanker {

    /**
     * @param query   free text (section topic, question or edit request)
     * @param chunks  candidate pool, read-only
     * @param limit   maximum number of chunks returned
     * @param options selection options
     * @return ordered, duplicate-free selection of at most {@code limit} chunks
     */
    List<Chunk> rank(String query, List<Chunk> chunks, int limit, RankOptions options);
}
