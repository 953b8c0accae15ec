package eu.virtualparadox.notedraft.rag.embed;

import java.util.List;

/**
 * Computes dense, L2-normalized vector embeddings.
 */
public interface EmbeddingService {

    /**
     * Embeds the given texts.
     *
     * @param texts texts to embed
     * @return one vector per text, in input order
     */
    List<float[]> embed(List<String> texts);

    /**
     * Embeds a single query string.
     *
     * @param text the query string (non-null, non-blank)
     * @return a dense vector representation of the query
     */
    default float[] embedQuery(final String text) {
        return embed(List.of(text)).get(0);
    }
}
