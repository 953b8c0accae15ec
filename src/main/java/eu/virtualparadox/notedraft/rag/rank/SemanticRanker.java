package eu.virtualparadox.notedraft.rag.rank;

import eu.virtualparadox.notedraft.ingest.model.Chunk;
import eu.virtualparadox.notedraft.rag.embed.EmbeddingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.util.VectorUtil;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ranks chunks by cosine similarity between query and chunk embeddings.
 * Chunk vectors are cached by chunk id and text, so a batch of sections over the
 * same document set embeds each chunk once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "notedraft.ranking", name = "semantic-enabled", havingValue = "true")
public class SemanticRanker implements EvidenceRanker {

    private final EmbeddingService embeddingService;
    private final Map<String, float[]> cache = new ConcurrentHashMap<>();

    @Override
    public List<Chunk> rank(final String query, final List<Chunk> chunks, final int limit, final RankOptions options) {
        if (query == null || query.isBlank() || chunks == null || chunks.isEmpty() || limit <= 0) {
            return List.of();
        }
        final float[] queryVector = embeddingService.embedQuery(query);
        final List<float[]> vectors = vectorsFor(chunks);

        final List<ScoredChunk> ranked = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            final float similarity = VectorUtil.cosine(queryVector, vectors.get(i));
            ranked.add(new ScoredChunk(chunks.get(i), similarity > 0, similarity, i));
        }
        ranked.sort(ScoredChunk.BY_SCORE);

        List<ScoredChunk> picks = ranked.stream().filter(ScoredChunk::matched).limit(limit).toList();
        if (options != null && options.includeUnmatchedSources()) {
            picks = SourceCoverage.ensure(picks, ranked, limit);
        }
        return picks.stream().map(ScoredChunk::chunk).toList();
    }

    private List<float[]> vectorsFor(final List<Chunk> chunks) {
        final List<String> missingTexts = new ArrayList<>();
        final List<String> missingKeys = new ArrayList<>();
        for (Chunk chunk : chunks) {
            final String key = key(chunk);
            if (!cache.containsKey(key) && !missingKeys.contains(key)) {
                missingKeys.add(key);
                missingTexts.add(chunk.text());
            }
        }
        if (!missingTexts.isEmpty()) {
            log.debug("Embedding {} new chunks", missingTexts.size());
            final List<float[]> embedded = embeddingService.embed(missingTexts);
            for (int i = 0; i < missingKeys.size(); i++) {
                cache.put(missingKeys.get(i), embedded.get(i));
            }
        }
        return chunks.stream().map(c -> cache.get(key(c))).toList();
    }

    private static String key(final Chunk chunk) {
        return chunk.id() + "#" + chunk.text().hashCode();
    }
}
