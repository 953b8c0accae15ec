package eu.virtualparadox.notedraft.rag.rank;

import eu.virtualparadox.notedraft.application.config.ApplicationConfig;
import eu.virtualparadox.notedraft.ingest.model.Chunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for evidence selection.
 *
 * <p>The lexical selection is always computed first. When a {@link SemanticRanker}
 * is available it is then given a chance to replace that selection; its result is
 * only adopted when non-empty, and any exception it throws is logged and ignored.</p>
 */
@Slf4j
@Service
public class EvidenceSelector {

    private final WeightedLexicalRanker weightedRanker;
    private final DiversityLexicalRanker diversityRanker;
    private final Optional<SemanticRanker> semanticRanker;
    private final ApplicationConfig config;

    public EvidenceSelector(final WeightedLexicalRanker weightedRanker,
                            final DiversityLexicalRanker diversityRanker,
                            final Optional<SemanticRanker> semanticRanker,
                            final ApplicationConfig config) {
        this.weightedRanker = weightedRanker;
        this.diversityRanker = diversityRanker;
        this.semanticRanker = semanticRanker;
        this.config = config;
    }

    public List<Chunk> select(final String query, final List<Chunk> pool, final int limit, final RankOptions options) {
        return select(query, pool, limit, config.getRanking().getStrategy(), options);
    }

    public List<Chunk> select(final String query,
                              final List<Chunk> pool,
                              final int limit,
                              final ERankingStrategy strategy,
                              final RankOptions options) {
        final EvidenceRanker lexical = strategy == ERankingStrategy.DIVERSITY ? diversityRanker : weightedRanker;
        final List<Chunk> lexicalResult = lexical.rank(query, pool, limit, options);

        if (semanticRanker.isEmpty() || !config.getRanking().isSemanticEnabled()) {
            return lexicalResult;
        }
        try {
            final List<Chunk> semanticResult = semanticRanker.get().rank(query, pool, limit, options);
            if (semanticResult != null && !semanticResult.isEmpty()) {
                return semanticResult;
            }
            log.debug("Semantic ranking returned nothing for '{}', keeping lexical selection", query);
        }
        catch (RuntimeException e) {
            log.warn("Semantic ranking failed, keeping lexical selection: {}", e.getMessage());
        }
        return lexicalResult;
    }

    /**
     * Default selection size, see {@code notedraft.ranking.evidence-limit}.
     */
    public int defaultLimit() {
        return config.getRanking().getEvidenceLimit();
    }
}
