package eu.virtualparadox.notedraft.rag.rank;

import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Plain top-k over the weighted lexical score.
 */
@Service
public class WeightedLexicalRanker extends LexicalRanker {

    @Override
    protected List<ScoredChunk> select(final List<ScoredChunk> ranked, final int limit, final RankOptions options) {
        return ranked.stream()
                .filter(ScoredChunk::matched)
                .limit(limit)
                .toList();
    }
}
