package eu.virtualparadox.notedraft.rag.rank;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Weighted lexical scoring with a source round: the best chunk of every source is
 * taken first, then the remaining slots are filled strictly by score. A single long
 * document therefore cannot crowd the others out.
 */
@Service
public class DiversityLexicalRanker extends LexicalRanker {

    @Override
    protected List<ScoredChunk> select(final List<ScoredChunk> ranked, final int limit, final RankOptions options) {
        final List<ScoredChunk> picks = new ArrayList<>();
        final Set<String> sources = new HashSet<>();
        final Set<Integer> used = new HashSet<>();

        for (ScoredChunk candidate : ranked) {
            if (picks.size() >= limit) {
                break;
            }
            if (candidate.matched() && sources.add(candidate.sourceId())) {
                picks.add(candidate);
                used.add(candidate.position());
            }
        }

        for (ScoredChunk candidate : ranked) {
            if (picks.size() >= limit || !candidate.matched()) {
                break;
            }
            if (used.add(candidate.position())) {
                picks.add(candidate);
            }
        }
        return picks;
    }
}
