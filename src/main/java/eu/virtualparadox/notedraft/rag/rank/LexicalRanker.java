package eu.virtualparadox.notedraft.rag.rank;

import eu.virtualparadox.notedraft.ingest.classifier.EpisodeDateExtractor;
import eu.virtualparadox.notedraft.ingest.model.Chunk;
import eu.virtualparadox.notedraft.ingest.model.EDocumentType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Token-overlap scoring shared by the lexical rankers.
 *
 * <p>A chunk's raw score is the number of its tokens found in the query token set;
 * chunks with a raw score of zero are below the cutoff. The ordering score multiplies
 * the raw score by the document weight and adds a recency bonus of up to
 * {@link #RECENCY_WEIGHT}, scaled between the oldest and newest episode date in the pool.
 * Subclasses decide how the scored pool becomes a selection.</p>
 */
public abstract class LexicalRanker implements EvidenceRanker {

    static final double RECENCY_WEIGHT = 0.35;

    private static final Map<EDocumentType, Double> HISTORY_BOOST = Map.of(
            EDocumentType.DISCHARGE_SUMMARY, 0.5,
            EDocumentType.PSYCH_EVAL, 0.4,
            EDocumentType.BIOPSYCHOSOCIAL, 0.3
    );

    @Override
    public List<Chunk> rank(final String query, final List<Chunk> chunks, final int limit, final RankOptions options) {
        if (chunks == null || chunks.isEmpty() || limit <= 0) {
            return List.of();
        }
        final RankOptions opts = options == null ? RankOptions.DEFAULT : options;
        final Set<String> queryTokens = new HashSet<>(tokenize(query));
        final List<ScoredChunk> ranked;
        List<ScoredChunk> picks;
        if (queryTokens.isEmpty()) {
            // nothing to score against, pool order stands
            ranked = unscored(chunks);
            picks = ranked.subList(0, Math.min(limit, ranked.size()));
        } else {
            ranked = new ArrayList<>(score(queryTokens, chunks, opts));
            ranked.sort(ScoredChunk.BY_SCORE);
            picks = select(ranked, limit, opts);
        }
        if (opts.includeUnmatchedSources()) {
            picks = SourceCoverage.ensure(picks, ranked, limit);
        }
        return picks.stream().map(ScoredChunk::chunk).toList();
    }

    /**
     * @param ranked whole pool ordered by score
     * @return selection ordered by rank, at most {@code limit} entries
     */
    protected abstract List<ScoredChunk> select(List<ScoredChunk> ranked, int limit, RankOptions options);

    private static List<ScoredChunk> unscored(final List<Chunk> chunks) {
        final List<ScoredChunk> result = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            result.add(new ScoredChunk(chunks.get(i), false, 0.0, i));
        }
        return result;
    }

    private List<ScoredChunk> score(final Set<String> queryTokens, final List<Chunk> chunks, final RankOptions options) {
        long min = Long.MAX_VALUE;
        long max = Long.MIN_VALUE;
        final Long[] days = new Long[chunks.size()];
        for (int i = 0; i < chunks.size(); i++) {
            days[i] = EpisodeDateExtractor.toEpochDay(chunks.get(i).episodeDate());
            if (days[i] != null) {
                min = Math.min(min, days[i]);
                max = Math.max(max, days[i]);
            }
        }

        final List<ScoredChunk> result = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            final Chunk chunk = chunks.get(i);
            int raw = 0;
            for (String token : tokenize(chunk.text())) {
                if (queryTokens.contains(token)) {
                    raw++;
                }
            }
            double score = raw * chunk.docWeight();
            if (days[i] != null && max > min) {
                score += RECENCY_WEIGHT * (days[i] - min) / (double) (max - min);
            }
            if (options.historyBoost()) {
                score += HISTORY_BOOST.getOrDefault(chunk.documentType(), 0.0);
            }
            result.add(new ScoredChunk(chunk, raw > 0, score, i));
        }
        return result;
    }

    /**
     * Lowercases, turns everything but letters, digits and whitespace into blanks
     * and keeps tokens longer than two characters.
     */
    static List<String> tokenize(final String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9\\s]", " ").split("\\s+"))
                .filter(t -> t.length() > 2)
                .toList();
    }
}
