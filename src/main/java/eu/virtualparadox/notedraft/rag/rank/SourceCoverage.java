package eu.virtualparadox.notedraft.rag.rank;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Makes sure every source of the candidate pool is represented in a selection,
 * as far as {@code limit} allows. When the selection is full, the lowest ranked
 * pick of a source holding more than one pick gives way.
 */
final class SourceCoverage {

    private SourceCoverage() {
    }

    /**
     * @param picks  current selection, ordered by rank
     * @param ranked whole pool ordered by rank
     * @param limit  selection bound
     * @return new selection; added chunks follow the existing picks
     */
    static List<ScoredChunk> ensure(final List<ScoredChunk> picks,
                                    final List<ScoredChunk> ranked,
                                    final int limit) {
        final List<ScoredChunk> result = new ArrayList<>(picks);
        final Map<String, Integer> perSource = new HashMap<>();
        result.forEach(p -> perSource.merge(p.sourceId(), 1, Integer::sum));

        final Set<String> seen = new LinkedHashSet<>();
        for (ScoredChunk candidate : ranked) {
            if (!seen.add(candidate.sourceId()) || perSource.containsKey(candidate.sourceId())) {
                continue;
            }
            if (result.size() >= limit && !evictSurplus(result, perSource)) {
                break;
            }
            result.add(candidate);
            perSource.put(candidate.sourceId(), 1);
        }
        return result;
    }

    private static boolean evictSurplus(final List<ScoredChunk> result, final Map<String, Integer> perSource) {
        for (int i = result.size() - 1; i >= 0; i--) {
            final String source = result.get(i).sourceId();
            if (perSource.get(source) > 1) {
                result.remove(i);
                perSource.merge(source, -1, Integer::sum);
                return true;
            }
        }
        return false;
    }
}
