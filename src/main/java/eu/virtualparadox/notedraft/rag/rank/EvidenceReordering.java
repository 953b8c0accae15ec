package eu.virtualparadox.notedraft.rag.rank;

import eu.virtualparadox.notedraft.ingest.model.Chunk;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Stable post-ranking passes. Both keep relative order inside the groups they
 * form and can be chained in either order.
 */
public final class EvidenceReordering {

    private EvidenceReordering() {
        // Prevent instantiation
    }

    /**
     * Moves the first chunk of every distinct source to the front so each source
     * shows up early, before any truncation of the evidence block.
     */
    public static List<Chunk> bySourceCoverage(final List<Chunk> selection) {
        final List<Chunk> leaders = new ArrayList<>();
        final List<Chunk> rest = new ArrayList<>();
        final Set<String> seen = new HashSet<>();
        for (Chunk chunk : selection) {
            if (seen.add(chunk.sourceId())) {
                leaders.add(chunk);
            } else {
                rest.add(chunk);
            }
        }
        leaders.addAll(rest);
        return leaders;
    }

    /**
     * Moves every chunk of the given sources to the front.
     *
     * @param prioritySourceIds ids of the documents to favour, e.g. newly added updates
     */
    public static List<Chunk> byPrioritySources(final List<Chunk> selection,
                                                final Collection<String> prioritySourceIds) {
        if (prioritySourceIds == null || prioritySourceIds.isEmpty()) {
            return new ArrayList<>(selection);
        }
        final Set<String> priority = new HashSet<>(prioritySourceIds);
        final List<Chunk> first = new ArrayList<>();
        final List<Chunk> rest = new ArrayList<>();
        for (Chunk chunk : selection) {
            (priority.contains(chunk.sourceId()) ? first : rest).add(chunk);
        }
        first.addAll(rest);
        return first;
    }
}
