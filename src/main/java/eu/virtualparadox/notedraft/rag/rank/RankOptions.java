package eu.virtualparadox.notedraft.rag.rank;

/**
 * @param includeUnmatchedSources surface at least one chunk of every source, even below the score cutoff
 * @param historyBoost            favour document types that usually carry the history of present illness
 */
public record RankOptions(boolean includeUnmatchedSources, boolean historyBoost) {

    public static final RankOptions DEFAULT = new RankOptions(false, false);

    public static RankOptions coverAllSources() {
        return new RankOptions(true, false);
    }
}
