package eu.virtualparadox.notedraft.ingest.chunker;

/**
 * Sliding window geometry.
 *
 * @param windowSize maximum chunk length in characters (must be {@code > 0})
 * @param overlap    characters shared by consecutive chunks ({@code 0 <= overlap < windowSize})
 */
public record ChunkingConfig(int windowSize, int overlap) {

    public static final ChunkingConfig STANDARD = new ChunkingConfig(1200, 200);
    public static final ChunkingConfig FRAGMENT = new ChunkingConfig(650, 120);

    public ChunkingConfig {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be positive");
        }
        if (overlap < 0 || overlap >= windowSize) {
            throw new IllegalArgumentException("overlap must be non-negative and less than windowSize");
        }
    }
}
