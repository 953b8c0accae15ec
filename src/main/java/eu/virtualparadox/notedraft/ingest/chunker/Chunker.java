package eu.virtualparadox.notedraft.ingest.chunker;

import eu.virtualparadox.notedraft.application.config.ApplicationConfig;
import eu.virtualparadox.notedraft.ingest.model.Chunk;
import eu.virtualparadox.notedraft.ingest.model.EDocumentType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-window text {@code Chunker} producing overlapping, citable chunks.
 *
 * <h2>Overview</h2>
 * <ul>
 *   <li><strong>Normalization:</strong> line endings are unified to {@code \n} and the text is trimmed.
 *       Offsets of produced chunks refer to this normalized text.</li>
 *   <li><strong>Windowing:</strong> a window of {@link ChunkingConfig#windowSize()} characters starts at
 *       offset 0; each following window starts {@link ChunkingConfig#overlap()} characters before the
 *       previous one ended. The last window is clipped to the text length.</li>
 *   <li><strong>Identifiers:</strong> {@code sourceId + "_chunk_" + ordinal}. Identical text and config
 *       always yield identical ids, which is what citation matching relies on.</li>
 *   <li><strong>Configurations:</strong> the standard and the narrower fragment geometry are two
 *       {@link ChunkingConfig} values run through the same loop, selected by {@link EPrivacyMode}.</li>
 * </ul>
 *
 * <h2>Determinism &amp; Thread-safety</h2>
 * Stateless after construction; output depends only on the arguments.
 */
@Component
public class Chunker {

    private final ChunkingConfig standard;
    private final ChunkingConfig fragment;

    public Chunker(final ApplicationConfig config) {
        final ApplicationConfig.Chunking chunking = config.getChunking();
        this.standard = new ChunkingConfig(chunking.getStandardWindow(), chunking.getStandardOverlap());
        this.fragment = new ChunkingConfig(chunking.getFragmentWindow(), chunking.getFragmentOverlap());
    }

    /**
     * Returns the window geometry used for the given privacy mode.
     */
    public ChunkingConfig configFor(final EPrivacyMode mode) {
        return mode == EPrivacyMode.FRAGMENT ? fragment : standard;
    }

    /**
     * Chunks text without document metadata.
     *
     * @see #chunk(String, String, String, ChunkingConfig, EDocumentType, String)
     */
    public List<Chunk> chunk(final String text,
                             final String sourceId,
                             final String sourceName,
                             final ChunkingConfig config) {
        return chunk(text, sourceId, sourceName, config, EDocumentType.OTHER, null);
    }

    /**
     * Splits {@code text} into overlapping windows.
     *
     * @param text         raw document text (non-null, may be blank)
     * @param sourceId     owning document id (non-blank)
     * @param sourceName   owning document name
     * @param config       window geometry
     * @param documentType classification copied onto every chunk
     * @param episodeDate  ISO episode date copied onto every chunk, may be {@code null}
     * @return ordered chunks; empty for blank text
     * @throws IllegalArgumentException if {@code text} is null or {@code sourceId} blank
     */
    public List<Chunk> chunk(final String text,
                             final String sourceId,
                             final String sourceName,
                             final ChunkingConfig config,
                             final EDocumentType documentType,
                             final String episodeDate) {
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("sourceId cannot be null or blank");
        }
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }

        final String normalized = normalize(text);
        final List<Chunk> result = new ArrayList<>();
        if (normalized.isEmpty()) {
            return result;
        }

        final EDocumentType type = documentType == null ? EDocumentType.OTHER : documentType;
        final int len = normalized.length();
        int start = 0;
        int ordinal = 0;
        while (start < len) {
            final int end = Math.min(len, start + config.windowSize());
            result.add(new Chunk(
                    sourceId + "_chunk_" + ordinal++,
                    sourceId,
                    sourceName,
                    normalized.substring(start, end),
                    start,
                    end,
                    type,
                    episodeDate,
                    type.weight()));
            if (end == len) {
                break;
            }
            start = Math.max(0, end - config.overlap());
        }
        return result;
    }

    /**
     * Line-ending normalization shared by chunking and offset consumers.
     */
    public static String normalize(final String text) {
        return text.replace("\r\n", "\n").replace('\r', '\n').trim();
    }
}
