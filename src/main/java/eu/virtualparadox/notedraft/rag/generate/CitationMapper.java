package eu.virtualparadox.notedraft.rag.generate;

import eu.virtualparadox.notedraft.ingest.model.Chunk;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Resolves raw citations against the evidence that was actually sent to the model.
 * Ids are matched exactly, then case-insensitively; anything else is dropped.
 * The result holds one citation per chunk, in first-seen order.
 */
@Slf4j
@Component
public class CitationMapper {

    static final int MAX_EXCERPT = 200;
    static final int FALLBACK_EXCERPT = 180;

    public List<Citation> map(final List<RawCitation> raw, final List<Chunk> evidence) {
        if (raw == null || raw.isEmpty() || evidence == null || evidence.isEmpty()) {
            return List.of();
        }
        final Map<String, Chunk> byId = new HashMap<>();
        final Map<String, Chunk> byLowerId = new HashMap<>();
        for (Chunk chunk : evidence) {
            byId.putIfAbsent(chunk.id(), chunk);
            byLowerId.putIfAbsent(chunk.id().toLowerCase(Locale.ROOT), chunk);
        }

        final List<Citation> citations = new ArrayList<>();
        final Set<String> seen = new HashSet<>();
        for (RawCitation citation : raw) {
            final String id = normalizeId(citation.chunkId());
            Chunk chunk = byId.get(id);
            if (chunk == null) {
                chunk = byLowerId.get(id.toLowerCase(Locale.ROOT));
            }
            if (chunk == null) {
                log.debug("Dropping citation to unknown chunk '{}'", citation.chunkId());
                continue;
            }
            if (!seen.add(chunk.id())) {
                continue;
            }
            String excerpt = cleanExcerpt(citation.excerpt());
            if (excerpt.isEmpty()) {
                excerpt = fallbackExcerpt(chunk.text());
            }
            citations.add(new Citation(chunk.sourceId(), chunk.sourceName(), chunk.id(), excerpt));
        }
        return citations;
    }

    static String normalizeId(final String id) {
        return StringUtils.defaultString(id).trim().replaceAll("^[\\[\"'\\s]+|[\\]\"'\\s]+$", "");
    }

    static String cleanExcerpt(final String excerpt) {
        final String stripped = StringUtils.defaultString(excerpt).trim()
                .replaceAll("^[\"'“”]+|[\"'“”]+$", "")
                .replaceAll("\\s+", " ")
                .trim();
        return StringUtils.abbreviate(stripped, "…", MAX_EXCERPT);
    }

    /**
     * First sentence of the chunk that says something (more than 20 characters).
     */
    static String fallbackExcerpt(final String chunkText) {
        final String text = StringUtils.defaultString(chunkText).replaceAll("\\s+", " ").trim();
        String sentence = text;
        for (String candidate : text.split("(?<=[.!?])\\s+")) {
            if (candidate.trim().length() > 20) {
                sentence = candidate.trim();
                break;
            }
        }
        if (sentence.length() <= FALLBACK_EXCERPT) {
            return sentence;
        }
        return sentence.substring(0, FALLBACK_EXCERPT).trim() + "…";
    }
}
