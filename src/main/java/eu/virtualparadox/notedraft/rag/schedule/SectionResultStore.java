package eu.virtualparadox.notedraft.rag.schedule;

import eu.virtualparadox.notedraft.rag.generate.Citation;
import eu.virtualparadox.notedraft.rag.generate.GenerationResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory hand-off point for section content. The scheduler writes here only
 * through {@link InFlightRegistry#commit}; failures never erase accepted text.
 */
@Component
public class SectionResultStore {

    private final Map<String, SectionDraft> drafts = new ConcurrentHashMap<>();

    public Optional<SectionDraft> get(final String sectionId) {
        return Optional.ofNullable(drafts.get(sectionId));
    }

    public Map<String, SectionDraft> snapshot() {
        return Map.copyOf(drafts);
    }

    /**
     * Seeds or overwrites a section with externally edited content.
     */
    public void put(final String sectionId, final String text, final List<Citation> citations) {
        drafts.put(sectionId, new SectionDraft(sectionId, text, citations, null, Instant.now()));
    }

    void apply(final GenerationJob job, final GenerationResult result) {
        if (job.getKind() == EJobKind.UPDATE) {
            appendUpdate(job.getTargetId(), result, job.getUpdateLabel());
        } else {
            put(job.getTargetId(), result.text(), result.citations());
        }
    }

    private void appendUpdate(final String sectionId, final GenerationResult result, final String label) {
        drafts.compute(sectionId, (id, current) -> {
            final String note = (label == null ? "Update" : label) + ": " + result.text();
            if (current == null || current.text().isBlank()) {
                return new SectionDraft(id, note, result.citations(), null, Instant.now());
            }
            final Map<String, Citation> merged = new LinkedHashMap<>();
            current.citations().forEach(c -> merged.put(c.chunkId(), c));
            result.citations().forEach(c -> merged.putIfAbsent(c.chunkId(), c));
            return new SectionDraft(id, current.text().stripTrailing() + "\n\n" + note,
                    new ArrayList<>(merged.values()), null, Instant.now());
        });
    }

    void warn(final String sectionId, final String warning) {
        drafts.compute(sectionId, (id, current) -> current == null
                ? new SectionDraft(id, "", List.of(), warning, Instant.now())
                : new SectionDraft(id, current.text(), current.citations(), warning, current.updatedAt()));
    }
}
