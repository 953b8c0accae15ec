package eu.virtualparadox.notedraft.rag.schedule;

import eu.virtualparadox.notedraft.rag.generate.Citation;

import java.time.Instant;
import java.util.List;

/**
 * Latest accepted content of a section plus the advisory left by the last failed attempt.
 */
public record SectionDraft(String sectionId, String text, List<Citation> citations, String warning, Instant updatedAt) {

    public SectionDraft {
        text = text == null ? "" : text;
        citations = citations == null ? List.of() : List.copyOf(citations);
    }
}
