package eu.virtualparadox.notedraft.rag.generate;

import java.util.List;

/**
 * Accepted generator output. Whenever {@code text} is non-empty, {@code citations}
 * is non-empty as well; the generator never hands out anything else.
 *
 * @param text       section prose
 * @param citations  supporting citations, each resolvable to an evidence chunk
 * @param repairStep ladder step that produced the citations
 */
public record GenerationResult(String text, List<Citation> citations, ERepairStep repairStep) {

    public GenerationResult {
        citations = citations == null ? List.of() : List.copyOf(citations);
    }
}
