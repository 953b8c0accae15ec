package eu.virtualparadox.notedraft.rag.generate;

import eu.virtualparadox.notedraft.ingest.model.Chunk;
import lombok.Builder;

import java.util.List;

/**
 * Per-request generation settings.
 *
 * @param liveDisplay     stream the answer and publish partial text
 * @param context         other sections' text, used to avoid repeating facts
 * @param evidencePool    all chunks the widening step may draw from
 * @param evidenceLimit   size of the original evidence selection
 * @param openQuestions   ask for an open questions block
 * @param extraGuidance   additional instructions, e.g. for update notes
 */
@Builder(toBuilder = true)
public record GenerationOptions(boolean liveDisplay,
                                String context,
                                List<Chunk> evidencePool,
                                int evidenceLimit,
                                boolean openQuestions,
                                String extraGuidance) {

    public GenerationOptions {
        evidencePool = evidencePool == null ? List.of() : evidencePool;
    }

    public static GenerationOptions defaults() {
        return GenerationOptions.builder().evidenceLimit(6).build();
    }
}
