package eu.virtualparadox.notedraft.rag.generate;

/**
 * Item of a generation event stream: a state change, a new partial text or the final result.
 */
public record GenerationEvent(EGenerationEventType type,
                              String targetId,
                              EGenerationState state,
                              String partialText,
                              GenerationResult result) {

    public enum EGenerationEventType {
        STATE,
        PARTIAL_TEXT,
        RESULT
    }

    public static GenerationEvent state(final String targetId, final EGenerationState state) {
        return new GenerationEvent(EGenerationEventType.STATE, targetId, state, null, null);
    }

    public static GenerationEvent partial(final String targetId, final String text) {
        return new GenerationEvent(EGenerationEventType.PARTIAL_TEXT, targetId, EGenerationState.STREAMING_PARTIAL,
                text, null);
    }

    public static GenerationEvent result(final String targetId, final GenerationResult result) {
        return new GenerationEvent(EGenerationEventType.RESULT, targetId, EGenerationState.ACCEPTED, null, result);
    }
}
