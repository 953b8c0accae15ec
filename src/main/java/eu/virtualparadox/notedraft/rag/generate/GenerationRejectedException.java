package eu.virtualparadox.notedraft.rag.generate;

/**
 * Every repair step failed to produce a cited result. Callers keep the previous
 * section content and show the message as a warning.
 */
public class GenerationRejectedException extends RuntimeException {

    private final String targetId;

    public GenerationRejectedException(final String targetId, final String message) {
        super(message);
        this.targetId = targetId;
    }

    public String getTargetId() {
        return targetId;
    }
}
