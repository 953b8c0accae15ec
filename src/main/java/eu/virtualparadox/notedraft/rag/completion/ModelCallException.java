package eu.virtualparadox.notedraft.rag.completion;

/**
 * Transport failure of the model service, or an answer that could not be parsed
 * at all. Both are handled the same way by callers.
 */
public class ModelCallException extends RuntimeException {

    public ModelCallException(final String message) {
        super(message);
    }

    public ModelCallException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
