package eu.virtualparadox.notedraft.rag.generate;

import eu.virtualparadox.notedraft.rag.completion.ModelCallException;

/**
 * The model answered, but no JSON object could be recovered from the answer.
 */
public class MalformedPayloadException extends ModelCallException {

    public MalformedPayloadException(final String message) {
        super(message);
    }
}
