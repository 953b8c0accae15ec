package eu.virtualparadox.notedraft.rag.completion;

import reactor.core.publisher.Flux;

/**
 * What the generation core needs from a text completion backend: a single
 * completed answer, or the same answer as a stream of text deltas.
 */
public interface CompletionService {

    /**
     * @return the complete answer text, never {@code null}
     * @throws ModelCallException on transport failure
     */
    String complete(CompletionRequest request);

    /**
     * Cold stream of text deltas; concatenated they form the answer. Errors are
     * signalled as {@link ModelCallException}. Cancelling the subscription aborts
     * the underlying request.
     */
    Flux<String> stream(CompletionRequest request);
}
