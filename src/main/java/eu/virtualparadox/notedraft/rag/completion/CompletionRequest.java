package eu.virtualparadox.notedraft.rag.completion;

/**
 * Vendor-neutral completion request.
 *
 * @param model           model name understood by the backing service
 * @param instructions    system-level instructions
 * @param input           user content (task plus evidence)
 * @param responseSchema  JSON shape the answer must follow, {@code null} for free text
 * @param maxOutputTokens output token cap
 * @param stream          whether the caller wants incremental deltas
 */
public record CompletionRequest(String model,
                                String instructions,
                                String input,
                                String responseSchema,
                                int maxOutputTokens,
                                boolean stream) {

    public boolean expectsJson() {
        return responseSchema != null;
    }

    public CompletionRequest withoutStreaming() {
        return new CompletionRequest(model, instructions, input, responseSchema, maxOutputTokens, false);
    }
}
