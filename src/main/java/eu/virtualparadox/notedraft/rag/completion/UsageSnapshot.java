package eu.virtualparadox.notedraft.rag.completion;

public record UsageSnapshot(long requests, long promptTokens, long completionTokens) {

    public long totalTokens() {
        return promptTokens + completionTokens;
    }
}
