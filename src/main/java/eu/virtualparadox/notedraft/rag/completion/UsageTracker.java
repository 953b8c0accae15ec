package eu.virtualparadox.notedraft.rag.completion;

import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Cumulative token counters across all model calls of the application.
 */
@Component
public class UsageTracker {

    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong promptTokens = new AtomicLong();
    private final AtomicLong completionTokens = new AtomicLong();

    public void record(final ChatResponse response) {
        requests.incrementAndGet();
        if (response == null || response.getMetadata() == null) {
            return;
        }
        final Usage usage = response.getMetadata().getUsage();
        if (usage == null) {
            return;
        }
        if (usage.getPromptTokens() != null) {
            promptTokens.addAndGet(usage.getPromptTokens());
        }
        if (usage.getCompletionTokens() != null) {
            completionTokens.addAndGet(usage.getCompletionTokens());
        }
    }

    public UsageSnapshot snapshot() {
        return new UsageSnapshot(requests.get(), promptTokens.get(), completionTokens.get());
    }

    public void reset() {
        requests.set(0);
        promptTokens.set(0);
        completionTokens.set(0);
    }
}
