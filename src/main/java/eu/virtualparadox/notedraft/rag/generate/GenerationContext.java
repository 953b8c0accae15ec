package eu.virtualparadox.notedraft.rag.generate;

import java.util.function.Consumer;

/**
 * Binds one generator run to its target, its cancellation token and the
 * consumer of its events.
 */
public class GenerationContext {

    private final String targetId;
    private final CancellationToken token;
    private final Consumer<GenerationEvent> events;

    public GenerationContext(final String targetId,
                             final CancellationToken token,
                             final Consumer<GenerationEvent> events) {
        this.targetId = targetId;
        this.token = token;
        this.events = events;
    }

    /**
     * Context for a one-off call nobody listens to.
     */
    public static GenerationContext detached(final String targetId) {
        return new GenerationContext(targetId, new CancellationToken(), event -> { });
    }

    public String targetId() {
        return targetId;
    }

    public CancellationToken token() {
        return token;
    }

    void state(final EGenerationState state) {
        events.accept(GenerationEvent.state(targetId, state));
    }

    void partial(final String text) {
        events.accept(GenerationEvent.partial(targetId, text));
    }

    void result(final GenerationResult result) {
        events.accept(GenerationEvent.result(targetId, result));
    }
}
