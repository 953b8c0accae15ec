package eu.virtualparadox.notedraft.rag.generate;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation handle of one generation. Besides the flag, the token exposes a
 * {@link Mono} that fires on cancel, which in-flight model streams are bound to
 * so they stop right away instead of running to completion.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Sinks.One<Boolean> signal = Sinks.one();

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            signal.tryEmitValue(Boolean.TRUE);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public Mono<Boolean> whenCancelled() {
        return signal.asMono();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("Generation cancelled");
        }
    }
}
