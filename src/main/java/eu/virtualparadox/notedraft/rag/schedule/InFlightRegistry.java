package eu.virtualparadox.notedraft.rag.schedule;

import eu.virtualparadox.notedraft.rag.generate.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tracks the single live generation per target.
 *
 * <p>{@link #begin} installs a job's token as soon as the job is queued and cancels the one
 * it replaces, so a queued job can be cancelled before a worker picks it up. A worker
 * {@link #claim claims} the target before generating. {@link #commit} runs the result write
 * while holding the target's map entry, and only if the caller's token is still the installed
 * one and not cancelled. A cancel that happens before the commit therefore always wins.</p>
 */
@Slf4j
@Component
public class InFlightRegistry {

    private final Map<String, CancellationToken> inFlight = new ConcurrentHashMap<>();

    public CancellationToken begin(final String targetId, final CancellationToken token) {
        final CancellationToken previous = inFlight.put(targetId, token);
        if (previous != null && previous != token) {
            log.info("Superseding in-flight generation of {}", targetId);
            previous.cancel();
        }
        return token;
    }

    /**
     * Confirms that {@code token} may generate for the target, installing it when the target
     * is free.
     *
     * @return false if the token was cancelled or a newer one owns the target
     */
    public boolean claim(final String targetId, final CancellationToken token) {
        if (token.isCancelled()) {
            return false;
        }
        final CancellationToken owner = inFlight.compute(targetId,
                (id, current) -> current == null ? token : current);
        return owner == token && !token.isCancelled();
    }

    /**
     * @return whether {@code write} ran
     */
    public boolean commit(final String targetId, final CancellationToken token, final Runnable write) {
        final AtomicBoolean written = new AtomicBoolean();
        inFlight.computeIfPresent(targetId, (id, current) -> {
            if (current != token || token.isCancelled()) {
                return current;
            }
            write.run();
            written.set(true);
            return null;
        });
        return written.get();
    }

    /**
     * Releases the target if {@code token} still owns it.
     */
    public void finish(final String targetId, final CancellationToken token) {
        inFlight.remove(targetId, token);
    }

    public boolean cancel(final String targetId) {
        final CancellationToken token = inFlight.remove(targetId);
        if (token == null) {
            return false;
        }
        token.cancel();
        log.info("Cancelled generation of {}", targetId);
        return true;
    }

    public void cancelAll() {
        inFlight.keySet().forEach(this::cancel);
    }

    public boolean isInFlight(final String targetId) {
        return inFlight.containsKey(targetId);
    }
}
