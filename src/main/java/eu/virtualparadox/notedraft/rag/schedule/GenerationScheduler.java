package eu.virtualparadox.notedraft.rag.schedule;

import eu.virtualparadox.notedraft.application.config.ApplicationConfig;
import eu.virtualparadox.notedraft.application.executor.GenerationExecutor;
import eu.virtualparadox.notedraft.rag.generate.CancellationToken;
import eu.virtualparadox.notedraft.rag.generate.CitationVerifiedGenerator;
import eu.virtualparadox.notedraft.rag.generate.GenerationContext;
import eu.virtualparadox.notedraft.rag.generate.GenerationRejectedException;
import eu.virtualparadox.notedraft.rag.generate.GenerationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Runs generation jobs on the {@link GenerationExecutor}.
 *
 * <p>A batch starts {@code min(maxWorkers, jobs)} workers that keep pulling jobs from a
 * shared queue until it is empty, so one slow section does not hold back a fixed share of
 * the others. Every job ends in exactly one terminal state; a failing job only leaves a
 * warning on its own section. {@link #runAll} returns once all jobs are terminal.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GenerationScheduler {

    private final CitationVerifiedGenerator generator;
    private final InFlightRegistry registry;
    private final SectionResultStore store;
    private final GenerationExecutor executor;
    private final ApplicationConfig config;

    public BatchReport runAll(final List<GenerationJob> jobs) {
        return runAll(jobs, config.getScheduler().getMaxWorkers());
    }

    public BatchReport runAll(final List<GenerationJob> jobs, final int maxWorkers) {
        if (jobs == null || jobs.isEmpty()) {
            return BatchReport.of(List.of());
        }
        final int workers = Math.max(1, Math.min(maxWorkers, jobs.size()));
        log.info("Running {} generation jobs on {} workers", jobs.size(), workers);

        jobs.forEach(this::enqueue);
        final Queue<GenerationJob> queue = new ConcurrentLinkedQueue<>(jobs);
        final List<JobOutcome> outcomes = Collections.synchronizedList(new ArrayList<>());
        final CompletableFuture<?>[] futures = new CompletableFuture<?>[workers];
        for (int i = 0; i < workers; i++) {
            futures[i] = CompletableFuture.runAsync(() -> drain(queue, outcomes), executor);
        }
        CompletableFuture.allOf(futures).join();

        synchronized (outcomes) {
            return BatchReport.of(new ArrayList<>(outcomes));
        }
    }

    /**
     * Runs a single job in the background; follow it through {@link GenerationJob#events()}.
     */
    public GenerationJob submit(final GenerationJob job) {
        enqueue(job);
        executor.execute(() -> execute(job));
        return job;
    }

    public boolean cancel(final String targetId) {
        return registry.cancel(targetId);
    }

    public void cancelAll() {
        registry.cancelAll();
    }

    private void enqueue(final GenerationJob job) {
        registry.begin(job.getTargetId(), job.getToken());
    }

    private void drain(final Queue<GenerationJob> queue, final List<JobOutcome> outcomes) {
        GenerationJob job;
        while ((job = queue.poll()) != null) {
            outcomes.add(execute(job));
        }
    }

    /**
     * Runs one job to a terminal state. Never throws.
     */
    JobOutcome execute(final GenerationJob job) {
        final String targetId = job.getTargetId();
        final CancellationToken token = job.getToken();
        if (!registry.claim(targetId, token)) {
            log.info("Job {} cancelled before it started", targetId);
            registry.finish(targetId, token);
            return finish(job, EJobStatus.CANCELLED, null, "Generation was cancelled.");
        }
        job.start();
        final GenerationContext context = new GenerationContext(targetId, token, job::emit);
        try {
            final GenerationResult result = generator.generate(job.getSection(), job.getEvidence(),
                    job.getOptions(), context);
            if (!registry.commit(targetId, token, () -> store.apply(job, result))) {
                return finish(job, EJobStatus.CANCELLED, null, "Generation was cancelled.");
            }
            return finish(job, EJobStatus.COMPLETED, result, null);
        }
        catch (CancellationException e) {
            log.info("Job {} cancelled", targetId);
            return finish(job, EJobStatus.CANCELLED, null, "Generation was cancelled.");
        }
        catch (GenerationRejectedException e) {
            log.warn("Job {} rejected: {}", targetId, e.getMessage());
            return finishWithWarning(job, token, EJobStatus.REJECTED, e.getMessage());
        }
        catch (RuntimeException e) {
            log.error("Job {} failed", targetId, e);
            return finishWithWarning(job, token, EJobStatus.FAILED,
                    "Generation failed: " + e.getMessage() + " Previous content kept.");
        }
        finally {
            registry.finish(targetId, token);
        }
    }

    private JobOutcome finishWithWarning(final GenerationJob job,
                                         final CancellationToken token,
                                         final EJobStatus status,
                                         final String message) {
        if (!registry.commit(job.getTargetId(), token, () -> store.warn(job.getTargetId(), message))) {
            return finish(job, EJobStatus.CANCELLED, null, "Generation was cancelled.");
        }
        return finish(job, status, null, message);
    }

    private JobOutcome finish(final GenerationJob job,
                              final EJobStatus status,
                              final GenerationResult result,
                              final String message) {
        job.finish(status, message);
        return new JobOutcome(job.getTargetId(), job.getKind(), status, result, message);
    }
}
