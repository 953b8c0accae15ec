package eu.virtualparadox.notedraft.rag.schedule;

import eu.virtualparadox.notedraft.ingest.model.Chunk;
import eu.virtualparadox.notedraft.rag.generate.CancellationToken;
import eu.virtualparadox.notedraft.rag.generate.GenerationEvent;
import eu.virtualparadox.notedraft.rag.generate.GenerationOptions;
import eu.virtualparadox.notedraft.rag.generate.SectionSpec;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.util.List;

/**
 * One section generation as seen by the scheduler. Events are buffered until the
 * first subscriber arrives and the stream completes when the job ends.
 */
public class GenerationJob {

    private final String targetId;
    private final EJobKind kind;
    private final SectionSpec section;
    private final List<Chunk> evidence;
    private final GenerationOptions options;
    private final String updateLabel;
    private final Instant createdAt;
    private final Sinks.Many<GenerationEvent> events = Sinks.many().multicast().onBackpressureBuffer();

    private volatile EJobStatus status;
    private volatile String message;
    private final CancellationToken token = new CancellationToken();

    public GenerationJob(final EJobKind kind,
                         final SectionSpec section,
                         final List<Chunk> evidence,
                         final GenerationOptions options,
                         final String updateLabel) {
        this.targetId = section.id();
        this.kind = kind;
        this.section = section;
        this.evidence = List.copyOf(evidence);
        this.options = options;
        this.updateLabel = updateLabel;
        this.status = EJobStatus.QUEUED;
        this.createdAt = Instant.now();
    }

    public static GenerationJob full(final SectionSpec section, final List<Chunk> evidence,
                                     final GenerationOptions options) {
        return new GenerationJob(EJobKind.FULL, section, evidence, options, null);
    }

    public static GenerationJob update(final SectionSpec section, final List<Chunk> evidence,
                                       final GenerationOptions options, final String label) {
        return new GenerationJob(EJobKind.UPDATE, section, evidence, options, label);
    }

    public String getTargetId() { return targetId; }
    public EJobKind getKind() { return kind; }
    public SectionSpec getSection() { return section; }
    public List<Chunk> getEvidence() { return evidence; }
    public GenerationOptions getOptions() { return options; }
    public String getUpdateLabel() { return updateLabel; }
    public Instant getCreatedAt() { return createdAt; }
    public EJobStatus getStatus() { return status; }
    public String getMessage() { return message; }

    public Flux<GenerationEvent> events() {
        return events.asFlux();
    }

    /**
     * Cancels this job. A queued job ends as cancelled without generating.
     */
    public void cancel() {
        token.cancel();
    }

    CancellationToken getToken() {
        return token;
    }

    void start() {
        this.status = EJobStatus.RUNNING;
    }

    synchronized void emit(final GenerationEvent event) {
        events.tryEmitNext(event);
    }

    synchronized void finish(final EJobStatus finalStatus, final String finalMessage) {
        this.message = finalMessage;
        this.status = finalStatus;
        events.tryEmitComplete();
    }
}
