package eu.virtualparadox.notedraft.rag.generate;

import eu.virtualparadox.notedraft.ingest.model.Chunk;
import eu.virtualparadox.notedraft.rag.completion.CompletionRequest;
import eu.virtualparadox.notedraft.rag.completion.CompletionService;
import eu.virtualparadox.notedraft.rag.completion.ModelCallException;
import eu.virtualparadox.notedraft.rag.rank.EvidenceSelector;
import eu.virtualparadox.notedraft.rag.rank.RankOptions;
import eu.virtualparadox.notedraft.rag.stream.PartialTextTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drafts one section and refuses to hand out text without citations.
 *
 * <h2>Protocol</h2>
 * <ol>
 *   <li>Request the section as JSON ({@code text} plus {@code citations}) with the evidence
 *       serialized by {@link PromptBuilder}. With live display the answer is streamed and the
 *       partially decoded {@code text} is published as it grows.</li>
 *   <li>Validate: the text must be non-empty and at least one citation must resolve to a chunk
 *       of the evidence. Citations to anything else are dropped.</li>
 *   <li>On failure walk the repair ladder, first success wins:
 *     <ol type="a">
 *       <li>chunk ids written inline in the generated text,</li>
 *       <li>a recovery call asking for citations of the text as written,</li>
 *       <li>a regeneration with a prompt that forbids uncited claims,</li>
 *       <li>a regeneration over about twice as much evidence, with citation-bound guidance.</li>
 *     </ol>
 *   </li>
 *   <li>If nothing works, {@link GenerationRejectedException} is thrown, or the last
 *       {@link ModelCallException} if no attempt reached the model successfully.</li>
 * </ol>
 *
 * <p>States are published through the {@link GenerationContext}. Cancellation aborts a running
 * stream and is checked between steps; it surfaces as {@link java.util.concurrent.CancellationException}.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CitationVerifiedGenerator {

    static final String TEXT_FIELD = "text";

    private final CompletionService completionService;
    private final PromptBuilder promptBuilder;
    private final ModelPayloadParser payloadParser;
    private final CitationMapper citationMapper;
    private final InlineCitationScanner inlineScanner;
    private final EvidenceSelector evidenceSelector;

    /**
     * Outcome of one model round trip: either a payload or the failure that prevented one.
     */
    private record Attempt(ModelPayload payload, ModelCallException failure) {

        boolean hasText() {
            return payload != null && !payload.text().isBlank();
        }
    }

    public GenerationResult generate(final SectionSpec section,
                                     final List<Chunk> evidence,
                                     final GenerationOptions options,
                                     final GenerationContext context) {
        context.state(EGenerationState.IDLE);
        int transportFailures = 0;
        int attempts = 0;

        // initial request
        final Attempt initial = request(promptBuilder.sectionRequest(section, evidence, options,
                EPromptMode.STANDARD, options.liveDisplay()), context);
        attempts++;
        transportFailures += initial.failure() == null ? 0 : 1;
        GenerationResult result = validate(initial, evidence, ERepairStep.NONE, false, context);
        if (result != null) {
            return accept(result, context);
        }

        context.state(EGenerationState.REPAIRING);
        log.info("Section {} came back without usable citations, repairing", section.id());

        if (initial.hasText()) {
            // (a) inline markers
            result = withCitations(initial.payload().text(),
                    inlineScanner.scan(initial.payload().text(), evidence), evidence, ERepairStep.INLINE_MARKERS, context);
            if (result != null) {
                return accept(result, context);
            }

            // (b) recovery call
            context.token().throwIfCancelled();
            try {
                final String recovered = completionService.complete(
                        promptBuilder.recoveryRequest(initial.payload().text(), evidence));
                final ModelPayload payload = payloadParser.parse(recovered);
                result = withCitations(initial.payload().text(), payload.citations(), evidence,
                        ERepairStep.RECOVERY_CALL, context);
                if (result != null) {
                    return accept(result, context);
                }
            }
            catch (ModelCallException e) {
                log.warn("Citation recovery for section {} failed: {}", section.id(), e.getMessage());
            }
        }

        // (c) strict regeneration
        context.token().throwIfCancelled();
        final Attempt strict = request(promptBuilder.sectionRequest(section, evidence, options,
                EPromptMode.STRICT, false), context);
        attempts++;
        transportFailures += strict.failure() == null ? 0 : 1;
        result = validate(strict, evidence, ERepairStep.STRICT_RETRY, true, context);
        if (result != null) {
            return accept(result, context);
        }

        // (d) widened evidence
        context.token().throwIfCancelled();
        final List<Chunk> widened = widen(section, evidence, options);
        log.debug("Section {}: retrying with {} instead of {} evidence chunks", section.id(), widened.size(),
                evidence.size());
        final Attempt wide = request(promptBuilder.sectionRequest(section, widened, options,
                EPromptMode.CITATION_BOUND, false), context);
        attempts++;
        transportFailures += wide.failure() == null ? 0 : 1;
        result = validate(wide, widened, ERepairStep.WIDENED_EVIDENCE, true, context);
        if (result != null) {
            return accept(result, context);
        }

        context.state(EGenerationState.REJECTED);
        if (transportFailures == attempts && wide.failure() != null) {
            throw wide.failure();
        }
        throw new GenerationRejectedException(section.id(),
                "Could not produce a cited draft for \"" + section.title() + "\"; previous content kept.");
    }

    /**
     * Sends one request. Streamed answers that cannot be parsed are asked for once more
     * without streaming before the attempt counts as failed.
     */
    private Attempt request(final CompletionRequest request, final GenerationContext context) {
        context.token().throwIfCancelled();
        context.state(EGenerationState.REQUESTING);
        try {
            if (!request.stream()) {
                return new Attempt(payloadParser.parse(completionService.complete(request)), null);
            }
            final String streamed = stream(request, context);
            try {
                return new Attempt(payloadParser.parse(streamed), null);
            }
            catch (MalformedPayloadException e) {
                log.warn("Streamed answer for {} was not parseable, retrying without streaming", context.targetId());
                context.token().throwIfCancelled();
                return new Attempt(payloadParser.parse(completionService.complete(request.withoutStreaming())), null);
            }
        }
        catch (ModelCallException e) {
            log.warn("Model request for {} failed: {}", context.targetId(), e.getMessage());
            return new Attempt(null, e);
        }
    }

    private String stream(final CompletionRequest request, final GenerationContext context) {
        final PartialTextTracker tracker = new PartialTextTracker(TEXT_FIELD);
        final boolean[] streaming = {false};
        completionService.stream(request)
                .takeUntilOther(context.token().whenCancelled())
                .doOnNext(delta -> {
                    final String partial = tracker.accept(delta);
                    if (partial != null) {
                        if (!streaming[0]) {
                            streaming[0] = true;
                            context.state(EGenerationState.STREAMING_PARTIAL);
                        }
                        context.partial(partial);
                    }
                })
                .blockLast();
        context.token().throwIfCancelled();
        return tracker.content();
    }

    /**
     * @param scanInline also accept inline chunk markers, used for the regeneration steps
     * @return an acceptable result, or {@code null}
     */
    private GenerationResult validate(final Attempt attempt,
                                      final List<Chunk> evidence,
                                      final ERepairStep step,
                                      final boolean scanInline,
                                      final GenerationContext context) {
        if (!attempt.hasText()) {
            context.state(EGenerationState.VALIDATING);
            return null;
        }
        final String text = attempt.payload().text();
        final List<RawCitation> raw = new ArrayList<>(attempt.payload().citations());
        if (scanInline) {
            raw.addAll(inlineScanner.scan(text, evidence));
        }
        return withCitations(text, raw, evidence, step, context);
    }

    private GenerationResult withCitations(final String rawText,
                                           final List<RawCitation> raw,
                                           final List<Chunk> evidence,
                                           final ERepairStep step,
                                           final GenerationContext context) {
        context.state(EGenerationState.VALIDATING);
        final String text = inlineScanner.strip(rawText);
        if (text.isBlank()) {
            return null;
        }
        final List<Citation> citations = citationMapper.map(raw, evidence);
        if (citations.isEmpty()) {
            return null;
        }
        return new GenerationResult(text, citations, step);
    }

    /**
     * Original evidence first, then further chunks of the pool, up to twice the original limit.
     */
    private List<Chunk> widen(final SectionSpec section, final List<Chunk> evidence, final GenerationOptions options) {
        final List<Chunk> pool = options.evidencePool();
        if (pool.isEmpty()) {
            return evidence;
        }
        final int baseLimit = Math.max(options.evidenceLimit(), evidence.size());
        final int limit = Math.min(pool.size(), Math.max(1, baseLimit * 2));
        final List<Chunk> more = evidenceSelector.select(section.rankingQuery(), pool, limit,
                RankOptions.coverAllSources());

        final Map<String, Chunk> merged = new LinkedHashMap<>();
        evidence.forEach(c -> merged.put(c.id(), c));
        for (Chunk chunk : more) {
            if (merged.size() >= limit) {
                break;
            }
            merged.putIfAbsent(chunk.id(), chunk);
        }
        return new ArrayList<>(merged.values());
    }

    private GenerationResult accept(final GenerationResult result, final GenerationContext context) {
        context.token().throwIfCancelled();
        context.state(EGenerationState.ACCEPTED);
        context.result(result);
        log.info("Section {} accepted with {} citations ({})", context.targetId(), result.citations().size(),
                result.repairStep());
        return result;
    }
}
